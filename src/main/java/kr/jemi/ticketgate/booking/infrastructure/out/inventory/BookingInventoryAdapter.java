package kr.jemi.ticketgate.booking.infrastructure.out.inventory;

import kr.jemi.ticketgate.booking.application.port.out.BookingInventoryPort;
import kr.jemi.ticketgate.inventory.api.InventoryFacade;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
public class BookingInventoryAdapter implements BookingInventoryPort {

    private final InventoryFacade inventoryFacade;

    public BookingInventoryAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public int transferFromCart(long cartId, long bookingId, LocalDateTime expiresAt) {
        return inventoryFacade.transferCartToBooking(cartId, bookingId, expiresAt);
    }

    @Override
    public void sell(long bookingId) {
        inventoryFacade.sellBooking(bookingId);
    }

    @Override
    public void release(long bookingId) {
        inventoryFacade.releaseBooking(bookingId);
    }
}
