package kr.jemi.ticketgate.cart.infrastructure.out.inventory;

import kr.jemi.ticketgate.cart.application.port.out.CartInventoryPort;
import kr.jemi.ticketgate.cart.domain.CartCategory;
import kr.jemi.ticketgate.cart.domain.CartHold;
import kr.jemi.ticketgate.inventory.api.CategorySnapshot;
import kr.jemi.ticketgate.inventory.api.HoldRequest;
import kr.jemi.ticketgate.inventory.api.HoldView;
import kr.jemi.ticketgate.inventory.api.InventoryFacade;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Component
public class CartInventoryAdapter implements CartInventoryPort {

    private final InventoryFacade inventoryFacade;

    public CartInventoryAdapter(InventoryFacade inventoryFacade) {
        this.inventoryFacade = inventoryFacade;
    }

    @Override
    public CartCategory getCategory(long categoryId) {
        CategorySnapshot category = inventoryFacade.getCategory(categoryId);
        return new CartCategory(category.categoryId(), category.eventId(), category.name(), category.price(),
                category.available());
    }

    @Override
    public CartHold hold(long cartId, long categoryId, int quantity, List<Long> seatIds, LocalDateTime expiresAt) {
        return toCartHold(inventoryFacade.holdForCart(
                new HoldRequest(cartId, categoryId, quantity, seatIds, expiresAt)));
    }

    @Override
    public CartHold resize(long holdId, int quantity) {
        return toCartHold(inventoryFacade.resize(holdId, quantity));
    }

    @Override
    public void release(long holdId) {
        inventoryFacade.release(holdId);
    }

    @Override
    public void releaseCart(long cartId) {
        inventoryFacade.releaseCart(cartId);
    }

    @Override
    public void extend(long cartId, LocalDateTime expiresAt) {
        inventoryFacade.extendCart(cartId, expiresAt);
    }

    @Override
    public List<CartHold> findHolds(Collection<Long> holdIds) {
        if (holdIds.isEmpty()) {
            return List.of();
        }
        return inventoryFacade.findHolds(holdIds).stream()
                .map(this::toCartHold)
                .toList();
    }

    private CartHold toCartHold(HoldView hold) {
        return new CartHold(hold.holdId(), hold.categoryId(), hold.quantity(), hold.seatIds(),
                hold.expiresAt(), hold.active());
    }
}
