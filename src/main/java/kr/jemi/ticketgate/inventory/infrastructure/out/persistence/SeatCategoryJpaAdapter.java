package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import kr.jemi.ticketgate.inventory.application.port.out.CategoryCounterPort;
import kr.jemi.ticketgate.inventory.domain.SeatCategory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class SeatCategoryJpaAdapter implements CategoryCounterPort {

    private final SeatCategoryJpaRepository seatCategoryJpaRepository;

    public SeatCategoryJpaAdapter(SeatCategoryJpaRepository seatCategoryJpaRepository) {
        this.seatCategoryJpaRepository = seatCategoryJpaRepository;
    }

    @Override
    public Optional<SeatCategory> findById(long categoryId) {
        return seatCategoryJpaRepository.findById(categoryId).map(SeatCategoryJpaEntity::toDomain);
    }

    @Override
    public List<SeatCategory> findByEventId(long eventId) {
        return seatCategoryJpaRepository.findByEventIdOrderByIdAsc(eventId).stream()
                .map(SeatCategoryJpaEntity::toDomain)
                .toList();
    }

    @Override
    public int countAvailable(long categoryId) {
        Integer available = seatCategoryJpaRepository.countAvailable(categoryId);
        return available == null ? 0 : available;
    }

    @Override
    public boolean tryHold(long categoryId, int quantity) {
        return seatCategoryJpaRepository.hold(categoryId, quantity) == 1;
    }

    @Override
    public boolean release(long categoryId, int quantity) {
        return seatCategoryJpaRepository.release(categoryId, quantity) == 1;
    }

    @Override
    public boolean sell(long categoryId, int quantity) {
        return seatCategoryJpaRepository.sell(categoryId, quantity) == 1;
    }
}
