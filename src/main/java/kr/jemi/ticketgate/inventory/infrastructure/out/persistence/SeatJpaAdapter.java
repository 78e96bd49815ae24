package kr.jemi.ticketgate.inventory.infrastructure.out.persistence;

import kr.jemi.ticketgate.inventory.application.port.out.SeatPort;
import kr.jemi.ticketgate.inventory.domain.Seat;
import kr.jemi.ticketgate.inventory.domain.SeatStatus;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

@Component
public class SeatJpaAdapter implements SeatPort {

    private final SeatJpaRepository seatJpaRepository;

    public SeatJpaAdapter(SeatJpaRepository seatJpaRepository) {
        this.seatJpaRepository = seatJpaRepository;
    }

    @Override
    public List<Seat> findByIds(Collection<Long> seatIds) {
        return seatJpaRepository.findAllById(seatIds).stream()
                .map(SeatJpaEntity::toDomain)
                .toList();
    }

    @Override
    public int hold(long categoryId, Collection<Long> seatIds, long holdId) {
        return seatJpaRepository.hold(categoryId, seatIds, holdId, SeatStatus.AVAILABLE, SeatStatus.HELD);
    }

    @Override
    public int release(long holdId) {
        return seatJpaRepository.release(holdId, SeatStatus.HELD, SeatStatus.AVAILABLE);
    }

    @Override
    public int sell(long holdId) {
        return seatJpaRepository.sell(holdId, SeatStatus.HELD, SeatStatus.SOLD);
    }
}
