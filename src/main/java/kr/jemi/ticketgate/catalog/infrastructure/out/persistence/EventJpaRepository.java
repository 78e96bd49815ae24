package kr.jemi.ticketgate.catalog.infrastructure.out.persistence;

import kr.jemi.ticketgate.catalog.domain.EventStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface EventJpaRepository extends JpaRepository<EventJpaEntity, Long> {

    @Query("select e.id from EventJpaEntity e where e.queueEnabled = true and e.status = :status")
    List<Long> findQueueEnabledIds(@Param("status") EventStatus status);
}
