package kr.jemi.ticketgate.queue.event;

import java.time.LocalDateTime;
import java.util.List;

public record QueueAdmittedEvent(long eventId, List<Long> userIds, LocalDateTime processingDeadline) {
}
