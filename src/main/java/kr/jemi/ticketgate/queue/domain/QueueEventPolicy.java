package kr.jemi.ticketgate.queue.domain;

public record QueueEventPolicy(long eventId, boolean queueEnabled, int batchSize, int processingMinutes,
                               boolean bookingOpen) {
}
