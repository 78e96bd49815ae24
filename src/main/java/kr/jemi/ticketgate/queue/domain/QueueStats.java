package kr.jemi.ticketgate.queue.domain;

public record QueueStats(long eventId, boolean queueEnabled, long waiting, long processing,
                         Integer estimatedWaitMinutes, boolean active) {

    public static QueueStats disabled(long eventId) {
        return new QueueStats(eventId, false, 0, 0, null, false);
    }
}
