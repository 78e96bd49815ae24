package kr.jemi.ticketgate.booking.application.port.out;

public interface QueueCompletionPort {

    void complete(long eventId, long userId);
}
