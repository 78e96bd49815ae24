package kr.jemi.ticketgate.queue.application.port.in;

public interface LeaveQueueUseCase {

    void leave(long eventId, long userId);
}
