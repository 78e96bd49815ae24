package kr.jemi.ticketgate.queue.application.port.out;

public interface QueueSequencePort {

    long next(long eventId);
}
