package kr.jemi.ticketgate.queue.domain;

public enum QueueStatus {
    WAITING, PROCESSING, COMPLETED, EXPIRED, LEFT;

    public boolean isTerminal() {
        return this != WAITING && this != PROCESSING;
    }
}
