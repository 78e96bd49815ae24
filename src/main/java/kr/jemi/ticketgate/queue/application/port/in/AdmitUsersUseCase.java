package kr.jemi.ticketgate.queue.application.port.in;

public interface AdmitUsersUseCase {

    /**
     * @return 이번 배치에서 입장한 인원
     */
    int admitBatch();
}
