package kr.jemi.ticketgate.queue.api;

public interface QueueFacade {

    /**
     * PROCESSING 이고 현재 시각이 입장 기한 이전일 때만 true.
     */
    boolean canProceed(long eventId, long userId);

    /**
     * 입장 권한을 사용 완료 처리한다. 진행 중인 엔트리가 없으면 아무 일도 하지 않는다.
     */
    void complete(long eventId, long userId);
}
