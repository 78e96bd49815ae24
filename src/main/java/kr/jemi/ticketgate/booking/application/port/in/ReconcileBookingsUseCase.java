package kr.jemi.ticketgate.booking.application.port.in;

public interface ReconcileBookingsUseCase {

    /**
     * @return 이번 패스에서 확정 또는 취소로 정리한 예매 수
     */
    int reconcile();
}
