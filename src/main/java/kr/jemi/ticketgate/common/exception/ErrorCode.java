package kr.jemi.ticketgate.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    // catalog
    EVENT_NOT_FOUND(404, "이벤트를 찾을 수 없습니다"),
    BOOKING_WINDOW_CLOSED(409, "예매 가능 기간이 아닙니다"),

    // queue
    QUEUE_NOT_ENABLED(400, "대기열이 운영되지 않는 이벤트입니다"),
    ALREADY_QUEUED(409, "이미 대기열에 진입했습니다"),
    NOT_IN_QUEUE(404, "대기열 정보를 찾을 수 없습니다"),
    ADMISSION_REQUIRED(403, "대기열 입장 후 이용할 수 있습니다"),

    // inventory
    CATEGORY_NOT_FOUND(404, "좌석 등급을 찾을 수 없습니다"),
    INSUFFICIENT_AVAILABILITY(409, "잔여 좌석이 부족합니다"),
    SEAT_UNAVAILABLE(409, "이미 선점되었거나 판매된 좌석이 포함되어 있습니다"),

    // cart
    CART_NOT_FOUND(404, "장바구니를 찾을 수 없습니다"),
    CART_ITEM_NOT_FOUND(404, "장바구니 항목을 찾을 수 없습니다"),
    CART_EXPIRED(410, "장바구니 유효시간이 만료되었습니다. 다시 담아주세요"),
    CART_INVALID(409, "장바구니를 결제할 수 없는 상태입니다"),
    CART_NOT_ACTIVE(409, "사용 중인 장바구니가 아닙니다"),
    CATEGORY_ALREADY_IN_CART(409, "이미 담긴 좌석 등급입니다. 수량을 변경해주세요"),
    MAX_TICKETS_EXCEEDED(409, "1회 예매 가능 매수를 초과했습니다"),
    SEAT_ITEM_QUANTITY_FIXED(400, "지정석은 수량을 변경할 수 없습니다. 삭제 후 다시 담아주세요"),
    FORBIDDEN(403, "접근 권한이 없습니다"),

    // booking
    BOOKING_NOT_FOUND(404, "예매 내역을 찾을 수 없습니다"),
    BOOKING_NOT_PENDING(409, "결제 대기 중인 예매가 아닙니다"),
    PAYMENT_VERIFICATION_FAILED(402, "결제 검증에 실패했습니다. 결제는 완료되지 않았으며 선점한 좌석은 모두 해제되었습니다"),
    TRANSACTION_ALREADY_RESOLVED(409, "이미 처리가 끝난 결제 건입니다"),
    GATEWAY_UNAVAILABLE(503, "결제 서비스에 일시적으로 연결할 수 없습니다. 잠시 후 다시 시도해주세요"),
    INVALID_WEBHOOK_SIGNATURE(401, "웹훅 서명이 올바르지 않습니다"),

    CONCURRENT_REQUEST(409, "다른 요청이 먼저 처리되었습니다. 다시 시도해주세요"),
    INVALID_REQUEST(400, "잘못된 요청입니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
