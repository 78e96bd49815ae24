package kr.jemi.ticketgate.common.dto;

import kr.jemi.ticketgate.common.exception.ErrorCode;

public record ErrorResponse(int status, String code, String message) {

    public static ErrorResponse from(ErrorCode errorCode) {
        return of(errorCode, errorCode.getMessage());
    }

    public static ErrorResponse of(ErrorCode errorCode, String message) {
        return new ErrorResponse(
                errorCode.getStatus().value(),
                errorCode.name(),
                message == null ? errorCode.getMessage() : message
        );
    }
}
