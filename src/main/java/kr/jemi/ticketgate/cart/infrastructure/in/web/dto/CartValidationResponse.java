package kr.jemi.ticketgate.cart.infrastructure.in.web.dto;

import kr.jemi.ticketgate.cart.domain.CartValidation;

import java.util.List;

public record CartValidationResponse(long cartId, boolean valid, List<String> errors, List<String> warnings) {

    public static CartValidationResponse from(CartValidation validation) {
        return new CartValidationResponse(validation.cartId(), validation.valid(), validation.errors(),
                validation.warnings());
    }
}
