package kr.jemi.ticketgate.cart.domain;

import java.util.List;

/**
 * 결제 진입 전 점검 결과. errors 가 하나라도 있으면 결제를 시작할 수 없고, warnings 는 안내만 한다.
 */
public record CartValidation(long cartId, List<String> errors, List<String> warnings) {

    public CartValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
