package kr.jemi.ticketgate.common.validation;

/**
 * 생성자 끝에서 {@link #validateSelf()} 를 호출해 jakarta.validation 제약을 검사하는 도메인 객체.
 * 위반 시 IllegalArgumentException 이 발생한다.
 */
public interface SelfValidating {

    default void validateSelf() {
        ValidationUtils.validate(this);
    }
}
