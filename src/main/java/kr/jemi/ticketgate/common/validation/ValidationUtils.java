package kr.jemi.ticketgate.common.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bean Validation 제약을 즉시 검사한다. 위반이 있으면 필드 경로 순으로 정렬한 메시지를 담아
 * {@link IllegalArgumentException}을 던진다.
 */
public final class ValidationUtils {

    private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private ValidationUtils() {}

    public static void validate(Object target) {
        Objects.requireNonNull(target, "검증 대상이 null입니다");
        Set<ConstraintViolation<Object>> violations = VALIDATOR.validate(target);
        if (violations.isEmpty()) {
            return;
        }
        String detail = violations.stream()
                .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException(target.getClass().getSimpleName() + " 검증 실패: " + detail);
    }
}
