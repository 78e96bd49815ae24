package kr.jemi.ticketgate.booking.infrastructure.in.web.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import kr.jemi.ticketgate.booking.application.port.in.BeginCheckoutCommand;
import kr.jemi.ticketgate.booking.domain.ContactInfo;

public record BeginCheckoutRequest(
        @NotBlank(message = "예매자 이름은 필수입니다") @Size(max = 100) String name,
        @NotBlank(message = "이메일은 필수입니다") @Email(message = "이메일 형식이 올바르지 않습니다") String email,
        @Size(max = 30) String phone) {

    public BeginCheckoutCommand toCommand(long userId, long cartId) {
        return new BeginCheckoutCommand(userId, cartId, new ContactInfo(name, email, phone));
    }
}
