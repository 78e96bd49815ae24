package kr.jemi.ticketgate.booking.domain;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import kr.jemi.ticketgate.common.validation.SelfValidating;

public record ContactInfo(
        @NotBlank @Size(max = 100) String name,
        @NotBlank @Email @Size(max = 200) String email,
        @Size(max = 30) String phone
) implements SelfValidating {

    public ContactInfo(String name, String email, String phone) {
        this.name = name;
        this.email = email;
        this.phone = phone;
        validateSelf();
    }
}
