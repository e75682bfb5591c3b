package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

public record CreateUserRequest(
        @NotBlank @Email String email,
        @NotBlank String name,
        @JsonProperty("job_title") String jobTitle,
        Set<String> interests,
        @JsonProperty("preferred_contact_method") String preferredContactMethod,
        @JsonProperty("phone_number") String phoneNumber
) {
    public User toUser() {
        TreeSet<String> normalized = new TreeSet<>();
        if (interests != null) {
            interests.stream()
                    .filter(interest -> interest != null && !interest.isBlank())
                    .map(interest -> interest.trim().toLowerCase(Locale.ROOT))
                    .forEach(normalized::add);
        }
        return new User(null, email.trim().toLowerCase(Locale.ROOT), name, jobTitle, normalized,
                preferredContactMethod, phoneNumber, false);
    }
}
