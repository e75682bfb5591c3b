package com.engagesphere.booster.infrastructure.web.dto;

import com.engagesphere.booster.domain.model.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record UserResponse(
        Long id,
        String email,
        String name,
        @JsonProperty("job_title") String jobTitle,
        List<String> interests,
        @JsonProperty("preferred_contact_method") String preferredContactMethod,
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("is_admin") boolean admin
) {
    public static UserResponse fromUser(User user) {
        return new UserResponse(
                user.id(),
                user.email(),
                user.name(),
                user.jobTitle(),
                List.copyOf(user.interests()),
                user.preferredContactMethod(),
                user.phoneNumber(),
                user.admin()
        );
    }
}
