package com.engagesphere.booster.domain.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Registered attendee. Interests are a derived, lowercase keyword set that
 * grows on every registration.
 */
public record User(
        Long id,
        String email,
        String name,
        String jobTitle,
        Set<String> interests,
        String preferredContactMethod,
        String phoneNumber,
        boolean admin
) {
    public User {
        interests = Collections.unmodifiableSortedSet(interests == null ? new TreeSet<>() : new TreeSet<>(interests));
    }

    public User withInterests(Set<String> newInterests) {
        return new User(id, email, name, jobTitle, newInterests,
                preferredContactMethod, phoneNumber, admin);
    }

    public User withContact(String contactMethod, String phone) {
        return new User(id, email, name, jobTitle, interests, contactMethod, phone, admin);
    }

    public ContactMethod contactMethod() {
        return ContactMethod.fromValue(preferredContactMethod);
    }
}
