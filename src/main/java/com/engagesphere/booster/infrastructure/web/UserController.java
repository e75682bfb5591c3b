package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.ManageUsers;
import com.engagesphere.booster.domain.exception.UserNotFoundException;
import com.engagesphere.booster.infrastructure.web.dto.CreateUserRequest;
import com.engagesphere.booster.infrastructure.web.dto.UpdateContactRequest;
import com.engagesphere.booster.infrastructure.web.dto.UserResponse;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    private final ManageUsers manageUsers;

    public UserController(ManageUsers manageUsers) {
        this.manageUsers = manageUsers;
    }

    @PostMapping
    public ResponseEntity<UserResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        logger.info("Creating user {}", request.email());
        var user = manageUsers.create(request.toUser());
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.fromUser(user));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable long userId) {
        var user = manageUsers.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        return ResponseEntity.ok(UserResponse.fromUser(user));
    }

    @PutMapping("/{userId}/contact")
    public ResponseEntity<UserResponse> updateContact(
            @PathVariable long userId,
            @Valid @RequestBody UpdateContactRequest request
    ) {
        var user = manageUsers.updateContact(userId, request.preferredContactMethod(), request.phoneNumber());
        return ResponseEntity.ok(UserResponse.fromUser(user));
    }
}
