package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.CancelRegistration;
import com.engagesphere.booster.application.FindRegistrations;
import com.engagesphere.booster.application.ManageUsers;
import com.engagesphere.booster.application.RegisterForEvent;
import com.engagesphere.booster.domain.exception.AdminRequiredException;
import com.engagesphere.booster.infrastructure.web.dto.ApiError;
import com.engagesphere.booster.infrastructure.web.dto.EventResponse;
import com.engagesphere.booster.infrastructure.web.dto.RegistrationRequest;
import com.engagesphere.booster.infrastructure.web.dto.RegistrationResponse;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/registrations")
public class RegistrationController {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationController.class);

    private final RegisterForEvent registerForEvent;
    private final CancelRegistration cancelRegistration;
    private final FindRegistrations findRegistrations;
    private final ManageUsers manageUsers;
    private final CallerResolver callerResolver;

    public RegistrationController(RegisterForEvent registerForEvent,
                                  CancelRegistration cancelRegistration,
                                  FindRegistrations findRegistrations,
                                  ManageUsers manageUsers,
                                  CallerResolver callerResolver) {
        this.registerForEvent = registerForEvent;
        this.cancelRegistration = cancelRegistration;
        this.findRegistrations = findRegistrations;
        this.manageUsers = manageUsers;
        this.callerResolver = callerResolver;
    }

    @PostMapping
    public ResponseEntity<RegistrationResponse> register(@Valid @RequestBody RegistrationRequest request) {
        var user = manageUsers.findOrCreate(request.user().toUser());
        var result = registerForEvent.register(user, request.eventId());

        logger.info("User {} registered for event {}", user.id(), request.eventId());
        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponse.fromResult(result));
    }

    @DeleteMapping
    public ResponseEntity<?> cancel(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId,
            @RequestParam("user_id") long userId,
            @RequestParam("event_id") long eventId
    ) {
        var caller = callerResolver.require(callerId);
        if (caller.id() != userId && !caller.admin()) {
            logger.warn("User {} tried to cancel the registration of user {}", caller.id(), userId);
            throw new AdminRequiredException();
        }

        if (!cancelRegistration.cancel(userId, eventId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiError.of("REGISTRATION_NOT_FOUND",
                            "User " + userId + " is not registered for event " + eventId));
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/upcoming")
    public ResponseEntity<List<EventResponse>> upcoming(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId
    ) {
        var caller = callerResolver.require(callerId);
        return ResponseEntity.ok(EventResponse.fromEvents(findRegistrations.upcomingFor(caller.id())));
    }
}
