package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.infrastructure.scheduler.InMemoryJobScheduler;
import com.engagesphere.booster.infrastructure.web.dto.SchedulerStatusResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/scheduler")
public class SchedulerAdminController {

    private final InMemoryJobScheduler jobScheduler;
    private final CallerResolver callerResolver;

    public SchedulerAdminController(InMemoryJobScheduler jobScheduler, CallerResolver callerResolver) {
        this.jobScheduler = jobScheduler;
        this.callerResolver = callerResolver;
    }

    @GetMapping
    public ResponseEntity<SchedulerStatusResponse> status(
            @RequestHeader(value = CallerResolver.USER_ID_HEADER, required = false) Long callerId
    ) {
        callerResolver.requireAdmin(callerId);
        return ResponseEntity.ok(SchedulerStatusResponse.from(
                jobScheduler.isRunning(), jobScheduler.stats(), jobScheduler.pendingJobIds()));
    }
}
