package com.engagesphere.booster.infrastructure.web;

import com.engagesphere.booster.application.ManageUsers;
import com.engagesphere.booster.domain.model.User;
import com.engagesphere.booster.infrastructure.scheduler.InMemoryJobScheduler;
import com.engagesphere.booster.infrastructure.scheduler.SchedulerStats;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SchedulerAdminController.class)
@Import(CallerResolver.class)
class SchedulerAdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InMemoryJobScheduler jobScheduler;

    @MockBean
    private ManageUsers manageUsers;

    @Test
    void shouldReportSchedulerStatusToAdmin() throws Exception {
        // Given
        when(manageUsers.findById(1L)).thenReturn(Optional.of(
                new User(1L, "admin@example.com", "Admin", null, Set.of(), "email", null, true)));
        when(jobScheduler.isRunning()).thenReturn(true);
        when(jobScheduler.stats()).thenReturn(new SchedulerStats(2, 10, 6, 2, 1));
        when(jobScheduler.pendingJobIds()).thenReturn(Set.of("start:7:42", "follow_up:7:42"));

        // When & Then
        mockMvc.perform(get("/admin/scheduler").header("X-User-Id", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running", is(true)))
                .andExpect(jsonPath("$.pending", is(2)))
                .andExpect(jsonPath("$.fired", is(6)))
                .andExpect(jsonPath("$.failed", is(1)))
                .andExpect(jsonPath("$.pending_job_ids", contains("follow_up:7:42", "start:7:42")));
    }

    @Test
    void shouldForbidNonAdmin() throws Exception {
        // Given
        when(manageUsers.findById(2L)).thenReturn(Optional.of(
                new User(2L, "ada@example.com", "Ada", null, Set.of(), "email", null, false)));

        // When & Then
        mockMvc.perform(get("/admin/scheduler").header("X-User-Id", 2))
                .andExpect(status().isForbidden());
    }
}
