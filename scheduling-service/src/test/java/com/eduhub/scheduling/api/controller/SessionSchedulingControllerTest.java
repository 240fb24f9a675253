package com.eduhub.scheduling.api.controller;

import com.eduhub.common.exception.ForbiddenOperationException;
import com.eduhub.common.exception.PersistenceException;
import com.eduhub.common.exception.ValidationException;
import com.eduhub.scheduling.domain.bulk.BulkCancelCommand;
import com.eduhub.scheduling.domain.bulk.BulkCancelService;
import com.eduhub.scheduling.domain.bulk.BulkTransitionResult;
import com.eduhub.scheduling.domain.commit.CommitSummary;
import com.eduhub.scheduling.domain.model.CancelReasonCode;
import com.eduhub.scheduling.domain.recurrence.BookingWindow;
import com.eduhub.scheduling.domain.reset.ResetCommand;
import com.eduhub.scheduling.domain.reset.ScopedResetService;
import com.eduhub.scheduling.domain.service.GenerationCommand;
import com.eduhub.scheduling.domain.service.GenerationReport;
import com.eduhub.scheduling.domain.service.SessionGenerationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionSchedulingController.class)
class SessionSchedulingControllerTest {

    private static final String GENERATE_BODY = """
            {
              "env": "staging",
              "flags": ["--replace-existing-in-range"],
              "termStart": "2026-02-09",
              "termEnd": "2026-06-13",
              "timeZone": "America/Edmonton",
              "rules": [
                {"weekday": 2, "startTime": "18:30", "durationMinutes": 60,
                 "tutorId": "tutor-1", "centerId": "center-1", "groupId": "algebra", "sessionType": "GROUP"}
              ],
              "excludeDates": ["2026-03-17"],
              "dryRun": false
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionGenerationService generationService;

    @MockBean
    private ScopedResetService resetService;

    @MockBean
    private BulkCancelService bulkCancelService;

    @Test
    @DisplayName("POST /generate returns counts and a sample of at most ten conflicts")
    void generate_returnsReport() throws Exception {
        List<String> conflicts = IntStream.range(0, 12).mapToObj(i -> "Overlap " + i).toList();
        when(generationService.generate(any())).thenReturn(report(new CommitSummary(17, 1, 0, conflicts, false)));

        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .header("X-Actor-Id", "ops@center")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.createdCount").value(17))
                .andExpect(jsonPath("$.data.skippedCount").value(1))
                .andExpect(jsonPath("$.data.conflictCount").value(12))
                .andExpect(jsonPath("$.data.sampleConflicts.length()").value(10));

        ArgumentCaptor<GenerationCommand> captor = ArgumentCaptor.forClass(GenerationCommand.class);
        verify(generationService).generate(captor.capture());
        GenerationCommand command = captor.getValue();
        assertThat(command.tenantId()).isEqualTo("tenant-1");
        assertThat(command.actorId()).isEqualTo("ops@center");
        assertThat(command.environment()).isEqualTo("staging");
        assertThat(command.flags()).containsExactly("--replace-existing-in-range");
        assertThat(command.rules()).hasSize(1);
    }

    @Test
    @DisplayName("POST /generate/preview always goes through the preview path")
    void preview_usesPreviewPath() throws Exception {
        when(generationService.preview(any())).thenReturn(report(new CommitSummary(18, 0, 0, List.of(), true)));

        mockMvc.perform(post("/api/v1/sessions/generate/preview")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.dryRun").value(true));

        verify(generationService).preview(any());
        verify(generationService, never()).generate(any());
    }

    @Test
    @DisplayName("Malformed request body is rejected with field errors")
    void generate_invalidBody_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "staging", "termStart": "09/02/2026", "timeZone": "America/Edmonton", "rules": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("Unknown environment reaches the service as typed and its rejection maps to 400")
    void generate_unknownEnv_returns400() throws Exception {
        when(generationService.generate(any()))
                .thenThrow(new ValidationException("Invalid env: prod (expected staging|production)"));

        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY.replace("\"staging\"", "\"prod\"")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ValidationException.ERROR_CODE));

        ArgumentCaptor<GenerationCommand> captor = ArgumentCaptor.forClass(GenerationCommand.class);
        verify(generationService).generate(captor.capture());
        assertThat(captor.getValue().environment()).isEqualTo("prod");
    }

    @Test
    @DisplayName("Null rule entry is a field error, not a server error")
    void generate_nullRule_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "staging", "termStart": "2026-02-09", "termEnd": "2026-06-13",
                                 "timeZone": "America/Edmonton", "rules": [null]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value(ValidationException.ERROR_CODE));

        verifyNoInteractions(generationService);
    }

    @Test
    @DisplayName("Missing tenant header is rejected")
    void generate_missingTenant_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Forbidden production operation maps to 403")
    void generate_forbidden_returns403() throws Exception {
        when(generationService.generate(any()))
                .thenThrow(new ForbiddenOperationException("--replace-existing-in-range is not allowed in production"));

        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.errorCode").value(ForbiddenOperationException.ERROR_CODE));
    }

    @Test
    @DisplayName("Store failure maps to 503")
    void generate_storeDown_returns503() throws Exception {
        when(generationService.generate(any()))
                .thenThrow(new PersistenceException("Session store failed to create sessions", new RuntimeException()));

        mockMvc.perform(post("/api/v1/sessions/generate")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(GENERATE_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value(PersistenceException.ERROR_CODE));
    }

    @Test
    @DisplayName("POST /reset passes the scope and returns the deleted count")
    void reset_returnsDeletedCount() throws Exception {
        when(resetService.reset(any())).thenReturn(18);

        mockMvc.perform(post("/api/v1/sessions/reset")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "staging", "startDate": "2026-02-09", "endDate": "2026-06-13",
                                 "timeZone": "America/Edmonton", "centerIds": ["center-1"], "dryRun": true}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deletedCount").value(18))
                .andExpect(jsonPath("$.data.dryRun").value(true));

        ArgumentCaptor<ResetCommand> captor = ArgumentCaptor.forClass(ResetCommand.class);
        verify(resetService).reset(captor.capture());
        assertThat(captor.getValue().centerIds()).containsExactly("center-1");
        assertThat(captor.getValue().dryRun()).isTrue();
    }

    @Test
    @DisplayName("POST /reset without centers is rejected")
    void reset_withoutCenters_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/reset")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "staging", "startDate": "2026-02-09", "endDate": "2026-06-13",
                                 "timeZone": "America/Edmonton", "centerIds": []}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(resetService);
    }

    @Test
    @DisplayName("POST /bulk-cancel returns requested and cancelled counts")
    void bulkCancel_returnsCounts() throws Exception {
        when(bulkCancelService.bulkTransition(any())).thenReturn(new BulkTransitionResult(4, 3));

        mockMvc.perform(post("/api/v1/sessions/bulk-cancel")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "production", "flags": ["--confirm-prod"],
                                 "sessionIds": ["s-1", "s-2", "s-3", "s-4"], "reasonCode": "WEATHER"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.requestedCount").value(4))
                .andExpect(jsonPath("$.data.canceledCount").value(3));

        ArgumentCaptor<BulkCancelCommand> captor = ArgumentCaptor.forClass(BulkCancelCommand.class);
        verify(bulkCancelService).bulkTransition(captor.capture());
        assertThat(captor.getValue().reasonCode()).isEqualTo(CancelReasonCode.WEATHER);
        assertThat(captor.getValue().environment()).isEqualTo("production");
        assertThat(captor.getValue().flags()).containsExactly("--confirm-prod");
    }

    @Test
    @DisplayName("Unknown cancel reason is rejected")
    void bulkCancel_unknownReason_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/bulk-cancel")
                        .header("X-Tenant-Id", "tenant-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"env": "staging", "sessionIds": ["s-1"], "reasonCode": "ALIENS"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(bulkCancelService);
    }

    private GenerationReport report(CommitSummary summary) {
        return new GenerationReport(summary, 18, summary.skippedCount(),
                new BookingWindow(Instant.parse("2026-02-09T07:00:00Z"), Instant.parse("2026-06-14T06:00:00Z")),
                List.of("Tue 6:30 PM (60 min)"));
    }
}
