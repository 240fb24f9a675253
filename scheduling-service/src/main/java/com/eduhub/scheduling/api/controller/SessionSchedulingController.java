package com.eduhub.scheduling.api.controller;

import com.eduhub.common.dto.BaseResponse;
import com.eduhub.common.util.Constants;
import com.eduhub.scheduling.api.dto.BulkCancelRequest;
import com.eduhub.scheduling.api.dto.BulkCancelResponse;
import com.eduhub.scheduling.api.dto.GenerateSessionsRequest;
import com.eduhub.scheduling.api.dto.GenerateSessionsResponse;
import com.eduhub.scheduling.api.dto.ResetSessionsRequest;
import com.eduhub.scheduling.api.dto.ResetSessionsResponse;
import com.eduhub.scheduling.domain.bulk.BulkCancelService;
import com.eduhub.scheduling.domain.bulk.BulkTransitionResult;
import com.eduhub.scheduling.domain.reset.ScopedResetService;
import com.eduhub.scheduling.domain.service.GenerationReport;
import com.eduhub.scheduling.domain.service.SessionGenerationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operator endpoints for recurring session scheduling.
 * Tenant and actor come from request headers; the environment is always explicit in the body.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
public class SessionSchedulingController {

    private final SessionGenerationService generationService;
    private final ScopedResetService resetService;
    private final BulkCancelService bulkCancelService;

    /**
     * Runs the full generation pipeline without writing anything.
     */
    @PostMapping("/generate/preview")
    public ResponseEntity<BaseResponse<GenerateSessionsResponse>> previewGeneration(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @RequestHeader(value = Constants.ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody GenerateSessionsRequest request) {
        GenerationReport report = generationService.preview(request.toCommand(tenantId, actorId));
        return ResponseEntity.ok(BaseResponse.success("Preview generated", GenerateSessionsResponse.from(report)));
    }

    @PostMapping("/generate")
    public ResponseEntity<BaseResponse<GenerateSessionsResponse>> generateSessions(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @RequestHeader(value = Constants.ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody GenerateSessionsRequest request) {
        GenerationReport report = generationService.generate(request.toCommand(tenantId, actorId));
        String message = report.summary().dryRun() ? "Dry run completed" : "Sessions generated";
        return ResponseEntity.ok(BaseResponse.success(message, GenerateSessionsResponse.from(report)));
    }

    @PostMapping("/reset")
    public ResponseEntity<BaseResponse<ResetSessionsResponse>> resetSessions(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @RequestHeader(value = Constants.ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody ResetSessionsRequest request) {
        int deleted = resetService.reset(request.toCommand(tenantId, actorId));
        return ResponseEntity.ok(BaseResponse.success(new ResetSessionsResponse(deleted, request.dryRun())));
    }

    @PostMapping("/bulk-cancel")
    public ResponseEntity<BaseResponse<BulkCancelResponse>> bulkCancel(
            @RequestHeader(Constants.TENANT_HEADER) String tenantId,
            @RequestHeader(value = Constants.ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody BulkCancelRequest request) {
        BulkTransitionResult result = bulkCancelService.bulkTransition(request.toCommand(tenantId, actorId));
        return ResponseEntity.ok(BaseResponse.success("Sessions cancelled",
                new BulkCancelResponse(result.requestedCount(), result.transitionedCount())));
    }
}
