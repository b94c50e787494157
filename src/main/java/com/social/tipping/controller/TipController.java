package com.social.tipping.controller;

import com.social.tipping.model.RejectionSource;
import com.social.tipping.model.TipJob;
import com.social.tipping.model.TipRequest;
import com.social.tipping.model.TipSubmissionResult;
import com.social.tipping.service.TipJobQueue;
import com.social.tipping.service.TipSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/tips")
@Tag(name = "Tips", description = "Submit tips and follow their processing jobs")
public class TipController {

    private final TipSubmissionService submissionService;
    private final TipJobQueue jobQueue;

    public TipController(TipSubmissionService submissionService, TipJobQueue jobQueue) {
        this.submissionService = submissionService;
        this.jobQueue = jobQueue;
    }

    @Operation(summary = "Submit a tip",
            description = "Runs rate limits, abuse checks and message moderation, then queues the tip for " +
                    "settlement. Returns 200 when queued, 429 with Retry-After when rate limited and 422 " +
                    "when rejected as abusive or by moderation.")
    @PostMapping
    public ResponseEntity<TipSubmissionResult> submitTip(@Valid @RequestBody TipRequest request,
                                                         HttpServletRequest httpRequest) {
        if (request.getClientIp() == null || request.getClientIp().isBlank()) {
            request.setClientIp(httpRequest.getRemoteAddr());
        }

        TipSubmissionResult result = submissionService.submit(request);
        if (result.isAccepted()) {
            return ResponseEntity.ok(result);
        }

        HttpStatus status = result.getRejectionSource() == RejectionSource.RATE_LIMIT
                ? HttpStatus.TOO_MANY_REQUESTS
                : HttpStatus.UNPROCESSABLE_ENTITY;
        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (result.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(result.getRetryAfterSeconds()));
        }
        return response.body(result);
    }

    @Operation(summary = "Get a tip job",
            description = "Returns the processing state of a queued tip: status, attempts, last error and " +
                    "settlement handle once completed.")
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<TipJob> getJob(
            @Parameter(description = "Job ID", example = "tip-user-123-user-456-1760000000000")
            @PathVariable String jobId) {
        TipJob job = jobQueue.getJob(jobId);
        if (job == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(job);
    }
}
