package com.social.tipping.controller;

import com.social.tipping.exception.DependencyUnavailableException;
import com.social.tipping.model.*;
import com.social.tipping.service.TipJobQueue;
import com.social.tipping.service.TipSubmissionService;
import com.social.tipping.testutil.TestDataFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TipController.class)
class TipControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private TipSubmissionService submissionService;

    @MockBean
    private TipJobQueue jobQueue;

    @Test
    void submitTip_accepted() throws Exception {
        when(submissionService.submit(any())).thenReturn(TipSubmissionResult.builder()
                .accepted(true).jobId("tip-alice-bob-1").moderationAction(ModerationAction.ALLOW).build());

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createTipRequest("alice", "bob", 1_500_000L))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.jobId").value("tip-alice-bob-1"))
                .andExpect(jsonPath("$.rejectionReason").doesNotExist());
    }

    @Test
    void submitTip_missingClientIp_usesRemoteAddress() throws Exception {
        when(submissionService.submit(any())).thenReturn(TipSubmissionResult.builder().accepted(true).build());
        TipRequest request = TestDataFactory.createTipRequest("alice", "bob", 1_500_000L);
        request.setClientIp(null);

        mockMvc.perform(post("/api/v1/tips")
                        .with(r -> { r.setRemoteAddr("198.51.100.4"); return r; })
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk());

        ArgumentCaptor<TipRequest> captor = ArgumentCaptor.forClass(TipRequest.class);
        verify(submissionService).submit(captor.capture());
        assertThat(captor.getValue().getClientIp()).isEqualTo("198.51.100.4");
    }

    @Test
    void submitTip_clientClaimedTierAndWallet_areNotBound() throws Exception {
        when(submissionService.submit(any())).thenReturn(TipSubmissionResult.builder().accepted(true).build());
        String body = "{\"senderId\":\"alice\",\"recipientId\":\"bob\",\"amountSmallestUnit\":\"1500000\","
                + "\"verificationTier\":\"VERIFIED\",\"senderAddress\":\"0x0000000000000000000000000000000000001234\"}";

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<TipRequest> captor = ArgumentCaptor.forClass(TipRequest.class);
        verify(submissionService).submit(captor.capture());
        assertThat(objectMapper.valueToTree(captor.getValue()).has("verificationTier")).isFalse();
        assertThat(objectMapper.valueToTree(captor.getValue()).has("senderAddress")).isFalse();
    }

    @Test
    void submitTip_rateLimited_returns429WithRetryAfter() throws Exception {
        when(submissionService.submit(any())).thenReturn(TipSubmissionResult.builder()
                .accepted(false)
                .rejectionSource(RejectionSource.RATE_LIMIT)
                .rejectionReason("Daily tip limit reached: maximum 100 tips per 24 hours.")
                .retryAfterSeconds(3600L)
                .build());

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createTipRequest("alice", "bob", 1L))))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "3600"))
                .andExpect(jsonPath("$.rejectionSource").value("RATE_LIMIT"));
    }

    @Test
    void submitTip_abusive_returns422() throws Exception {
        when(submissionService.submit(any())).thenReturn(TipSubmissionResult.builder()
                .accepted(false)
                .rejectionSource(RejectionSource.ABUSE)
                .rejectionReason("Cannot tip yourself.")
                .severity(Severity.CRITICAL)
                .build());

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createTipRequest("alice", "bob", 1L))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(header().doesNotExist("Retry-After"))
                .andExpect(jsonPath("$.severity").value("CRITICAL"));
    }

    @Test
    void submitTip_invalidAmount_returns400() throws Exception {
        TipRequest request = TestDataFactory.createTipRequest("alice", "bob", 1L);
        request.setAmountSmallestUnit("1.5");

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.startsWith("amountSmallestUnit")));
        verifyNoInteractions(submissionService);
    }

    @Test
    void submitTip_storageDown_returns503() throws Exception {
        when(submissionService.submit(any())).thenThrow(new DependencyUnavailableException("content-storage",
                "Message storage is temporarily unavailable, please retry", new RuntimeException("503")));

        mockMvc.perform(post("/api/v1/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(TestDataFactory.createTipRequest("alice", "bob", 1L))))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("DEPENDENCY_UNAVAILABLE"));
    }

    @Test
    void getJob_found() throws Exception {
        when(jobQueue.getJob("tip-1")).thenReturn(TestDataFactory.createJob("tip-1", JobStatus.COMPLETED, 1));

        mockMvc.perform(get("/api/v1/tips/jobs/tip-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobId").value("tip-1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void getJob_notFound() throws Exception {
        when(jobQueue.getJob("missing")).thenReturn(null);

        mockMvc.perform(get("/api/v1/tips/jobs/missing"))
                .andExpect(status().isNotFound());
    }
}
