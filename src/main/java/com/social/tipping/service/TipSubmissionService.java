package com.social.tipping.service;

import com.social.tipping.client.MessageVault;
import com.social.tipping.client.ModerationClient;
import com.social.tipping.client.UserDirectory;
import com.social.tipping.config.MetricsConfig;
import com.social.tipping.engine.AbuseDetector;
import com.social.tipping.engine.checks.VelocityCheck;
import com.social.tipping.exception.DependencyUnavailableException;
import com.social.tipping.exception.InvalidTipException;
import com.social.tipping.model.AbuseAssessment;
import com.social.tipping.model.AbuseCheckResult;
import com.social.tipping.model.ModerationAction;
import com.social.tipping.model.ModerationVerdict;
import com.social.tipping.model.RateLimitDecision;
import com.social.tipping.model.TipAttempt;
import com.social.tipping.model.TipJob;
import com.social.tipping.model.TipRequest;
import com.social.tipping.model.TipSubmissionResult;
import com.social.tipping.model.UserProfile;
import com.social.tipping.resilience.CircuitBreaker;
import com.social.tipping.resilience.CircuitBreakers;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Synchronous entry point for a tip: rate limits, abuse screening, moderation, sealing the
 * message and enqueueing. Rejections come back as results; only infrastructure problems throw.
 *
 * <p>Verification tier and wallet addresses come from the {@link UserDirectory}, never from the
 * request.
 */
@Service
public class TipSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(TipSubmissionService.class);
    private static final BigInteger MAX_AMOUNT = BigInteger.valueOf(Long.MAX_VALUE);

    private final RateLimitService rateLimitService;
    private final AbuseDetector abuseDetector;
    private final ModerationClient moderationClient;
    private final MessageVault messageVault;
    private final UserDirectory userDirectory;
    private final TipJobQueue tipJobQueue;
    private final TipReviewService reviewService;
    private final CircuitBreaker moderationBreaker;
    private final CircuitBreaker contentStorageBreaker;
    private final CircuitBreaker userDirectoryBreaker;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public TipSubmissionService(RateLimitService rateLimitService,
                                AbuseDetector abuseDetector,
                                ModerationClient moderationClient,
                                MessageVault messageVault,
                                UserDirectory userDirectory,
                                TipJobQueue tipJobQueue,
                                TipReviewService reviewService,
                                CircuitBreakers breakers,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.rateLimitService = rateLimitService;
        this.abuseDetector = abuseDetector;
        this.moderationClient = moderationClient;
        this.messageVault = messageVault;
        this.userDirectory = userDirectory;
        this.tipJobQueue = tipJobQueue;
        this.reviewService = reviewService;
        this.moderationBreaker = breakers.get("moderation");
        this.contentStorageBreaker = breakers.get("content-storage");
        this.userDirectoryBreaker = breakers.get("user-directory");
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "tip.submit", contextualName = "submit-tip")
    public TipSubmissionResult submit(TipRequest request) {
        long amount = parseAmount(request.getAmountSmallestUnit());
        UserProfile sender = lookUp(request.getSenderId(), "Sender");
        UserProfile recipient = lookUp(request.getRecipientId(), "Recipient");

        // 1. Rate limits
        RateLimitDecision limits = rateLimitService.checkAll(request.getSenderId(), request.getClientIp(),
                sender.getWalletAddress(), amount, sender.getVerificationTier());
        if (!limits.isAllowed()) {
            metricsConfig.recordSubmission("rate_limited");
            return TipSubmissionResult.rateLimited(limits.getRejection());
        }

        // 2. Abuse screening
        TipAttempt attempt = TipAttempt.builder()
                .senderId(request.getSenderId())
                .recipientId(request.getRecipientId())
                .amount(amount)
                .senderAddress(sender.getWalletAddress())
                .recipientAddress(recipient.getWalletAddress())
                .build();
        AbuseAssessment assessment = abuseDetector.assess(attempt);
        if (!assessment.isAllowed()) {
            metricsConfig.recordSubmission("abuse_rejected");
            return TipSubmissionResult.abusive(assessment, retryAfter(assessment));
        }

        // 3. Moderation
        ModerationVerdict verdict = moderate(request);
        if (verdict.getAction() == ModerationAction.BLOCK) {
            metricsConfig.recordSubmission("moderation_blocked");
            log.info("Tip from sender={} blocked by moderation: {}", request.getSenderId(), verdict.getCategories());
            return TipSubmissionResult.moderationBlocked(verdict);
        }

        // 4. Seal the message
        String contentReference = seal(request);

        // 5. Enqueue
        TipJob job = TipJob.builder()
                .senderId(request.getSenderId())
                .recipientId(request.getRecipientId())
                .amount(amount)
                .contentReference(contentReference)
                .moderationVerdict(verdict)
                .createdAt(clock.millis())
                .flaggedForReview(assessment.isFlaggedForReview())
                .build();
        String jobId = tipJobQueue.enqueue(job);

        if (assessment.isFlaggedForReview()) {
            reviewService.enqueue(jobId, attempt, assessment.getReviewReason());
        }

        metricsConfig.recordSubmission("accepted");
        return TipSubmissionResult.accepted(jobId, assessment, verdict);
    }

    private UserProfile lookUp(String userId, String role) {
        UserProfile profile;
        try {
            profile = userDirectoryBreaker.execute(() -> userDirectory.findProfile(userId)).orElse(null);
        } catch (Exception e) {
            metricsConfig.recordSubmission("user_directory_unavailable");
            log.error("User lookup failed for {}: {}", userId, e.getMessage());
            throw new DependencyUnavailableException("user-directory",
                    "User directory is temporarily unavailable, please retry", e);
        }
        if (profile == null || profile.getWalletAddress() == null || profile.getWalletAddress().isBlank()) {
            throw new InvalidTipException(role + " " + userId + " has no registered wallet");
        }
        return profile;
    }

    private ModerationVerdict moderate(TipRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ModerationVerdict.skipped();
        }
        try {
            return moderationBreaker.execute(() -> moderationClient.moderate(
                    request.getMessage(), request.getSenderId(), request.getRecipientId()));
        } catch (Exception e) {
            log.warn("Moderation unavailable for tip from sender={}, passing with warning: {}",
                    request.getSenderId(), e.getMessage());
            return ModerationVerdict.unavailable();
        }
    }

    private String seal(TipRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return null;
        }
        try {
            return contentStorageBreaker.execute(() -> messageVault.seal(
                    request.getSenderId(), request.getRecipientId(), request.getMessage()));
        } catch (Exception e) {
            metricsConfig.recordSubmission("content_storage_unavailable");
            log.error("Message storage failed for tip from sender={}: {}", request.getSenderId(), e.getMessage());
            throw new DependencyUnavailableException("content-storage",
                    "Message storage is temporarily unavailable, please retry", e);
        }
    }

    static long parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTipException("amountSmallestUnit is required");
        }
        BigInteger value;
        try {
            value = new BigInteger(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidTipException("amountSmallestUnit must be a decimal integer");
        }
        if (value.signum() <= 0) {
            throw new InvalidTipException("amountSmallestUnit must be greater than zero");
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new InvalidTipException("amountSmallestUnit exceeds the supported maximum");
        }
        return value.longValueExact();
    }

    private static Long retryAfter(AbuseAssessment assessment) {
        if (assessment.getResults() == null) return null;
        return assessment.getResults().stream()
                .filter(r -> !r.isAllowed() && r.getCheckType() == assessment.getCheckType())
                .map(AbuseCheckResult::getMetadata)
                .filter(m -> m != null && m.get(VelocityCheck.RETRY_AFTER_SECONDS) instanceof Number)
                .map(m -> ((Number) m.get(VelocityCheck.RETRY_AFTER_SECONDS)).longValue())
                .findFirst()
                .orElse(null);
    }
}
