package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.TipLedgerEntry;
import com.social.tipping.repository.TipLedgerRepository;
import com.social.tipping.resilience.CircuitBreaker;
import com.social.tipping.resilience.CircuitBreakers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Relational replay log of settled tips. Writes are best effort: a failure is logged and counted
 * but never reaches the job.
 */
@Service
public class TipLedgerService {

    private static final Logger log = LoggerFactory.getLogger(TipLedgerService.class);

    private final TipLedgerRepository ledgerRepository;
    private final CircuitBreaker databaseBreaker;
    private final MetricsConfig metricsConfig;

    public TipLedgerService(TipLedgerRepository ledgerRepository,
                            CircuitBreakers breakers,
                            MetricsConfig metricsConfig) {
        this.ledgerRepository = ledgerRepository;
        this.databaseBreaker = breakers.get("database");
        this.metricsConfig = metricsConfig;
    }

    @Async("ledgerExecutor")
    public void recordAsync(TipLedgerEntry entry) {
        record(entry);
    }

    /**
     * @return true when a new row was written, false for replays and failures
     */
    public boolean record(TipLedgerEntry entry) {
        try {
            return databaseBreaker.execute(() -> {
                if (ledgerRepository.existsByJobId(entry.getJobId())) {
                    log.debug("Ledger already has job {}", entry.getJobId());
                    return false;
                }
                try {
                    ledgerRepository.save(entry);
                    return true;
                } catch (DataIntegrityViolationException e) {
                    // Concurrent replay of the same job lost the unique-key race; the database is healthy.
                    log.debug("Ledger entry for job {} written concurrently", entry.getJobId());
                    return false;
                }
            });
        } catch (Exception e) {
            metricsConfig.recordLedgerFailure();
            log.error("Failed to write ledger entry for job {}: {}", entry.getJobId(), e.getMessage(), e);
            return false;
        }
    }

    public Page<TipLedgerEntry> history(String userId, int page, int size) {
        int boundedSize = Math.max(1, Math.min(size, 100));
        return ledgerRepository.findByParticipant(userId,
                PageRequest.of(Math.max(0, page), boundedSize, Sort.by(Sort.Direction.DESC, "settledAt")));
    }
}
