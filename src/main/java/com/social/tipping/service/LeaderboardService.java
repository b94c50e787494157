package com.social.tipping.service;

import com.social.tipping.config.LeaderboardConfig;
import com.social.tipping.model.LeaderboardCategory;
import com.social.tipping.model.LeaderboardEntry;
import com.social.tipping.model.LeaderboardPage;
import com.social.tipping.model.LeaderboardPeriod;
import com.social.tipping.model.TipLedgerEntry;
import com.social.tipping.model.TipTally;
import com.social.tipping.model.UserStatSnapshot;
import com.social.tipping.repository.LeaderboardRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.IsoFields;
import java.util.List;
import java.util.Map;

/**
 * Rankings and per-user totals. The Aerospike boards are authoritative for reads; the
 * relational ledger is fed the same event asynchronously.
 */
@Service
public class LeaderboardService {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardService.class);

    private final LeaderboardRepository leaderboardRepository;
    private final TipLedgerService tipLedgerService;
    private final LeaderboardConfig config;
    private final Clock clock;
    private final ZoneId zone;

    public LeaderboardService(LeaderboardRepository leaderboardRepository,
                              TipLedgerService tipLedgerService,
                              LeaderboardConfig config,
                              Clock clock) {
        this.leaderboardRepository = leaderboardRepository;
        this.tipLedgerService = tipLedgerService;
        this.config = config;
        this.clock = clock;
        this.zone = ZoneId.of(config.getZone());
    }

    /**
     * Credit a settled tip to both parties. Weekly boards use the ISO week of {@code settledAt}.
     * A job is credited once; a redelivered job only reaches the ledger, which skips replays itself.
     *
     * @return false when the job had already been credited
     */
    @Observed(name = "leaderboard.record", contextualName = "record-tip")
    public boolean recordTip(String jobId, String senderId, String recipientId, long amount,
                             String transactionHandle, long settledAt) {
        String weekKey = weekBucket(settledAt, zone);
        boolean credited = leaderboardRepository.applyTip(TipTally.builder()
                .jobId(jobId)
                .senderId(senderId)
                .recipientId(recipientId)
                .amount(amount)
                .weekKey(weekKey)
                .build());
        if (credited) {
            log.debug("Leaderboards updated for job={} sender={} recipient={} amount={} week={}",
                    jobId, senderId, recipientId, amount, weekKey);
        }

        tipLedgerService.recordAsync(TipLedgerEntry.builder()
                .jobId(jobId)
                .senderId(senderId)
                .recipientId(recipientId)
                .amount(amount)
                .periodKey(weekKey)
                .transactionHandle(transactionHandle)
                .settledAt(Instant.ofEpochMilli(settledAt))
                .build());
        return credited;
    }

    public LeaderboardPage getLeaderboard(LeaderboardPeriod period, LeaderboardCategory category, Integer limit) {
        int effectiveLimit = clampLimit(limit);
        String periodKey = periodKey(period);
        List<LeaderboardEntry> entries = leaderboardRepository.findTop(
                category.getBoardPrefix(), periodKey, effectiveLimit);
        long total = leaderboardRepository.countEntries(category.getBoardPrefix(), periodKey);
        return new LeaderboardPage(period, category, periodKey, total, entries);
    }

    public long getTotalCount(LeaderboardPeriod period, LeaderboardCategory category) {
        return leaderboardRepository.countEntries(category.getBoardPrefix(), periodKey(period));
    }

    public UserStatSnapshot getUserStats(String subjectId) {
        String weekKey = currentWeek();
        Map<String, Long> totals = leaderboardRepository.findUserTotals(subjectId);
        Map<String, Long> weekly = leaderboardRepository.findWeeklyTotals(subjectId, weekKey);
        String senders = LeaderboardCategory.SENT.getBoardPrefix();

        return UserStatSnapshot.builder()
                .subjectId(subjectId)
                .tipsSent(totals.getOrDefault("tipsSent", 0L))
                .amountSent(totals.getOrDefault("amountSent", 0L))
                .tipsReceived(totals.getOrDefault("tipsReceived", 0L))
                .amountReceived(totals.getOrDefault("amountReceived", 0L))
                .weeklyTips(weekly.getOrDefault("weeklyTips", 0L))
                .weeklyAmount(weekly.getOrDefault("weeklyAmount", 0L))
                .globalRank(leaderboardRepository.findRank(senders, LeaderboardRepository.ALL_TIME, subjectId))
                .weeklyRank(leaderboardRepository.findRank(senders, weekKey, subjectId))
                .periodKey(weekKey)
                .build();
    }

    public String currentWeek() {
        return weekBucket(clock.millis(), zone);
    }

    /**
     * ISO week bucket such as {@code 2026-W42}; the year is the week-based year.
     */
    public static String weekBucket(long epochMillis, ZoneId zone) {
        LocalDate date = Instant.ofEpochMilli(epochMillis).atZone(zone).toLocalDate();
        return String.format("%d-W%02d",
                date.get(IsoFields.WEEK_BASED_YEAR), date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    private String periodKey(LeaderboardPeriod period) {
        return period == LeaderboardPeriod.WEEKLY ? currentWeek() : LeaderboardRepository.ALL_TIME;
    }

    private int clampLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return config.getDefaultLimit();
        }
        return Math.min(limit, config.getMaxLimit());
    }
}
