package com.social.tipping.service;

import com.social.tipping.config.MetricsConfig;
import com.social.tipping.model.AchievementMilestone;
import com.social.tipping.model.LeaderboardCategory;
import com.social.tipping.model.SettledTip;
import com.social.tipping.model.UserStatSnapshot;
import com.social.tipping.repository.AchievementRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Awards tip-count milestones to both parties after a tip settles. Every milestone already
 * reached is (re)offered, so a missed run is caught up by the next tip.
 */
@Component
public class AchievementEnrichment implements TipEnrichment {

    private static final Logger log = LoggerFactory.getLogger(AchievementEnrichment.class);

    private final LeaderboardService leaderboardService;
    private final AchievementRepository achievementRepository;
    private final MetricsConfig metricsConfig;

    public AchievementEnrichment(LeaderboardService leaderboardService,
                                 AchievementRepository achievementRepository,
                                 MetricsConfig metricsConfig) {
        this.leaderboardService = leaderboardService;
        this.achievementRepository = achievementRepository;
        this.metricsConfig = metricsConfig;
    }

    @Override
    public String getName() {
        return "achievements";
    }

    @Override
    public void onTipSettled(SettledTip tip) {
        UserStatSnapshot sender = leaderboardService.getUserStats(tip.getSenderId());
        awardReached(tip.getSenderId(), LeaderboardCategory.SENT, sender.getTipsSent(), tip.getSettledAt());

        UserStatSnapshot recipient = leaderboardService.getUserStats(tip.getRecipientId());
        awardReached(tip.getRecipientId(), LeaderboardCategory.RECEIVED, recipient.getTipsReceived(),
                tip.getSettledAt());
    }

    public Map<AchievementMilestone, Long> getAchievements(String userId) {
        return achievementRepository.findByUser(userId);
    }

    private void awardReached(String userId, LeaderboardCategory category, long count, long now) {
        for (AchievementMilestone milestone : AchievementMilestone.values()) {
            if (milestone.getCategory() != category || count < milestone.getThreshold()) {
                continue;
            }
            if (achievementRepository.award(userId, milestone, now)) {
                metricsConfig.recordAchievementAwarded(milestone.name());
                log.info("Achievement {} awarded to user={}", milestone, userId);
            }
        }
    }
}
