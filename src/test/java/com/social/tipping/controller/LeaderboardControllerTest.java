package com.social.tipping.controller;

import com.social.tipping.model.*;
import com.social.tipping.service.AchievementEnrichment;
import com.social.tipping.service.LeaderboardService;
import com.social.tipping.service.TipLedgerService;
import com.social.tipping.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.domain.PageImpl;
import org.springframework.test.web.servlet.MockMvc;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LeaderboardController.class)
class LeaderboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LeaderboardService leaderboardService;

    @MockBean
    private TipLedgerService ledgerService;

    @MockBean
    private AchievementEnrichment achievements;

    @Test
    void getLeaderboard_weeklySenders() throws Exception {
        when(leaderboardService.getLeaderboard(LeaderboardPeriod.WEEKLY, LeaderboardCategory.SENT, 5))
                .thenReturn(new LeaderboardPage(LeaderboardPeriod.WEEKLY, LeaderboardCategory.SENT, "2026-W42", 12,
                        List.of(TestDataFactory.createLeaderboardEntry(1, "alice", 900, "2026-W42"))));

        mockMvc.perform(get("/api/v1/leaderboard/weekly?category=senders&limit=5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.periodKey").value("2026-W42"))
                .andExpect(jsonPath("$.totalCount").value(12))
                .andExpect(jsonPath("$.entries[0].subjectId").value("alice"))
                .andExpect(jsonPath("$.entries[0].rank").value(1));
    }

    @Test
    void getLeaderboard_allTimeRecipientsByEnumName() throws Exception {
        when(leaderboardService.getLeaderboard(eq(LeaderboardPeriod.ALL), eq(LeaderboardCategory.RECEIVED), any()))
                .thenReturn(new LeaderboardPage(LeaderboardPeriod.ALL, LeaderboardCategory.RECEIVED, "all", 0, List.of()));

        mockMvc.perform(get("/api/v1/leaderboard/all?category=RECEIVED"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries").isEmpty());
    }

    @Test
    void getLeaderboard_unknownPeriod_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/leaderboard/monthly"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void countEntries_success() throws Exception {
        when(leaderboardService.getTotalCount(LeaderboardPeriod.ALL, LeaderboardCategory.SENT)).thenReturn(42L);

        mockMvc.perform(get("/api/v1/leaderboard/all/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCount").value(42));
    }

    @Test
    void getUserStats_success() throws Exception {
        when(leaderboardService.getUserStats("alice")).thenReturn(UserStatSnapshot.builder()
                .subjectId("alice").tipsSent(3).amountSent(30).globalRank(2L).periodKey("2026-W42").build());

        mockMvc.perform(get("/api/v1/users/alice/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tipsSent").value(3))
                .andExpect(jsonPath("$.globalRank").value(2));
    }

    @Test
    void getLedger_success() throws Exception {
        when(ledgerService.history("alice", 0, 20)).thenReturn(new PageImpl<>(List.of(TipLedgerEntry.builder()
                .jobId("tip-alice-bob-1").senderId("alice").recipientId("bob").amount(5L).periodKey("2026-W42")
                .build())));

        mockMvc.perform(get("/api/v1/users/alice/ledger"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].jobId").value("tip-alice-bob-1"));
    }

    @Test
    void getAchievements_namesMilestones() throws Exception {
        Map<AchievementMilestone, Long> awarded = new EnumMap<>(AchievementMilestone.class);
        awarded.put(AchievementMilestone.FIRST_TIP_SENT, 1_760_000_000_000L);
        when(achievements.getAchievements("alice")).thenReturn(awarded);

        mockMvc.perform(get("/api/v1/users/alice/achievements"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.FIRST_TIP_SENT").value(1_760_000_000_000L));
    }
}
