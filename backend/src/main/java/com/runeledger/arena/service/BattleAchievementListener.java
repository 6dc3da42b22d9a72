package com.runeledger.arena.service;

import com.runeledger.arena.model.BattleRating;
import com.runeledger.service.AchievementLedgerService;
import com.runeledger.service.BattleStatLine;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BattleAchievementListener {

    private final AchievementLedgerService achievementLedgerService;

    @EventListener
    public void onBattleRecorded(BattleRecordedEvent event) {
        evaluate(event.ratingA(), event);
        evaluate(event.ratingB(), event);
    }

    private void evaluate(BattleRating rating, BattleRecordedEvent event) {
        achievementLedgerService.evaluateBattleAchievements(
                rating.getPlayerId(),
                rating.getCategory(),
                new BattleStatLine(
                        rating.getWins(),
                        rating.getWinStreak(),
                        rating.getHighestWinStreak(),
                        rating.getTotalBattles()
                ),
                event.occurredAt()
        );
    }
}
