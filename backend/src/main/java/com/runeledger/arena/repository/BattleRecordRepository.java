package com.runeledger.arena.repository;

import com.runeledger.arena.model.BattleRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BattleRecordRepository extends JpaRepository<BattleRecord, Long> {
    Optional<BattleRecord> findByBattleKey(String battleKey);

    List<BattleRecord> findTop50ByParticipantAIdOrParticipantBIdOrderByRecordedAtDescIdDesc(
            Long participantAId,
            Long participantBId
    );
}
