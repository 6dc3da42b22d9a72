package com.runeledger.repository;

import com.runeledger.model.PlayerSkill;
import com.runeledger.model.SkillType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PlayerSkillRepository extends JpaRepository<PlayerSkill, Long> {
    List<PlayerSkill> findByPlayerIdOrderByIdAsc(Long playerId);

    Optional<PlayerSkill> findByPlayerIdAndSkill(Long playerId, SkillType skill);

    @Modifying
    @Query("delete from PlayerSkill s where s.playerId = :playerId")
    int deleteAllByPlayerId(@Param("playerId") Long playerId);
}
