package com.runeledger.arena.repository;

import com.runeledger.arena.model.TournamentMatch;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TournamentMatchRepository extends JpaRepository<TournamentMatch, Long> {
    List<TournamentMatch> findByTournamentIdOrderByRoundAscBracketPositionAsc(Long tournamentId);

    List<TournamentMatch> findByTournamentIdAndRoundOrderByBracketPositionAsc(Long tournamentId, Integer round);

    @Query("select m.tournamentId from TournamentMatch m where m.id = :matchId")
    Optional<Long> findTournamentIdById(@Param("matchId") Long matchId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select m from TournamentMatch m where m.id = :matchId")
    Optional<TournamentMatch> findByIdForUpdate(@Param("matchId") Long matchId);
}
