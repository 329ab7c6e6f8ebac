package com.tony.gridironStats.repository;

import com.tony.gridironStats.model.PlayerSeasonAggregate;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

@NoRepositoryBean
public interface SeasonAggregateRepository<A extends PlayerSeasonAggregate> extends JpaRepository<A, Long> {

    Optional<A> findByPlayerId(String playerId);

    // Lecture pour mise à jour : SELECT ... FOR UPDATE, deux écrivains sur le même joueur passent l'un après l'autre
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM #{#entityName} a WHERE a.playerId = :playerId")
    Optional<A> findForUpdateByPlayerId(@Param("playerId") String playerId);
}
