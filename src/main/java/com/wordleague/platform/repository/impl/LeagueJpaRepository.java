package com.wordleague.platform.repository.impl;

import com.wordleague.platform.model.League;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface LeagueJpaRepository extends JpaRepository<League, String> {

    /**
     * Insert-only write; an existing id fails with a unique-key violation instead of being merged.
     */
    @Modifying
    @Transactional
    @Query(value = "insert into leagues (id, name, created_at) values (:id, :name, :createdAt)", nativeQuery = true)
    int insertLeague(@Param("id") String id, @Param("name") String name, @Param("createdAt") Instant createdAt);
}
