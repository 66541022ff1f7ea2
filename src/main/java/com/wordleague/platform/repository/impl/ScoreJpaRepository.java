package com.wordleague.platform.repository.impl;

import com.wordleague.platform.model.Score;
import com.wordleague.platform.model.ScoreId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScoreJpaRepository extends JpaRepository<Score, ScoreId> {
    List<Score> findByLeagueIdAndDate(String leagueId, String date);
    long countByLeagueIdAndDate(String leagueId, String date);
}
