package com.wordleague.platform.repository.impl;

import com.wordleague.platform.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlayerJpaRepository extends JpaRepository<Player, String> {
}
