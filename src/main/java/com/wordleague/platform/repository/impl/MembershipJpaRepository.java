package com.wordleague.platform.repository.impl;

import com.wordleague.platform.model.LeagueMember;
import com.wordleague.platform.model.Membership;
import com.wordleague.platform.model.MembershipId;
import com.wordleague.platform.model.PlayerLeague;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MembershipJpaRepository extends JpaRepository<Membership, MembershipId> {

    @Query("select new com.wordleague.platform.model.LeagueMember(p.uuid, p.displayName) "
        + "from Membership m join Player p on p.uuid = m.playerUuid "
        + "where m.leagueId = :leagueId order by m.joinedAt asc, p.uuid asc")
    List<LeagueMember> findMembersOfLeague(@Param("leagueId") String leagueId);

    @Query("select new com.wordleague.platform.model.PlayerLeague(l.id, l.name) "
        + "from Membership m join League l on l.id = m.leagueId "
        + "where m.playerUuid = :playerUuid order by m.joinedAt asc")
    List<PlayerLeague> findLeaguesOfPlayer(@Param("playerUuid") String playerUuid);

    long countByLeagueId(String leagueId);
}
