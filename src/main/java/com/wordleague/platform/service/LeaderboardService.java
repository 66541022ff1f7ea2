package com.wordleague.platform.service;

import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.exception.LeagueNotFoundException;
import com.wordleague.platform.model.LeaderboardEntry;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueLeaderboard;
import com.wordleague.platform.model.LeagueMember;
import com.wordleague.platform.model.PlayerLeague;
import com.wordleague.platform.model.PlayerLeagueSummary;
import com.wordleague.platform.model.Score;
import com.wordleague.platform.repository.MembershipRepository;
import com.wordleague.platform.repository.ScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class LeaderboardService {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);
    
    private final MembershipRepository membershipRepository;
    private final ScoreRepository scoreRepository;
    private final PuzzleCalendar puzzleCalendar;
    private final LeaderboardRanking leaderboardRanking;
    
    @Autowired
    public LeaderboardService(
            MembershipRepository membershipRepository,
            ScoreRepository scoreRepository,
            PuzzleCalendar puzzleCalendar,
            LeaderboardRanking leaderboardRanking) {
        this.membershipRepository = membershipRepository;
        this.scoreRepository = scoreRepository;
        this.puzzleCalendar = puzzleCalendar;
        this.leaderboardRanking = leaderboardRanking;
    }
    
    /**
     * Ranked standings of a league for one puzzle date.
     * Every member appears; members who have not played that date are listed last without a rank.
     *
     * @param date puzzle date, today when null or blank; not otherwise validated
     */
    public LeagueLeaderboard computeLeaderboard(String leagueId, String date) {
        if (leagueId == null || leagueId.trim().isEmpty()) {
            throw new InvalidRequestException("League id cannot be null or empty");
        }
        String resolvedDate = (date == null || date.trim().isEmpty()) ? puzzleCalendar.today() : date;
        League league = membershipRepository.getLeague(leagueId)
            .orElseThrow(() -> new LeagueNotFoundException(leagueId));
        
        List<LeagueMember> members = membershipRepository.listMembersOfLeague(leagueId);
        Map<String, Score> scoresByPlayer = scoreRepository.getScoresForLeagueOnDate(leagueId, resolvedDate).stream()
            .collect(Collectors.toMap(Score::getPlayerUuid, Function.identity(), (first, second) -> second));
        
        List<LeaderboardEntry> entries = members.stream()
            .map(member -> toEntry(member, scoresByPlayer.get(member.getPlayerUuid()), resolvedDate))
            .toList();
        List<LeaderboardEntry> ranked = leaderboardRanking.rank(entries);
        
        logger.debug("Computed leaderboard for league {} on {} - {} members, {} played",
            leagueId, resolvedDate, members.size(), scoresByPlayer.size());
        
        return LeagueLeaderboard.builder()
            .league(league)
            .date(resolvedDate)
            .entries(ranked)
            .build();
    }
    
    private LeaderboardEntry toEntry(LeagueMember member, Score score, String date) {
        return LeaderboardEntry.builder()
            .uuid(member.getPlayerUuid())
            .displayName(member.getDisplayName())
            .mistakes(score != null ? score.getMistakes() : null)
            .date(score != null ? date : null)
            .build();
    }
    
    /**
     * Member count and today's played count for every league the player belongs to.
     * Leagues that can no longer be resolved are left out.
     */
    public List<PlayerLeagueSummary> getPlayerLeagueSummary(String uuid) {
        if (uuid == null || uuid.trim().isEmpty()) {
            throw new InvalidRequestException("Player UUID cannot be null or empty");
        }
        String today = puzzleCalendar.today();
        
        List<PlayerLeagueSummary> summaries = new ArrayList<>();
        for (PlayerLeague playerLeague : membershipRepository.listLeaguesOfPlayer(uuid)) {
            Optional<League> league = membershipRepository.getLeague(playerLeague.getLeagueId());
            if (league.isEmpty()) {
                logger.debug("Skipping unresolvable league {} for player {}", playerLeague.getLeagueId(), uuid);
                continue;
            }
            String leagueId = league.get().getId();
            summaries.add(PlayerLeagueSummary.builder()
                .leagueId(leagueId)
                .leagueName(league.get().getName())
                .totalMembers(membershipRepository.countMembers(leagueId))
                .playedToday(scoreRepository.countPlayedOnDate(leagueId, today))
                .build());
        }
        return summaries;
    }
}
