package com.wordleague.platform.service;

import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.exception.LeagueNotFoundException;
import com.wordleague.platform.exception.StoreUnavailableException;
import com.wordleague.platform.model.LeaderboardEntry;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueLeaderboard;
import com.wordleague.platform.model.LeagueMember;
import com.wordleague.platform.model.PlayerLeague;
import com.wordleague.platform.model.PlayerLeagueSummary;
import com.wordleague.platform.model.Score;
import com.wordleague.platform.repository.MembershipRepository;
import com.wordleague.platform.repository.ScoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardServiceTest {
    
    @Mock
    private MembershipRepository membershipRepository;
    
    @Mock
    private ScoreRepository scoreRepository;
    
    private LeaderboardService leaderboardService;
    
    private League testLeague;
    private final String testLeagueId = "abcd1234";
    private final String testDate = "2024-01-05";
    
    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-03-10T12:00:00Z"), ZoneOffset.UTC);
        leaderboardService = new LeaderboardService(
            membershipRepository, scoreRepository, new PuzzleCalendar(clock), new LeaderboardRanking("en"));
        
        testLeague = League.builder()
            .id(testLeagueId)
            .name("Test League")
            .createdAt(Instant.now())
            .build();
    }
    
    private static Score score(String uuid, int mistakes, String date) {
        return Score.builder()
            .playerUuid(uuid)
            .leagueId("abcd1234")
            .date(date)
            .mistakes(mistakes)
            .recordedAt(Instant.now())
            .build();
    }
    
    @Test
    void testComputeLeaderboard_TiedPlayersThenUnplayed() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of(
            new LeagueMember("alice", "Alice"),
            new LeagueMember("bob", "Bob"),
            new LeagueMember("carol", "Carol")));
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, testDate)).thenReturn(List.of(
            score("bob", 2, testDate), score("carol", 2, testDate)));
        
        // Act
        LeagueLeaderboard result = leaderboardService.computeLeaderboard(testLeagueId, testDate);
        
        // Assert
        assertEquals(testLeague, result.getLeague());
        assertEquals(testDate, result.getDate());
        List<LeaderboardEntry> entries = result.getEntries();
        assertEquals(3, entries.size());
        assertEquals("Bob", entries.get(0).getDisplayName());
        assertEquals(1, entries.get(0).getRank());
        assertEquals("Carol", entries.get(1).getDisplayName());
        assertEquals(1, entries.get(1).getRank());
        assertEquals("Alice", entries.get(2).getDisplayName());
        assertNull(entries.get(2).getRank());
        assertNull(entries.get(2).getMistakes());
        assertNull(entries.get(2).getDate());
        assertEquals(testDate, entries.get(0).getDate());
    }
    
    @Test
    void testComputeLeaderboard_FourthMemberWithZeroMistakesLeads() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of(
            new LeagueMember("alice", "Alice"),
            new LeagueMember("bob", "Bob"),
            new LeagueMember("carol", "Carol"),
            new LeagueMember("dave", "Dave")));
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, testDate)).thenReturn(List.of(
            score("bob", 2, testDate), score("carol", 2, testDate), score("dave", 0, testDate)));
        
        // Act
        List<LeaderboardEntry> entries = leaderboardService.computeLeaderboard(testLeagueId, testDate).getEntries();
        
        // Assert
        assertEquals(List.of("Dave", "Bob", "Carol", "Alice"),
            entries.stream().map(LeaderboardEntry::getDisplayName).toList());
        assertEquals(1, entries.get(0).getRank());
        assertEquals(2, entries.get(1).getRank());
        assertEquals(2, entries.get(2).getRank());
        assertNull(entries.get(3).getRank());
    }
    
    @Test
    void testComputeLeaderboard_EmptyLeague() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(new ArrayList<>());
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, testDate)).thenReturn(new ArrayList<>());
        
        // Act
        LeagueLeaderboard result = leaderboardService.computeLeaderboard(testLeagueId, testDate);
        
        // Assert
        assertNotNull(result.getEntries());
        assertTrue(result.getEntries().isEmpty());
    }
    
    @Test
    void testComputeLeaderboard_DefaultsToToday() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of(
            new LeagueMember("bob", "Bob")));
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, "2024-03-10")).thenReturn(List.of(
            score("bob", 1, "2024-03-10")));
        
        // Act
        LeagueLeaderboard result = leaderboardService.computeLeaderboard(testLeagueId, null);
        
        // Assert
        assertEquals("2024-03-10", result.getDate());
        assertEquals(1, result.getEntries().get(0).getRank());
        verify(scoreRepository).getScoresForLeagueOnDate(testLeagueId, "2024-03-10");
    }
    
    @Test
    void testComputeLeaderboard_FutureDateIsNotRejected() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of(
            new LeagueMember("bob", "Bob")));
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, "2099-12-31")).thenReturn(List.of());
        
        // Act
        LeagueLeaderboard result = leaderboardService.computeLeaderboard(testLeagueId, "2099-12-31");
        
        // Assert
        assertEquals("2099-12-31", result.getDate());
        assertNull(result.getEntries().get(0).getRank());
    }
    
    @Test
    void testComputeLeaderboard_ScoresOfNonMembersAreIgnored() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of(
            new LeagueMember("bob", "Bob")));
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, testDate)).thenReturn(List.of(
            score("bob", 3, testDate), score("stranger", 0, testDate)));
        
        // Act
        List<LeaderboardEntry> entries = leaderboardService.computeLeaderboard(testLeagueId, testDate).getEntries();
        
        // Assert
        assertEquals(1, entries.size());
        assertEquals("bob", entries.get(0).getUuid());
        assertEquals(1, entries.get(0).getRank());
    }
    
    @Test
    void testComputeLeaderboard_LeagueNotFound() {
        // Arrange
        when(membershipRepository.getLeague("missing1")).thenReturn(Optional.empty());
        
        // Act & Assert
        assertThrows(LeagueNotFoundException.class, () -> {
            leaderboardService.computeLeaderboard("missing1", testDate);
        });
        verifyNoInteractions(scoreRepository);
    }
    
    @Test
    void testComputeLeaderboard_InvalidLeagueId() {
        assertThrows(InvalidRequestException.class, () -> {
            leaderboardService.computeLeaderboard(" ", testDate);
        });
        verifyNoInteractions(membershipRepository, scoreRepository);
    }
    
    @Test
    void testComputeLeaderboard_StoreFailurePropagates() {
        // Arrange
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.listMembersOfLeague(testLeagueId)).thenReturn(List.of());
        when(scoreRepository.getScoresForLeagueOnDate(testLeagueId, testDate))
            .thenThrow(new StoreUnavailableException("down", new RuntimeException()));
        
        // Act & Assert
        assertThrows(StoreUnavailableException.class, () -> {
            leaderboardService.computeLeaderboard(testLeagueId, testDate);
        });
    }
    
    @Test
    void testGetPlayerLeagueSummary_CountsMembersAndPlayedToday() {
        // Arrange
        League other = League.builder().id("zz99yy88").name("Other").createdAt(Instant.now()).build();
        when(membershipRepository.listLeaguesOfPlayer("bob")).thenReturn(List.of(
            new PlayerLeague(testLeagueId, "Test League"),
            new PlayerLeague("zz99yy88", "Other")));
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.getLeague("zz99yy88")).thenReturn(Optional.of(other));
        when(membershipRepository.countMembers(testLeagueId)).thenReturn(4L);
        when(membershipRepository.countMembers("zz99yy88")).thenReturn(2L);
        when(scoreRepository.countPlayedOnDate(testLeagueId, "2024-03-10")).thenReturn(3L);
        when(scoreRepository.countPlayedOnDate("zz99yy88", "2024-03-10")).thenReturn(0L);
        
        // Act
        List<PlayerLeagueSummary> result = leaderboardService.getPlayerLeagueSummary("bob");
        
        // Assert
        assertEquals(2, result.size());
        assertEquals(testLeagueId, result.get(0).getLeagueId());
        assertEquals("Test League", result.get(0).getLeagueName());
        assertEquals(4L, result.get(0).getTotalMembers());
        assertEquals(3L, result.get(0).getPlayedToday());
        assertEquals("Other", result.get(1).getLeagueName());
        assertEquals(0L, result.get(1).getPlayedToday());
        verify(scoreRepository, never()).countPlayedOnDate(anyString(), argThat(date -> !"2024-03-10".equals(date)));
    }
    
    @Test
    void testGetPlayerLeagueSummary_SkipsUnresolvableLeague() {
        // Arrange
        when(membershipRepository.listLeaguesOfPlayer("bob")).thenReturn(List.of(
            new PlayerLeague("gone0000", "Gone"),
            new PlayerLeague(testLeagueId, "Test League")));
        when(membershipRepository.getLeague("gone0000")).thenReturn(Optional.empty());
        when(membershipRepository.getLeague(testLeagueId)).thenReturn(Optional.of(testLeague));
        when(membershipRepository.countMembers(testLeagueId)).thenReturn(1L);
        when(scoreRepository.countPlayedOnDate(testLeagueId, "2024-03-10")).thenReturn(1L);
        
        // Act
        List<PlayerLeagueSummary> result = leaderboardService.getPlayerLeagueSummary("bob");
        
        // Assert
        assertEquals(1, result.size());
        assertEquals(testLeagueId, result.get(0).getLeagueId());
        verify(membershipRepository, never()).countMembers("gone0000");
    }
    
    @Test
    void testGetPlayerLeagueSummary_NoLeagues() {
        when(membershipRepository.listLeaguesOfPlayer("loner")).thenReturn(List.of());
        
        assertTrue(leaderboardService.getPlayerLeagueSummary("loner").isEmpty());
    }
    
    @Test
    void testGetPlayerLeagueSummary_InvalidUuid() {
        assertThrows(InvalidRequestException.class, () -> {
            leaderboardService.getPlayerLeagueSummary(null);
        });
    }
}
