package com.wordleague.platform.service;

import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.exception.LeagueNotFoundException;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueDetails;
import com.wordleague.platform.model.LeagueJoin;
import com.wordleague.platform.model.Player;
import com.wordleague.platform.repository.MembershipRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeagueServiceTest {
    
    @Mock
    private MembershipRepository membershipRepository;
    
    @InjectMocks
    private LeagueService leagueService;
    
    private League testLeague;
    private Player testPlayer;
    
    @BeforeEach
    void setUp() {
        testLeague = League.builder()
            .id("abcd1234")
            .name("My League")
            .createdAt(Instant.now())
            .build();
        testPlayer = Player.builder()
            .uuid("player-1")
            .displayName("Alice")
            .createdAt(Instant.now())
            .build();
    }
    
    @Test
    void testCreateLeague_DelegatesToStore() {
        when(membershipRepository.createLeague("My League ")).thenReturn(testLeague);
        
        League result = leagueService.createLeague("My League ");
        
        assertEquals("abcd1234", result.getId());
        assertEquals("My League", result.getName());
    }
    
    @Test
    void testCreateLeague_BlankNameRejectedBeforeWrite() {
        assertThrows(InvalidRequestException.class, () -> leagueService.createLeague("   "));
        assertThrows(InvalidRequestException.class, () -> leagueService.createLeague(null));
        verifyNoInteractions(membershipRepository);
    }
    
    @Test
    void testGetLeagueDetails_IncludesMemberCount() {
        when(membershipRepository.getLeague("abcd1234")).thenReturn(Optional.of(testLeague));
        when(membershipRepository.countMembers("abcd1234")).thenReturn(3L);
        
        LeagueDetails details = leagueService.getLeagueDetails("abcd1234");
        
        assertEquals(testLeague, details.getLeague());
        assertEquals(3L, details.getMemberCount());
    }
    
    @Test
    void testGetLeagueDetails_NotFound() {
        when(membershipRepository.getLeague("missing1")).thenReturn(Optional.empty());
        
        assertThrows(LeagueNotFoundException.class, () -> leagueService.getLeagueDetails("missing1"));
    }
    
    @Test
    void testJoinLeague_FirstJoin() {
        // Arrange
        when(membershipRepository.getLeague("abcd1234")).thenReturn(Optional.of(testLeague));
        when(membershipRepository.upsertPlayer("player-1", "Alice")).thenReturn(testPlayer);
        when(membershipRepository.hasMembership("player-1", "abcd1234")).thenReturn(false);
        
        // Act
        LeagueJoin result = leagueService.joinLeague("abcd1234", "player-1", "Alice");
        
        // Assert
        assertFalse(result.isAlreadyMember());
        assertEquals(testLeague, result.getLeague());
        assertEquals(testPlayer, result.getPlayer());
        InOrder inOrder = inOrder(membershipRepository);
        inOrder.verify(membershipRepository).upsertPlayer("player-1", "Alice");
        inOrder.verify(membershipRepository).addMembership("player-1", "abcd1234");
    }
    
    @Test
    void testJoinLeague_RejoinIsReportedNotRejected() {
        when(membershipRepository.getLeague("abcd1234")).thenReturn(Optional.of(testLeague));
        when(membershipRepository.upsertPlayer("player-1", "Alice")).thenReturn(testPlayer);
        when(membershipRepository.hasMembership("player-1", "abcd1234")).thenReturn(true);
        
        LeagueJoin result = leagueService.joinLeague("abcd1234", "player-1", "Alice");
        
        assertTrue(result.isAlreadyMember());
        verify(membershipRepository).addMembership("player-1", "abcd1234");
    }
    
    @Test
    void testJoinLeague_UnknownLeagueWritesNothing() {
        when(membershipRepository.getLeague("missing1")).thenReturn(Optional.empty());
        
        assertThrows(LeagueNotFoundException.class, () -> leagueService.joinLeague("missing1", "player-1", "Alice"));
        verify(membershipRepository, never()).upsertPlayer(anyString(), anyString());
        verify(membershipRepository, never()).addMembership(anyString(), anyString());
    }
    
    @Test
    void testJoinLeague_InvalidInputs() {
        assertThrows(InvalidRequestException.class, () -> leagueService.joinLeague("abcd1234", "", "Alice"));
        assertThrows(InvalidRequestException.class, () -> leagueService.joinLeague("abcd1234", "player-1", " "));
        assertThrows(InvalidRequestException.class, () -> leagueService.joinLeague(null, "player-1", "Alice"));
        verifyNoInteractions(membershipRepository);
    }
    
    @Test
    void testUpdateDisplayName_UpsertsPlayer() {
        when(membershipRepository.upsertPlayer("player-1", "Alice")).thenReturn(testPlayer);
        
        assertEquals(testPlayer, leagueService.updateDisplayName("player-1", "Alice"));
        verify(membershipRepository, never()).addMembership(anyString(), anyString());
    }
}
