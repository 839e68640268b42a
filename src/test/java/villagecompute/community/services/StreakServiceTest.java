package villagecompute.community.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.community.api.types.StreakSummaryType;
import villagecompute.community.api.types.StreakUpdateType;
import villagecompute.community.data.models.StreakType;
import villagecompute.community.data.models.UserStreak;
import villagecompute.community.data.repositories.UserStreakRepository;

/**
 * Unit tests for {@link StreakService}.
 */
class StreakServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);
    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    UserStreakRepository streakRepository;

    @Mock
    PointsService pointsService;

    @InjectMocks
    StreakService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        service.clock = Clock.fixed(Instant.parse("2026-03-10T15:30:00Z"), ZoneOffset.UTC);
    }

    @Test
    void testAdvance_firstActivityStartsAtOne() {
        UserStreak streak = UserStreak.start(USER_ID, StreakType.LOGIN);

        assertTrue(service.advance(streak, TODAY));
        assertEquals(1, streak.currentCount);
        assertEquals(1, streak.longestCount);
        assertEquals(TODAY, streak.lastActivityDate);
    }

    @Test
    void testAdvance_sameDayIsNoOp() {
        UserStreak streak = streak(4, 6, TODAY);

        assertFalse(service.advance(streak, TODAY));
        assertEquals(4, streak.currentCount);
    }

    @Test
    void testAdvance_consecutiveDayExtends() {
        UserStreak streak = streak(6, 6, TODAY.minusDays(1));

        service.advance(streak, TODAY);

        assertEquals(7, streak.currentCount);
        assertEquals(7, streak.longestCount);
    }

    @Test
    void testAdvance_gapResetsButKeepsLongest() {
        UserStreak streak = streak(12, 12, TODAY.minusDays(3));

        service.advance(streak, TODAY);

        assertEquals(1, streak.currentCount);
        assertEquals(12, streak.longestCount);
    }

    @Test
    void testRecordActivity_milestoneAwardsPoints() {
        UserStreak streak = streak(6, 6, TODAY.minusDays(1));
        when(streakRepository.findForUpdate(USER_ID, StreakType.LOGIN)).thenReturn(Optional.of(streak));

        StreakUpdateType update = service.recordActivity(USER_ID, StreakType.LOGIN);

        assertTrue(update.reachedMilestone());
        assertEquals("Weekly Warrior", update.milestoneTitle());
        assertEquals(25, update.milestonePoints());
        verify(pointsService).addPoints(USER_ID, 25, "7-day login streak: Weekly Warrior");
        verify(streakRepository).persist(streak);
    }

    @Test
    void testRecordActivity_postMilestone() {
        UserStreak streak = streak(13, 13, TODAY.minusDays(1));
        streak.streakType = StreakType.POST;
        when(streakRepository.findForUpdate(USER_ID, StreakType.POST)).thenReturn(Optional.of(streak));

        StreakUpdateType update = service.recordActivity(USER_ID, StreakType.POST);

        assertEquals(14, update.current());
        assertEquals(70, update.milestonePoints());
    }

    @Test
    void testRecordActivity_noMilestone() {
        when(streakRepository.findForUpdate(USER_ID, StreakType.LOGIN)).thenReturn(Optional.of(streak(0, 0, null)));

        StreakUpdateType update = service.recordActivity(USER_ID, StreakType.LOGIN);

        assertEquals(1, update.current());
        assertTrue(update.advanced());
        assertNull(update.milestoneTitle());
        verify(streakRepository).persist(any(UserStreak.class));
        verify(pointsService, never()).addPoints(any(), anyInt(), anyString());
    }

    @Test
    void testRecordActivity_repeatSameDay_doesNotPayTwice() {
        UserStreak streak = streak(7, 7, TODAY);
        when(streakRepository.findForUpdate(USER_ID, StreakType.LOGIN)).thenReturn(Optional.of(streak));

        StreakUpdateType update = service.recordActivity(USER_ID, StreakType.LOGIN);

        assertFalse(update.advanced());
        verify(pointsService, never()).addPoints(any(), anyInt(), anyString());
    }

    @Test
    void testRecordActivity_firstActivity_insertsRowBeforeLocking() {
        when(streakRepository.findForUpdate(USER_ID, StreakType.LOGIN)).thenReturn(Optional.of(streak(0, 0, null)));

        service.recordActivity(USER_ID, StreakType.LOGIN);

        InOrder order = inOrder(streakRepository);
        order.verify(streakRepository).insertIfAbsent(USER_ID, StreakType.LOGIN);
        order.verify(streakRepository).findForUpdate(USER_ID, StreakType.LOGIN);
    }

    @Test
    void testRecordActivity_rowMissingAfterInsert_throws() {
        when(streakRepository.findForUpdate(USER_ID, StreakType.LOGIN)).thenReturn(Optional.empty());

        assertThrows(IllegalStateException.class, () -> service.recordActivity(USER_ID, StreakType.LOGIN));
        verify(streakRepository, never()).persist(any(UserStreak.class));
    }

    @Test
    void testResetBrokenLoginStreaks_usesYesterdayCutoff() {
        when(streakRepository.resetInactiveSince(StreakType.LOGIN, TODAY.minusDays(1))).thenReturn(3);

        assertEquals(3, service.resetBrokenLoginStreaks(TODAY));
    }

    @Test
    void testGetStreakSummary_fillsMissingTypesWithZeros() {
        UserStreak login = streak(4, 9, TODAY);
        when(streakRepository.findByUser(USER_ID)).thenReturn(List.of(login));

        Map<StreakType, StreakSummaryType> summary = service.getStreakSummary(USER_ID);

        assertEquals(StreakType.values().length, summary.size());
        assertEquals(4, summary.get(StreakType.LOGIN).current());
        assertEquals(9, summary.get(StreakType.LOGIN).longest());
        assertEquals(TODAY, summary.get(StreakType.LOGIN).lastActivityDate());
        assertEquals(StreakSummaryType.empty(StreakType.CHALLENGE), summary.get(StreakType.CHALLENGE));
    }

    @Test
    void testGetStreakSummary_noStreaks_allZero() {
        when(streakRepository.findByUser(USER_ID)).thenReturn(List.of());

        Map<StreakType, StreakSummaryType> summary = service.getStreakSummary(USER_ID);

        assertTrue(summary.values().stream().allMatch(s -> s.current() == 0 && s.longest() == 0));
    }

    private static UserStreak streak(int current, int longest, LocalDate last) {
        UserStreak streak = UserStreak.start(USER_ID, StreakType.LOGIN);
        streak.currentCount = current;
        streak.longestCount = longest;
        streak.lastActivityDate = last;
        return streak;
    }
}
