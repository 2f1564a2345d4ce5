package com.aiinpocket.ngplus.model.entity;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class StreakTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Test
    void firstCompletionStartsAtOne() {
        Streak streak = Streak.builder().build();

        assertTrue(streak.record(MONDAY));

        assertEquals(1, streak.getCurrentStreak());
        assertEquals(1, streak.getLongestStreak());
        assertEquals(MONDAY, streak.getLastCompletionDate());
    }

    @Test
    void consecutiveDaysExtendAndSameDayIsNoop() {
        Streak streak = Streak.builder().build();
        streak.record(MONDAY);
        streak.record(MONDAY);
        streak.record(MONDAY.plusDays(1));
        streak.record(MONDAY.plusDays(2));

        assertEquals(3, streak.getCurrentStreak());
        assertEquals(3, streak.getLongestStreak());
    }

    @Test
    void gapRestartsButKeepsLongest() {
        Streak streak = Streak.builder().build();
        streak.record(MONDAY);
        streak.record(MONDAY.plusDays(1));

        assertFalse(streak.record(MONDAY.plusDays(3)));

        assertEquals(1, streak.getCurrentStreak());
        assertEquals(2, streak.getLongestStreak());
        assertEquals(MONDAY.plusDays(3), streak.getLastCompletionDate());
    }

    @Test
    void lateCompletionForEarlierDayChangesNothing() {
        Streak streak = Streak.builder().build();
        streak.record(MONDAY.plusDays(1));

        assertTrue(streak.record(MONDAY));

        assertEquals(1, streak.getCurrentStreak());
        assertEquals(MONDAY.plusDays(1), streak.getLastCompletionDate());
    }

    @Test
    void activityAndRiskByDay() {
        Streak streak = Streak.builder().build();
        assertFalse(streak.isActive(MONDAY));
        assertEquals(0, streak.daysUntilBroken(MONDAY));

        streak.record(MONDAY);
        streak.record(MONDAY.plusDays(1));

        assertEquals(1, streak.daysUntilBroken(MONDAY.plusDays(1)));
        assertEquals(0, streak.daysUntilBroken(MONDAY.plusDays(2)));
        assertEquals(-1, streak.daysUntilBroken(MONDAY.plusDays(3)));
        assertTrue(streak.isActive(MONDAY.plusDays(2)));
        assertFalse(streak.isActive(MONDAY.plusDays(3)));
        assertEquals(2, streak.effectiveStreak(MONDAY.plusDays(2)));
        assertEquals(0, streak.effectiveStreak(MONDAY.plusDays(3)));
    }
}
