package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.exception.InvalidDifficultyException;
import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.InvalidLevelException;
import com.aiinpocket.ngplus.model.dto.LevelUpResult;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator.Award;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProgressionCalculatorTest {

    @Test
    void thresholdMatchesKnownValues() {
        assertEquals(120, ProgressionCalculator.xpThreshold(1));
        assertEquals(340, ProgressionCalculator.xpThreshold(2));
        assertEquals(624, ProgressionCalculator.xpThreshold(3));
        assertEquals(960, ProgressionCalculator.xpThreshold(4));
        assertEquals(3240, ProgressionCalculator.xpThreshold(9));
    }

    @Test
    void thresholdIsCeilingOfCurveAndStrictlyIncreasing() {
        long previous = 0;
        for (int level = 1; level <= 2000; level++) {
            long threshold = ProgressionCalculator.xpThreshold(level);
            double exact = 120 * Math.pow(level, 1.5);
            assertTrue(threshold >= exact - 1e-6 && threshold < exact + 1, "level " + level);
            assertTrue(threshold > previous, "not increasing at level " + level);
            previous = threshold;
        }
    }

    @Test
    void rewardsScaleWithDifficulty() {
        for (int d = 1; d <= 5; d++) {
            Award base = ProgressionCalculator.baseReward(d);
            Award bonus = ProgressionCalculator.cycleBonus(d);
            assertEquals(4L * d, base.playerXp());
            assertEquals(8L * d, base.skillXp());
            assertEquals(2L * d, base.coins());
            assertEquals(10 * base.playerXp(), bonus.playerXp());
            assertEquals(80L * d, bonus.skillXp());
            assertEquals(0, bonus.coins());
        }
    }

    @Test
    void rejectsOutOfRangeDifficultyAndLevel() {
        assertThrows(InvalidDifficultyException.class, () -> ProgressionCalculator.baseReward(0));
        assertThrows(InvalidDifficultyException.class, () -> ProgressionCalculator.cycleBonus(6));
        assertThrows(InvalidLevelException.class, () -> ProgressionCalculator.xpThreshold(0));
        assertThrows(InvalidInputException.class, () -> ProgressionCalculator.applyXp(1, 0, -5, false));
    }

    @Test
    void largeAwardCascadesAndCarriesRemainder() {
        LevelUpResult result = ProgressionCalculator.applyXp(1, 0, 1000, false);

        assertTrue(result.leveledUp());
        assertEquals(1, result.oldLevel());
        assertEquals(3, result.newLevel());
        assertEquals(1000 - 120 - 340, result.currentXp());
        assertEquals(624 - result.currentXp(), result.xpToNextLevel());
    }

    @Test
    void exactThresholdLevelsUpWithZeroRemainder() {
        LevelUpResult result = ProgressionCalculator.applyXp(1, 100, 20, false);

        assertEquals(2, result.newLevel());
        assertEquals(0, result.currentXp());
    }

    @Test
    void focusDoublesThreshold() {
        LevelUpResult focused = ProgressionCalculator.applyXp(1, 0, 200, true);
        assertFalse(focused.leveledUp());
        assertEquals(200, focused.currentXp());
        assertEquals(40, focused.xpToNextLevel());

        LevelUpResult released = ProgressionCalculator.resolveLevelUps(1, 200, false);
        assertTrue(released.leveledUp());
        assertEquals(2, released.newLevel());
        assertEquals(80, released.currentXp());
    }
}
