package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.exception.InvalidDifficultyException;
import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.InvalidLevelException;
import com.aiinpocket.ngplus.model.dto.LevelUpResult;

import java.math.BigInteger;

/**
 * 經驗值曲線、獎勵計算與升級結算。無狀態，所有數值由呼叫端傳入。
 *
 * <p>難度 D 的獎勵：
 * <ul>
 *   <li>基礎：玩家經驗 4D，每個關聯技能經驗 8D，金幣 2D</li>
 *   <li>週期獎勵：玩家經驗 40D，目標技能經驗 80D，無金幣</li>
 * </ul>
 */
public final class ProgressionCalculator {

    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 5;

    private static final long BASE_PLAYER_XP_PER_D = 4;
    private static final long BASE_SKILL_XP_PER_D = 8;
    private static final long BASE_COINS_PER_D = 2;
    private static final long CYCLE_PLAYER_XP_PER_D = 40;
    private static final long CYCLE_SKILL_XP_PER_D = 80;

    private static final BigInteger THRESHOLD_SQUARE_FACTOR = BigInteger.valueOf(120L * 120L);

    private ProgressionCalculator() {
    }

    public record Award(long playerXp, long skillXp, long coins) {}

    /**
     * 計算從 {@code level} 升到下一級所需經驗值：ceil(120 * level^1.5)。
     * 以整數計算 ceil(sqrt(14400 * level^3))，避免捨入誤差破壞單調性。
     */
    public static long xpThreshold(int level) {
        requireLevel(level);
        BigInteger l = BigInteger.valueOf(level);
        BigInteger square = THRESHOLD_SQUARE_FACTOR.multiply(l.pow(3));
        BigInteger root = square.sqrt();
        if (!root.multiply(root).equals(square)) {
            root = root.add(BigInteger.ONE);
        }
        return root.longValueExact();
    }

    /** 專注模式下每級門檻加倍 */
    public static long effectiveThreshold(int level, boolean focus) {
        long threshold = xpThreshold(level);
        return focus ? Math.multiplyExact(threshold, 2L) : threshold;
    }

    public static Award baseReward(int difficulty) {
        requireDifficulty(difficulty);
        return new Award(
                BASE_PLAYER_XP_PER_D * difficulty,
                BASE_SKILL_XP_PER_D * difficulty,
                BASE_COINS_PER_D * difficulty);
    }

    public static Award cycleBonus(int difficulty) {
        requireDifficulty(difficulty);
        return new Award(
                CYCLE_PLAYER_XP_PER_D * difficulty,
                CYCLE_SKILL_XP_PER_D * difficulty,
                0L);
    }

    /**
     * 將 {@code award} 加入 {@code xp} 並結算所有可升的等級。
     * 超出最後門檻的餘數保留。
     */
    public static LevelUpResult applyXp(int level, long xp, long award, boolean focus) {
        if (award < 0) {
            throw new InvalidInputException("XP award must not be negative, got " + award);
        }
        return resolveLevelUps(level, Math.addExact(xp, award), focus);
    }

    /**
     * 經驗值足夠（含專注加倍）時連續升級。
     * 關閉專注後以零獎勵呼叫，可恢復 {@code xp < threshold}。
     */
    public static LevelUpResult resolveLevelUps(int level, long xp, boolean focus) {
        requireLevel(level);
        if (xp < 0) {
            throw new InvalidInputException("XP must not be negative, got " + xp);
        }
        int newLevel = level;
        long remaining = xp;
        long threshold = effectiveThreshold(newLevel, focus);
        while (remaining >= threshold) {
            remaining -= threshold;
            newLevel++;
            threshold = effectiveThreshold(newLevel, focus);
        }
        return new LevelUpResult(newLevel > level, level, newLevel, remaining, threshold - remaining);
    }

    public static void requireDifficulty(int difficulty) {
        if (difficulty < MIN_DIFFICULTY || difficulty > MAX_DIFFICULTY) {
            throw new InvalidDifficultyException(difficulty);
        }
    }

    private static void requireLevel(int level) {
        if (level < 1) {
            throw new InvalidLevelException(level);
        }
    }
}
