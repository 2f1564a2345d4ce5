package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static com.aiinpocket.ngplus.service.navigator.SnapshotFixture.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class CoinHoardingDetectorTest {

    private final CoinHoardingDetector detector = new CoinHoardingDetector();

    @Test
    void noRewardsAboveFloor() {
        assertEquals(0.8, detector.detect(snapshot().coins(51).build()).orElseThrow().confidence());
        assertTrue(detector.detect(snapshot().coins(50).build()).isEmpty());
    }

    @Test
    void severalTimesCheapestRewardWithoutRecentRedemption() {
        Optional<DetectedPattern> pattern = detector.detect(snapshot()
                .coins(500).reward("Movie", 100).reward("Book", 250)
                .lastRedemption(Duration.ofDays(45))
                .build());

        assertEquals("coins", pattern.orElseThrow().subject());
        assertEquals(0.6, pattern.get().confidence(), 1e-9);
    }

    @Test
    void recentRedemptionOrSmallBalanceIsFine() {
        assertTrue(detector.detect(snapshot().coins(500).reward("Movie", 100)
                .lastRedemption(Duration.ofDays(3)).build()).isEmpty());
        assertTrue(detector.detect(snapshot().coins(299).reward("Movie", 100).build()).isEmpty());
    }

    @Test
    void onlyFreeRewardsNeverFire() {
        assertTrue(detector.detect(snapshot().coins(10_000).reward("Walk", 0).build()).isEmpty());
    }
}
