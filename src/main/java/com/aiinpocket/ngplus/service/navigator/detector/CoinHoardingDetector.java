package com.aiinpocket.ngplus.service.navigator.detector;

import com.aiinpocket.ngplus.config.ProgressionProperties.NavigatorParams;
import com.aiinpocket.ngplus.model.enums.PatternKind;
import com.aiinpocket.ngplus.service.navigator.DetectedPattern;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot;
import com.aiinpocket.ngplus.service.navigator.NavigatorSnapshot.RewardView;
import com.aiinpocket.ngplus.service.navigator.PatternDetector;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * 金幣囤積：沒有可兌換的獎勵，或在回顧期間內持有數倍於最便宜獎勵的金幣
 * 卻未曾兌換。
 */
@Component
public class CoinHoardingDetector implements PatternDetector {

    private static final String SUBJECT = "coins";

    @Override
    public PatternKind getKind() {
        return PatternKind.COIN_HOARDING;
    }

    @Override
    public Optional<DetectedPattern> detect(NavigatorSnapshot snapshot) {
        NavigatorParams params = snapshot.params();
        long coins = snapshot.coins();

        if (snapshot.activeRewards().isEmpty()) {
            if (coins > params.noRewardsCoinFloor()) {
                return Optional.of(new DetectedPattern(getKind(), SUBJECT, 0.8,
                        String.format("You have %d coins and no rewards to spend them on.", coins),
                        snapshot.lastRedemption()));
            }
            return Optional.empty();
        }

        Optional<RewardView> cheapest = snapshot.activeRewards().stream()
                .filter(r -> r.priceCoins() > 0)
                .min(Comparator.comparingLong(RewardView::priceCoins));
        if (cheapest.isEmpty()) {
            return Optional.empty();
        }
        long price = cheapest.get().priceCoins();
        double ratio = (double) coins / price;
        if (ratio < params.hoardingMultiple()) {
            return Optional.empty();
        }
        Instant cutoff = snapshot.now().minus(Duration.ofDays(params.redemptionLookbackDays()));
        if (snapshot.lastRedemption() != null && snapshot.lastRedemption().isAfter(cutoff)) {
            return Optional.empty();
        }
        double confidence = Math.min(1.0, 0.4 + 0.1 * (ratio - params.hoardingMultiple()));
        String message = String.format("You have %d coins, enough for \"%s\" %d times over.",
                coins, cheapest.get().title(), coins / price);
        return Optional.of(new DetectedPattern(getKind(), SUBJECT, confidence, message, snapshot.lastRedemption()));
    }
}
