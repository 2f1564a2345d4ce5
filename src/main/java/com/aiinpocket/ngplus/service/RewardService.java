package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.RewardRequest;
import com.aiinpocket.ngplus.model.entity.Player;
import com.aiinpocket.ngplus.model.entity.Redemption;
import com.aiinpocket.ngplus.model.entity.Reward;
import com.aiinpocket.ngplus.model.event.RewardRedeemed;
import com.aiinpocket.ngplus.repository.PlayerRepository;
import com.aiinpocket.ngplus.repository.RedemptionRepository;
import com.aiinpocket.ngplus.repository.RewardRepository;
import com.aiinpocket.ngplus.service.progression.CompletionLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 獎勵商店。兌換是唯一會減少金幣的操作。
 *
 * <p>規則：
 * <ul>
 *   <li>價格為非負金幣數，允許免費獎勵</li>
 *   <li>已封存的獎勵不可兌換</li>
 *   <li>餘額不會變成負數</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardService {

    private final RewardRepository rewardRepo;
    private final RedemptionRepository redemptionRepo;
    private final PlayerRepository playerRepo;
    private final PlayerService playerService;
    private final CompletionLockService lockService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<Reward> listActive() {
        return rewardRepo.findByArchivedFalseOrderByPriceCoinsAsc();
    }

    @Transactional(readOnly = true)
    public List<Redemption> history() {
        return redemptionRepo.findAllByOrderByRedeemedAtDesc();
    }

    @Transactional(readOnly = true)
    public Reward get(String rewardId) {
        return rewardRepo.findById(rewardId).orElseThrow(() -> NotFoundException.reward(rewardId));
    }

    @Transactional
    public Reward createReward(RewardRequest request) {
        validate(request);
        Reward reward = rewardRepo.save(Reward.builder()
                .title(request.title().trim())
                .priceCoins(request.priceCoins())
                .note(request.note())
                .createdAt(clock.instant())
                .build());
        log.info("[獎勵] 建立 {}，價格 {} 金幣", reward.getTitle(), reward.getPriceCoins());
        return reward;
    }

    @Transactional
    public Reward updateReward(String rewardId, RewardRequest request) {
        validate(request);
        Reward reward = get(rewardId);
        reward.setTitle(request.title().trim());
        reward.setPriceCoins(request.priceCoins());
        reward.setNote(request.note());
        return rewardRepo.save(reward);
    }

    @Transactional
    public Reward setArchived(String rewardId, boolean archived) {
        Reward reward = get(rewardId);
        reward.setArchived(archived);
        return rewardRepo.save(reward);
    }

    /**
     * 花費金幣兌換獎勵。
     *
     * @throws StateViolationException 獎勵已封存或金幣不足
     */
    public Redemption redeem(String rewardId, String note) {
        return lockService.executeWithLock("redemption of " + rewardId, () -> spend(rewardId, note));
    }

    private Redemption spend(String rewardId, String note) {
        Reward reward = get(rewardId);
        if (reward.isArchived()) {
            throw new StateViolationException("Reward is archived: " + reward.getTitle());
        }
        Player player = playerService.currentPlayer();
        if (player.getCoins() < reward.getPriceCoins()) {
            log.warn("[獎勵] 兌換 {} 被拒: 需要 {} 金幣，持有 {}",
                    reward.getTitle(), reward.getPriceCoins(), player.getCoins());
            throw new StateViolationException(String.format(
                    "Not enough coins: %d needed, %d held", reward.getPriceCoins(), player.getCoins()));
        }

        Instant now = clock.instant();
        player.setCoins(player.getCoins() - reward.getPriceCoins());
        playerRepo.save(player);
        reward.setTimesRedeemed(reward.getTimesRedeemed() + 1);
        rewardRepo.save(reward);

        Redemption redemption = redemptionRepo.save(Redemption.builder()
                .rewardId(reward.getId())
                .coinsSpent(reward.getPriceCoins())
                .redeemedAt(now)
                .note(note)
                .build());
        log.info("[獎勵] 兌換 {} 花費 {} 金幣，餘額 {}",
                reward.getTitle(), reward.getPriceCoins(), player.getCoins());

        eventPublisher.publishEvent(new RewardRedeemed(redemption.getId(), reward.getId(),
                reward.getTitle(), reward.getPriceCoins(), now));
        return redemption;
    }

    private static void validate(RewardRequest request) {
        if (request.title() == null || request.title().isBlank()) {
            throw new InvalidInputException("Reward title is required");
        }
        if (request.priceCoins() < 0) {
            throw new InvalidInputException("Price must not be negative, got " + request.priceCoins());
        }
    }
}
