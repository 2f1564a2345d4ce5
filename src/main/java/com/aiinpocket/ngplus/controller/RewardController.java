package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.RedeemRequest;
import com.aiinpocket.ngplus.model.dto.RewardRequest;
import com.aiinpocket.ngplus.model.entity.Redemption;
import com.aiinpocket.ngplus.model.entity.Reward;
import com.aiinpocket.ngplus.service.RewardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/rewards")
@RequiredArgsConstructor
public class RewardController {

    private final RewardService rewardService;

    @GetMapping
    public List<Reward> list() {
        return rewardService.listActive();
    }

    @GetMapping("/redemptions")
    public List<Redemption> history() {
        return rewardService.history();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Reward create(@Valid @RequestBody RewardRequest request) {
        return rewardService.createReward(request);
    }

    @PutMapping("/{id}")
    public Reward update(@PathVariable String id, @Valid @RequestBody RewardRequest request) {
        return rewardService.updateReward(id, request);
    }

    @PostMapping("/{id}/archive")
    public Reward archive(@PathVariable String id) {
        return rewardService.setArchived(id, true);
    }

    @PostMapping("/{id}/redeem")
    public Redemption redeem(@PathVariable String id, @Valid @RequestBody(required = false) RedeemRequest request) {
        return rewardService.redeem(id, request != null ? request.note() : null);
    }
}
