package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.dto.GoalProgress;
import com.aiinpocket.ngplus.model.dto.GoalProgressRequest;
import com.aiinpocket.ngplus.model.dto.GoalRequest;
import com.aiinpocket.ngplus.model.entity.Goal;
import com.aiinpocket.ngplus.model.enums.GoalStatus;
import com.aiinpocket.ngplus.service.GoalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/goals")
@RequiredArgsConstructor
public class GoalController {

    private final GoalService goalService;

    @GetMapping
    public List<Goal> list(@RequestParam(required = false) String status) {
        return goalService.list(parseStatus(status));
    }

    @GetMapping("/{id}")
    public Goal get(@PathVariable String id) {
        return goalService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GoalProgress create(@Valid @RequestBody GoalRequest request) {
        return goalService.createGoal(request);
    }

    @PostMapping("/{id}/progress")
    public GoalProgress progress(@PathVariable String id, @Valid @RequestBody GoalProgressRequest request) {
        return goalService.updateProgress(id, request.value());
    }

    @PostMapping("/{id}/archive")
    public Goal archive(@PathVariable String id) {
        return goalService.archive(id);
    }

    @PostMapping("/refresh")
    public List<GoalProgress> refresh() {
        return goalService.refreshActive();
    }

    private static GoalStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return GoalStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unrecognized goal status: " + status);
        }
    }
}
