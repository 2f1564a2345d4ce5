package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.StreakStatus;
import com.aiinpocket.ngplus.service.StreakService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/streaks")
@RequiredArgsConstructor
public class StreakController {

    private final StreakService streakService;

    @GetMapping
    public StreakStatus status() {
        return streakService.status();
    }
}
