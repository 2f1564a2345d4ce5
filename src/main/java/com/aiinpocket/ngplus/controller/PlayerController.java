package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.PlayerProfile;
import com.aiinpocket.ngplus.model.dto.PlayerSettingsRequest;
import com.aiinpocket.ngplus.service.PlayerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/player")
@RequiredArgsConstructor
public class PlayerController {

    private final PlayerService playerService;

    @GetMapping("/profile")
    public PlayerProfile getProfile() {
        return playerService.profile();
    }

    @PutMapping("/settings")
    public PlayerProfile updateSettings(@Valid @RequestBody PlayerSettingsRequest request) {
        playerService.updateSettings(request);
        return playerService.profile();
    }
}
