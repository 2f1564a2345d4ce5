package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.Suggestion;
import com.aiinpocket.ngplus.service.navigator.NavigatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/navigator")
@RequiredArgsConstructor
public class NavigatorController {

    private final NavigatorService navigatorService;

    @GetMapping("/suggestions")
    public List<Suggestion> suggestions() {
        return navigatorService.currentSuggestions();
    }

    @PostMapping("/refresh")
    public List<Suggestion> refresh() {
        return navigatorService.refresh();
    }
}
