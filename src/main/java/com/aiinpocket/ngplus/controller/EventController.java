package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.entity.GameEventLog;
import com.aiinpocket.ngplus.service.GameEventService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final GameEventService gameEventService;

    @GetMapping
    public List<GameEventLog> events(@RequestParam(defaultValue = "true") boolean unseenOnly) {
        return unseenOnly ? gameEventService.unseen() : gameEventService.recent();
    }

    @PostMapping("/seen")
    public Map<String, Integer> markSeen() {
        return Map.of("marked", gameEventService.markAllSeen());
    }
}
