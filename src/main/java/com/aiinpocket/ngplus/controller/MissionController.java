package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.CompletionResult;
import com.aiinpocket.ngplus.model.dto.MissionRequest;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.service.MissionService;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/missions")
@RequiredArgsConstructor
public class MissionController {

    private final MissionService missionService;
    private final CompletionProcessor completionProcessor;

    @GetMapping
    public List<Mission> list(@RequestParam(defaultValue = "false") boolean includeArchived) {
        return missionService.list(includeArchived);
    }

    @GetMapping("/{id}")
    public Mission get(@PathVariable String id) {
        return missionService.get(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mission create(@Valid @RequestBody MissionRequest request) {
        return missionService.createMission(request);
    }

    @PutMapping("/{id}")
    public Mission update(@PathVariable String id, @Valid @RequestBody MissionRequest request) {
        return missionService.updateMission(id, request);
    }

    @PostMapping("/{id}/archive")
    public Mission archive(@PathVariable String id) {
        return missionService.setArchived(id, true);
    }

    @PostMapping("/{id}/restore")
    public Mission restore(@PathVariable String id) {
        return missionService.setArchived(id, false);
    }

    @PostMapping("/{id}/complete")
    public CompletionResult complete(@PathVariable String id) {
        return completionProcessor.completeMission(id);
    }
}
