package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.CadenceRequest;
import com.aiinpocket.ngplus.model.dto.SkillMetrics;
import com.aiinpocket.ngplus.model.dto.SkillRequest;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.service.MissionService;
import com.aiinpocket.ngplus.service.SkillMetricsService;
import com.aiinpocket.ngplus.service.SkillService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/skills")
@RequiredArgsConstructor
public class SkillController {

    private final SkillService skillService;
    private final MissionService missionService;
    private final SkillMetricsService metricsService;

    @GetMapping
    public List<Skill> list() {
        return skillService.listActive();
    }

    @GetMapping("/{id}")
    public Skill get(@PathVariable String id) {
        return skillService.get(id);
    }

    @GetMapping("/{id}/metrics")
    public SkillMetrics metrics(@PathVariable String id) {
        return metricsService.metrics(id);
    }

    @GetMapping("/{id}/missions")
    public List<Mission> missions(@PathVariable String id) {
        skillService.get(id);
        return missionService.assignedTo(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Skill create(@Valid @RequestBody SkillRequest request) {
        return skillService.createSkill(request);
    }

    @PutMapping("/{id}")
    public Skill update(@PathVariable String id, @RequestBody SkillRequest request) {
        return skillService.updateSkill(id, request);
    }

    @PostMapping("/{id}/focus")
    public Skill toggleFocus(@PathVariable String id) {
        return skillService.toggleFocus(id);
    }

    @PutMapping("/{id}/cadence")
    public Skill setCadence(@PathVariable String id, @Valid @RequestBody CadenceRequest request) {
        return skillService.setCadence(id, request);
    }

    @PostMapping("/{id}/archive")
    public Skill archive(@PathVariable String id) {
        return skillService.setArchived(id, true);
    }

    @PostMapping("/{id}/restore")
    public Skill restore(@PathVariable String id) {
        return skillService.setArchived(id, false);
    }

    @PostMapping("/rollover")
    public Map<String, Integer> rollover() {
        return Map.of("rolledOver", skillService.rolloverNow());
    }
}
