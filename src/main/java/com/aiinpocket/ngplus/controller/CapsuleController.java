package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.CapsuleRequest;
import com.aiinpocket.ngplus.model.entity.JournalEntry;
import com.aiinpocket.ngplus.service.capsule.CapsuleService;
import com.aiinpocket.ngplus.service.capsule.CapsuleService.CapsuleView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/capsules")
@RequiredArgsConstructor
public class CapsuleController {

    private final CapsuleService capsuleService;

    @GetMapping
    public List<CapsuleView> list() {
        return capsuleService.list();
    }

    @GetMapping("/{id}")
    public CapsuleView get(@PathVariable String id) {
        return capsuleService.view(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CapsuleView seal(@Valid @RequestBody CapsuleRequest request) {
        return capsuleService.view(capsuleService.seal(request).getId());
    }

    @PostMapping("/{id}/archive")
    public JournalEntry archive(@PathVariable String id) {
        return capsuleService.archiveToJournal(id);
    }

    @PostMapping("/check")
    public ResponseEntity<Void> check() {
        capsuleService.tick();
        return ResponseEntity.ok().build();
    }
}
