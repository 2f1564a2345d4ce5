package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.JournalRequest;
import com.aiinpocket.ngplus.model.entity.JournalEntry;
import com.aiinpocket.ngplus.service.JournalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/journal")
@RequiredArgsConstructor
public class JournalController {

    private final JournalService journalService;

    @GetMapping
    public List<JournalEntry> list(@RequestParam(required = false) String skillId) {
        return journalService.list(skillId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public JournalEntry write(@Valid @RequestBody JournalRequest request) {
        return journalService.write(request);
    }

    @PutMapping("/{id}")
    public JournalEntry edit(@PathVariable String id, @RequestBody Map<String, String> body) {
        return journalService.edit(id, body.get("text"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        journalService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
