package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.model.dto.GameSnapshot;
import com.aiinpocket.ngplus.service.SnapshotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/snapshot")
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotService snapshotService;

    @GetMapping
    public GameSnapshot export() {
        return snapshotService.exportSnapshot();
    }

    @PostMapping
    public ResponseEntity<Void> importSnapshot(@RequestBody GameSnapshot snapshot,
                                               @RequestParam(defaultValue = "false") boolean merge) {
        snapshotService.importSnapshot(snapshot, merge);
        return ResponseEntity.noContent().build();
    }
}
