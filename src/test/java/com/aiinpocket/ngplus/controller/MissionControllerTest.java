package com.aiinpocket.ngplus.controller;

import com.aiinpocket.ngplus.exception.ConcurrencyConflictException;
import com.aiinpocket.ngplus.exception.InvalidDifficultyException;
import com.aiinpocket.ngplus.exception.MissionArchivedException;
import com.aiinpocket.ngplus.exception.MissionNotFoundException;
import com.aiinpocket.ngplus.model.dto.CompletionResult;
import com.aiinpocket.ngplus.model.dto.LevelUpResult;
import com.aiinpocket.ngplus.service.MissionService;
import com.aiinpocket.ngplus.service.progression.CompletionProcessor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MissionController.class)
class MissionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MissionService missionService;

    @MockitoBean
    private CompletionProcessor completionProcessor;

    @Test
    void completeReturnsAwards() throws Exception {
        when(completionProcessor.completeMission("m1")).thenReturn(new CompletionResult(
                "c1", "m1", Instant.parse("2026-03-04T12:00:00Z"), 12, 6, false, null,
                new LevelUpResult(false, 1, 1, 12, 108), List.of()));

        mockMvc.perform(post("/api/missions/m1/complete"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerXp").value(12))
                .andExpect(jsonPath("$.coins").value(6));
    }

    @Test
    void unknownMissionIs404() throws Exception {
        when(completionProcessor.completeMission("nope")).thenThrow(new MissionNotFoundException("nope"));

        mockMvc.perform(post("/api/missions/nope/complete"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Mission not found: nope"));
    }

    @Test
    void archivedMissionIs409() throws Exception {
        when(completionProcessor.completeMission("old")).thenThrow(new MissionArchivedException("old"));

        mockMvc.perform(post("/api/missions/old/complete"))
                .andExpect(status().isConflict());
    }

    @Test
    void lockTimeoutIs409() throws Exception {
        when(completionProcessor.completeMission("busy")).thenThrow(new ConcurrencyConflictException("lock timeout"));

        mockMvc.perform(post("/api/missions/busy/complete"))
                .andExpect(status().isConflict());
    }

    @Test
    void invalidDifficultyIs400() throws Exception {
        when(missionService.createMission(any())).thenThrow(new InvalidDifficultyException(9));

        mockMvc.perform(post("/api/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Essay\",\"difficulty\":9,\"energy\":3,\"skillIds\":[\"s1\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Difficulty must be 1-5, got 9"));
    }

    @Test
    void blankTitleFailsValidation() throws Exception {
        mockMvc.perform(post("/api/missions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"\",\"difficulty\":2,\"energy\":3,\"skillIds\":[\"s1\"]}"))
                .andExpect(status().isBadRequest());
    }
}
