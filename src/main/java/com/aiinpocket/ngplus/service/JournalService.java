package com.aiinpocket.ngplus.service;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.MissionNotFoundException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.model.dto.JournalRequest;
import com.aiinpocket.ngplus.model.entity.JournalEntry;
import com.aiinpocket.ngplus.repository.JournalEntryRepository;
import com.aiinpocket.ngplus.repository.MissionRepository;
import com.aiinpocket.ngplus.repository.SkillRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalEntryRepository journalRepo;
    private final SkillRepository skillRepo;
    private final MissionRepository missionRepo;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<JournalEntry> list(String skillId) {
        return skillId == null
                ? journalRepo.findAllByOrderByCreatedAtDesc()
                : journalRepo.findBySkillIdOrderByCreatedAtDesc(skillId);
    }

    @Transactional
    public JournalEntry write(JournalRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            throw new InvalidInputException("Journal text is required");
        }
        if (request.skillId() != null && !skillRepo.existsById(request.skillId())) {
            throw NotFoundException.skill(request.skillId());
        }
        if (request.missionId() != null && !missionRepo.existsById(request.missionId())) {
            throw new MissionNotFoundException(request.missionId());
        }
        JournalEntry entry = journalRepo.save(JournalEntry.builder()
                .text(request.text())
                .skillId(request.skillId())
                .missionId(request.missionId())
                .reflection(request.reflection())
                .createdAt(clock.instant())
                .build());
        log.debug("[日誌] 寫入 {} (技能 {}，反思 {})", entry.getId(), entry.getSkillId(), entry.isReflection());
        return entry;
    }

    @Transactional
    public JournalEntry edit(String entryId, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Journal text is required");
        }
        JournalEntry entry = journalRepo.findById(entryId).orElseThrow(() -> NotFoundException.journalEntry(entryId));
        entry.setText(text);
        entry.setEditedAt(clock.instant());
        return journalRepo.save(entry);
    }

    @Transactional
    public void delete(String entryId) {
        JournalEntry entry = journalRepo.findById(entryId).orElseThrow(() -> NotFoundException.journalEntry(entryId));
        journalRepo.delete(entry);
    }
}
