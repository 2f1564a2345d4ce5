package com.aiinpocket.ngplus.service.capsule;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.CapsuleRequest;
import com.aiinpocket.ngplus.model.dto.JournalRequest;
import com.aiinpocket.ngplus.model.entity.JournalEntry;
import com.aiinpocket.ngplus.model.entity.TimeCapsule;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.aiinpocket.ngplus.model.event.DateTick;
import com.aiinpocket.ngplus.repository.TimeCapsuleRepository;
import com.aiinpocket.ngplus.service.JournalService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class CapsuleService {

    private final TimeCapsuleRepository capsuleRepo;
    private final JournalService journalService;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** 玩家看到的膠囊：解鎖前不顯示內容 */
    public record CapsuleView(
            String id,
            String title,
            String body,
            boolean encrypted,
            String passphraseHint,
            UnlockType unlockType,
            String unlockParams,
            Instant createdAt,
            Instant unlockedAt,
            String archivedToJournalEntryId
    ) {
        static CapsuleView of(TimeCapsule c) {
            return new CapsuleView(c.getId(), c.getTitle(), c.isUnlocked() ? c.getBody() : null,
                    c.isEncrypted(), c.getPassphraseHint(), c.getUnlockType(), c.getUnlockParams(),
                    c.getCreatedAt(), c.getUnlockedAt(), c.getArchivedToJournalEntryId());
        }
    }

    @Transactional(readOnly = true)
    public List<CapsuleView> list() {
        return capsuleRepo.findAllByOrderByCreatedAtAsc().stream().map(CapsuleView::of).toList();
    }

    @Transactional(readOnly = true)
    public CapsuleView view(String capsuleId) {
        return CapsuleView.of(get(capsuleId));
    }

    @Transactional
    public TimeCapsule seal(CapsuleRequest request) {
        UnlockType type;
        try {
            type = UnlockType.valueOf(request.unlockType().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidInputException("Unrecognized unlock type: " + request.unlockType());
        }
        String params;
        try {
            params = objectMapper.writeValueAsString(request.unlockParams());
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Unlock parameters are not serialisable: " + e.getOriginalMessage());
        }
        CapsuleCondition.parse(type, params, objectMapper);

        TimeCapsule capsule = capsuleRepo.save(TimeCapsule.builder()
                .title(request.title().trim())
                .body(request.body())
                .encrypted(request.encrypted())
                .passphraseHint(request.passphraseHint())
                .unlockType(type)
                .unlockParams(params)
                .createdAt(clock.instant())
                .build());
        log.info("[時光膠囊] 封存「{}」，解鎖條件 {} {}", capsule.getTitle(), type, params);
        return capsule;
    }

    /**
     * 將已解鎖的膠囊複製為新的日誌。每個膠囊只能歸檔一次。
     */
    @Transactional
    public JournalEntry archiveToJournal(String capsuleId) {
        TimeCapsule capsule = get(capsuleId);
        if (!capsule.isUnlocked()) {
            throw new StateViolationException("Capsule is still locked: " + capsule.getTitle());
        }
        if (capsule.getArchivedToJournalEntryId() != null) {
            throw new StateViolationException("Capsule was already archived to the journal");
        }
        JournalEntry entry = journalService.write(new JournalRequest(
                "Time capsule: " + capsule.getTitle() + "\n\n" + capsule.getBody(), null, null, false));
        capsule.setArchivedToJournalEntryId(entry.getId());
        capsuleRepo.save(capsule);
        log.info("[時光膠囊] 「{}」已歸檔至日誌 {}", capsule.getTitle(), entry.getId());
        return entry;
    }

    /** 立即發布日期事件，{@code CapsuleDateTickJob} 也會定期呼叫 */
    @Transactional
    public void tick() {
        eventPublisher.publishEvent(new DateTick(clock.instant()));
    }

    private TimeCapsule get(String capsuleId) {
        return capsuleRepo.findById(capsuleId).orElseThrow(() -> NotFoundException.capsule(capsuleId));
    }
}
