package com.aiinpocket.ngplus.service.template;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.MissionRequest;
import com.aiinpocket.ngplus.model.dto.TemplateRequest;
import com.aiinpocket.ngplus.model.dto.TemplateRequest.Entry;
import com.aiinpocket.ngplus.model.dto.TemplateView;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.MissionTemplate;
import com.aiinpocket.ngplus.model.entity.TemplateMission;
import com.aiinpocket.ngplus.model.enums.TemplateCategory;
import com.aiinpocket.ngplus.repository.MissionTemplateRepository;
import com.aiinpocket.ngplus.service.MissionService;
import com.aiinpocket.ngplus.service.progression.ProgressionCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * 內建與自訂任務模板。套用時透過 {@link MissionService} 為每一項建立任務，
 * 全部成功或全部失敗。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TemplateService {

    private static final int MAX_ENTRIES = 30;

    private final MissionTemplateRepository templateRepo;
    private final MissionService missionService;
    private final Clock clock;

    /** 內建模板在前，自訂模板依建立順序 */
    @Transactional(readOnly = true)
    public List<TemplateView> list() {
        return Stream.concat(BuiltinTemplates.ALL.stream(),
                        templateRepo.findAllByOrderByCreatedAtAsc().stream().map(TemplateService::toView))
                .toList();
    }

    @Transactional(readOnly = true)
    public TemplateView get(String templateId) {
        return BuiltinTemplates.find(templateId)
                .orElseGet(() -> toView(findCustom(templateId)));
    }

    @Transactional
    public TemplateView createTemplate(TemplateRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidInputException("Template name is required");
        }
        if (request.missions() == null || request.missions().isEmpty()) {
            throw new InvalidInputException("A template needs at least one mission");
        }
        if (request.missions().size() > MAX_ENTRIES) {
            throw new InvalidInputException("A template holds at most " + MAX_ENTRIES + " missions");
        }
        List<TemplateMission> entries = new ArrayList<>();
        for (Entry entry : request.missions()) {
            entries.add(validate(entry));
        }
        MissionTemplate template = templateRepo.save(MissionTemplate.builder()
                .name(request.name().trim())
                .description(request.description())
                .category(TemplateCategory.parse(request.category()))
                .missions(entries)
                .createdAt(clock.instant())
                .build());
        log.info("[任務模板] 建立「{}」，共 {} 個任務", template.getName(), entries.size());
        return toView(template);
    }

    /**
     * 為指定技能建立模板中的任務。
     *
     * @throws NotFoundException 模板或技能不存在
     * @throws StateViolationException 技能已封存
     */
    @Transactional
    public List<Mission> instantiate(String templateId, List<String> skillIds) {
        TemplateView template = get(templateId);
        List<Mission> created = new ArrayList<>();
        for (Entry entry : template.missions()) {
            created.add(missionService.createMission(new MissionRequest(
                    entry.title(), entry.note(), entry.difficulty(), entry.energy(), skillIds)));
        }
        if (!template.builtin()) {
            MissionTemplate custom = findCustom(templateId);
            custom.setTimesUsed(custom.getTimesUsed() + 1);
            templateRepo.save(custom);
        }
        log.info("[任務模板] 套用「{}」: 建立 {} 個任務，技能 {}", template.name(), created.size(), skillIds);
        return created;
    }

    @Transactional
    public void deleteTemplate(String templateId) {
        if (BuiltinTemplates.isBuiltin(templateId)) {
            throw new StateViolationException("Built-in templates cannot be deleted");
        }
        MissionTemplate template = findCustom(templateId);
        templateRepo.delete(template);
        log.info("[任務模板] 刪除「{}」", template.getName());
    }

    // ===== 內部方法 =====

    private MissionTemplate findCustom(String templateId) {
        return templateRepo.findById(templateId).orElseThrow(() -> NotFoundException.template(templateId));
    }

    private static TemplateMission validate(Entry entry) {
        if (entry == null || entry.title() == null || entry.title().isBlank()) {
            throw new InvalidInputException("Every template mission needs a title");
        }
        ProgressionCalculator.requireDifficulty(entry.difficulty());
        if (entry.energy() < 1 || entry.energy() > 5) {
            throw new InvalidInputException("Energy must be 1-5, got " + entry.energy());
        }
        return TemplateMission.builder()
                .title(entry.title().trim())
                .note(entry.note())
                .difficulty(entry.difficulty())
                .energy(entry.energy())
                .build();
    }

    private static TemplateView toView(MissionTemplate template) {
        return new TemplateView(template.getId(), template.getName(), template.getDescription(),
                template.getCategory(), false,
                template.getMissions().stream()
                        .map(m -> new Entry(m.getTitle(), m.getNote(), m.getDifficulty(), m.getEnergy()))
                        .toList(),
                template.getTimesUsed());
    }
}
