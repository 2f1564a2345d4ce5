package com.aiinpocket.ngplus.service.template;

import com.aiinpocket.ngplus.exception.InvalidDifficultyException;
import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.exception.NotFoundException;
import com.aiinpocket.ngplus.exception.StateViolationException;
import com.aiinpocket.ngplus.model.dto.TemplateRequest;
import com.aiinpocket.ngplus.model.dto.TemplateRequest.Entry;
import com.aiinpocket.ngplus.model.dto.TemplateView;
import com.aiinpocket.ngplus.model.entity.Mission;
import com.aiinpocket.ngplus.model.entity.Skill;
import com.aiinpocket.ngplus.model.enums.CycleState;
import com.aiinpocket.ngplus.model.enums.TemplateCategory;
import com.aiinpocket.ngplus.service.progression.CycleManager;
import com.aiinpocket.ngplus.support.EngineJpaTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemplateServiceTest extends EngineJpaTest {

    @Autowired
    private TemplateService templateService;

    @Test
    void builtinsAreListedFirst() {
        TemplateView custom = templateService.createTemplate(new TemplateRequest("Morning", null, null,
                List.of(new Entry("Stretch", null, 1, 1))));

        List<TemplateView> all = templateService.list();

        assertEquals(BuiltinTemplates.ALL.size() + 1, all.size());
        assertEquals("template_writing_starter", all.get(0).id());
        assertTrue(all.get(0).builtin());
        assertEquals(custom.id(), all.get(all.size() - 1).id());
        assertEquals(TemplateCategory.CUSTOM, custom.category());
    }

    @Test
    void builtinTemplateMakesSkillReadyAtNextBoundary() {
        Skill writing = newSkill("Writing");

        List<Mission> created = templateService.instantiate("template_writing_starter", List.of(writing.getId()));

        assertEquals(10, created.size());
        assertEquals("Write 250 words", created.get(0).getTitle());
        assertEquals(3, created.get(2).getDifficulty());
        assertEquals(10, missionService.assignedTo(writing.getId()).size());

        clock.set(writing.getCycleEnd());
        skillService.rolloverNow();
        assertEquals(CycleState.ACTIVE, CycleManager.state(writing, clock.instant()));
    }

    @Test
    void customTemplateCountsUsesAndCanBeDeleted() {
        Skill writing = newSkill("Writing");
        Skill reading = newSkill("Reading");
        TemplateView template = templateService.createTemplate(new TemplateRequest(" Evening ", "wind down", "health",
                List.of(new Entry("Journal", "one page", 1, 1), new Entry("Read fiction", null, 2, 2))));
        assertEquals("Evening", template.name());
        assertEquals(TemplateCategory.HEALTH, template.category());

        List<Mission> created = templateService.instantiate(template.id(), List.of(writing.getId(), reading.getId()));
        templateService.instantiate(template.id(), List.of(reading.getId()));

        assertEquals(List.of(writing.getId(), reading.getId()), created.get(0).getSkillIds());
        assertEquals("one page", created.get(0).getNote());
        assertEquals(2, templateService.get(template.id()).timesUsed());
        assertEquals(4, missionService.assignedTo(reading.getId()).size());

        templateService.deleteTemplate(template.id());
        assertThrows(NotFoundException.class, () -> templateService.get(template.id()));
    }

    @Test
    void builtinTemplatesCannotBeDeleted() {
        assertThrows(StateViolationException.class, () -> templateService.deleteTemplate("template_coding_daily"));
        assertEquals(BuiltinTemplates.ALL.size(), templateService.list().size());
    }

    @Test
    void rejectsBadTemplatesAndTargets() {
        assertThrows(InvalidDifficultyException.class, () -> templateService.createTemplate(new TemplateRequest(
                "Hard", null, null, List.of(new Entry("Impossible", null, 6, 3)))));
        assertThrows(InvalidInputException.class, () -> templateService.createTemplate(new TemplateRequest(
                "Tired", null, null, List.of(new Entry("Nap", null, 1, 0)))));
        assertThrows(InvalidInputException.class, () -> templateService.createTemplate(new TemplateRequest(
                "Empty", null, null, List.of())));
        assertThrows(InvalidInputException.class, () -> templateService.createTemplate(new TemplateRequest(
                "Huge", null, null, Collections.nCopies(31, new Entry("Stretch", null, 1, 1)))));
        assertThrows(InvalidInputException.class, () -> templateService.createTemplate(new TemplateRequest(
                "Odd", null, "cooking", List.of(new Entry("Bake", null, 1, 1)))));

        Skill archived = newSkill("Old");
        skillService.setArchived(archived.getId(), true);
        assertThrows(StateViolationException.class,
                () -> templateService.instantiate("template_fitness_beginner", List.of(archived.getId())));
        assertThrows(NotFoundException.class,
                () -> templateService.instantiate("template_missing", List.of(archived.getId())));
    }
}
