package com.aiinpocket.ngplus.service.template;

import com.aiinpocket.ngplus.model.dto.TemplateRequest.Entry;
import com.aiinpocket.ngplus.model.dto.TemplateView;
import com.aiinpocket.ngplus.model.enums.TemplateCategory;

import java.util.List;
import java.util.Optional;

/**
 * 內建入門任務模板。每組十個任務，足以讓新技能達到就緒。
 */
public final class BuiltinTemplates {

    public static final List<TemplateView> ALL = List.of(
            builtin("template_writing_starter", "Writing Starter Pack",
                    "Essential writing missions to get started", TemplateCategory.WRITING, List.of(
                            entry("Write 250 words", 1, 2),
                            entry("Write 500 words", 2, 2),
                            entry("Write 1000 words", 3, 3),
                            entry("Edit previous work", 2, 3),
                            entry("Brainstorm ideas for 15 minutes", 1, 2),
                            entry("Read and analyze good writing", 2, 2),
                            entry("Outline a chapter", 2, 3),
                            entry("Research topic for article", 2, 2),
                            entry("Write morning pages", 1, 1),
                            entry("Revise one section", 3, 3))),
            builtin("template_fitness_beginner", "Fitness Beginner Pack",
                    "Beginner-friendly fitness missions", TemplateCategory.FITNESS, List.of(
                            entry("10 minute walk", 1, 1),
                            entry("20 minute walk", 2, 2),
                            entry("15 push-ups", 2, 2),
                            entry("30 second plank", 2, 2),
                            entry("10 squats", 1, 2),
                            entry("Stretch for 10 minutes", 1, 1),
                            entry("Run for 5 minutes", 2, 3),
                            entry("20 jumping jacks", 1, 2),
                            entry("Yoga session (15 min)", 2, 2),
                            entry("Bodyweight workout (20 min)", 3, 3))),
            builtin("template_coding_daily", "Coding Daily Practice",
                    "Daily coding practice missions", TemplateCategory.CODING, List.of(
                            entry("Code for 30 minutes", 2, 3),
                            entry("Solve one coding challenge", 2, 3),
                            entry("Read documentation for 20 minutes", 1, 2),
                            entry("Debug a tricky issue", 3, 4),
                            entry("Write tests for feature", 2, 3),
                            entry("Refactor old code", 2, 3),
                            entry("Learn new library/framework", 3, 3),
                            entry("Code review someone's work", 2, 2),
                            entry("Write technical blog post", 3, 3),
                            entry("Contribute to open source", 3, 4))),
            builtin("template_learning_routine", "Learning Routine",
                    "Structured learning missions", TemplateCategory.LEARNING, List.of(
                            entry("Read for 20 minutes", 1, 2),
                            entry("Watch educational video", 1, 1),
                            entry("Take notes on lesson", 2, 2),
                            entry("Practice exercises", 2, 3),
                            entry("Review flashcards", 1, 1),
                            entry("Teach concept to someone", 3, 3),
                            entry("Complete course module", 2, 3),
                            entry("Research new topic", 2, 2),
                            entry("Quiz yourself", 1, 2),
                            entry("Apply learning to project", 3, 4))),
            builtin("template_productivity_basics", "Productivity Basics",
                    "Core productivity habits", TemplateCategory.PRODUCTIVITY, List.of(
                            entry("Plan your day", 1, 1),
                            entry("Complete #1 priority task", 3, 3),
                            entry("Clear inbox to zero", 2, 2),
                            entry("Organize workspace", 1, 1),
                            entry("Review weekly goals", 1, 2),
                            entry("Time block tomorrow", 1, 1),
                            entry("Eliminate one distraction", 2, 2),
                            entry("Batch similar tasks", 2, 2),
                            entry("Take proper breaks", 1, 1),
                            entry("Weekly review session", 2, 3)))
    );

    private BuiltinTemplates() {
    }

    public static Optional<TemplateView> find(String id) {
        return ALL.stream().filter(t -> t.id().equals(id)).findFirst();
    }

    public static boolean isBuiltin(String id) {
        return find(id).isPresent();
    }

    private static TemplateView builtin(String id, String name, String description,
                                        TemplateCategory category, List<Entry> missions) {
        return new TemplateView(id, name, description, category, true, missions, 0);
    }

    private static Entry entry(String title, int difficulty, int energy) {
        return new Entry(title, null, difficulty, energy);
    }
}
