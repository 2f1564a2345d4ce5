package com.aiinpocket.ngplus.service.progression;

import com.aiinpocket.ngplus.config.ProgressionProperties;
import com.aiinpocket.ngplus.repository.CompletionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * 決定任務完成是否獲得反思代幣。
 *
 * <p>每次完成擲骰一次。中獎後還須滿足：當日已發出的代幣少於
 * {@code maxPerDay}，且每個關聯技能目前週期的代幣少於
 * {@code maxPerSkillCycle}。兩項計數每次都從完成紀錄重新計算。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReflectionTokenPolicy {

    static final List<String> PROMPTS = List.of(
            "What did you learn from this?",
            "How did this make you feel?",
            "What would you do differently next time?",
            "What surprised you about this?",
            "What's one thing you're proud of here?",
            "How does this connect to your larger goals?",
            "What challenge did you overcome?",
            "What skill did you practice?",
            "What would you tell your past self about this?",
            "What's your next step from here?"
    );

    private final CompletionRepository completionRepo;
    private final ProgressionProperties props;
    private final RandomGenerator random;

    /**
     * @param skillCycles 本次完成計入的每個技能的 (skillId, cycleId)
     * @return 發出代幣時的反思提示
     */
    public Optional<String> draw(Instant now, ZoneId zone, int dayStartHour, Collection<SkillCycle> skillCycles) {
        ProgressionProperties.ReflectionParams params = props.reflection();
        if (random.nextDouble() >= params.probability()) {
            return Optional.empty();
        }

        CycleWindow today = TimeAlignment.dayWindow(now, zone, dayStartHour);
        long issuedToday = completionRepo
                .countByReflectionTokenTrueAndCompletedAtGreaterThanEqualAndCompletedAtLessThan(today.start(), today.end());
        if (issuedToday >= params.maxPerDay()) {
            log.debug("[反思代幣] 已達每日上限 ({}/{})", issuedToday, params.maxPerDay());
            return Optional.empty();
        }

        for (SkillCycle sc : skillCycles) {
            long issued = completionRepo.countReflectionTokensInCycle(sc.skillId(), sc.cycleId());
            if (issued >= params.maxPerSkillCycle()) {
                log.debug("[反思代幣] {} 已達週期上限 ({}/{})", sc.cycleId(), issued, params.maxPerSkillCycle());
                return Optional.empty();
            }
        }
        return Optional.of(PROMPTS.get(random.nextInt(PROMPTS.size())));
    }

    public record SkillCycle(String skillId, String cycleId) {}
}
