package com.aiinpocket.ngplus.service.capsule;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class CapsuleConditionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void plainDateOpensAtStartOfDayInZone() {
        CapsuleCondition condition = CapsuleCondition.parse(UnlockType.DATE, "{\"date\":\"2026-12-31\"}", objectMapper);

        assertEquals(Instant.parse("2026-12-30T15:00:00Z"), condition.unlockAt(ZoneId.of("Asia/Tokyo")));
    }

    @Test
    void instantDateIsTakenAsIs() {
        CapsuleCondition condition = CapsuleCondition.parse(UnlockType.DATE,
                "{\"date\":\"2026-12-31T08:30:00Z\"}", objectMapper);

        assertEquals(Instant.parse("2026-12-31T08:30:00Z"), condition.unlockAt(ZoneId.of("UTC")));
    }

    @Test
    void unknownFieldsAreIgnored() {
        CapsuleCondition condition = CapsuleCondition.parse(UnlockType.PLAYER_LEVEL,
                "{\"level\":10,\"note\":\"ten!\"}", objectMapper);

        assertEquals(10, condition.level());
    }

    @Test
    void missingOrBadFieldsAreRejected() {
        assertThrows(InvalidInputException.class,
                () -> CapsuleCondition.parse(UnlockType.DATE, "{\"date\":\"next year\"}", objectMapper));
        assertThrows(InvalidInputException.class,
                () -> CapsuleCondition.parse(UnlockType.MISSION_COMPLETION, "{}", objectMapper));
        assertThrows(InvalidInputException.class,
                () -> CapsuleCondition.parse(UnlockType.SKILL_LEVEL, "{\"skillId\":\"s1\"}", objectMapper));
        assertThrows(InvalidInputException.class,
                () -> CapsuleCondition.parse(UnlockType.PLAYER_LEVEL, "{\"level\":0}", objectMapper));
        assertThrows(InvalidInputException.class,
                () -> CapsuleCondition.parse(UnlockType.PLAYER_LEVEL, "{level", objectMapper));
    }
}
