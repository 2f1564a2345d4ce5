package com.aiinpocket.ngplus.service.capsule;

import com.aiinpocket.ngplus.exception.InvalidInputException;
import com.aiinpocket.ngplus.model.enums.UnlockType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * 膠囊 JSON 解鎖參數的型別化檢視。只會填入該解鎖類型用到的欄位。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapsuleCondition(
        String date,
        String missionId,
        String skillId,
        Integer level
) {

    /**
     * 依 {@code type} 解析並驗證 {@code json}。
     *
     * @throws InvalidInputException JSON 格式錯誤或缺少必要欄位
     */
    public static CapsuleCondition parse(UnlockType type, String json, ObjectMapper objectMapper) {
        CapsuleCondition condition;
        try {
            condition = objectMapper.readValue(json, CapsuleCondition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Malformed unlock parameters: " + e.getOriginalMessage());
        }
        if (condition == null) {
            throw new InvalidInputException("Unlock parameters are required");
        }
        condition.validate(type);
        return condition;
    }

    /**
     * DATE 膠囊的解鎖時間。只給日期時，於 {@code zone} 當天開始時解鎖。
     */
    public Instant unlockAt(ZoneId zone) {
        try {
            if (date.contains("T")) {
                return Instant.parse(date);
            }
            return LocalDate.parse(date).atStartOfDay(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("Unlock date is not ISO-8601: " + date);
        }
    }

    private void validate(UnlockType type) {
        switch (type) {
            case DATE -> {
                if (date == null || date.isBlank()) {
                    throw new InvalidInputException("DATE capsules need a \"date\"");
                }
                unlockAt(ZoneId.of("UTC"));
            }
            case MISSION_COMPLETION -> {
                if (missionId == null || missionId.isBlank()) {
                    throw new InvalidInputException("MISSION_COMPLETION capsules need a \"missionId\"");
                }
            }
            case SKILL_LEVEL -> {
                if (skillId == null || skillId.isBlank()) {
                    throw new InvalidInputException("SKILL_LEVEL capsules need a \"skillId\"");
                }
                requireLevel();
            }
            case PLAYER_LEVEL -> requireLevel();
        }
    }

    private void requireLevel() {
        if (level == null || level < 1) {
            throw new InvalidInputException("Unlock level must be >= 1, got " + level);
        }
    }
}
