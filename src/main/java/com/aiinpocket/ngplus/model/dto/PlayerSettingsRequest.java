package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.Size;

/** null 欄位維持原值 */
public record PlayerSettingsRequest(
        @Size(max = 100) String displayName,
        @Size(max = 100) String className,
        @Size(max = 500) String classDescription,
        Integer dayStartHour
) {}
