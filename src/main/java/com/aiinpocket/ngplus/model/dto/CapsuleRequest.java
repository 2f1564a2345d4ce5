package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record CapsuleRequest(
        @NotBlank @Size(max = 200) String title,
        @NotBlank String body,
        boolean encrypted,
        @Size(max = 200) String passphraseHint,
        @NotBlank String unlockType,
        @NotNull Map<String, Object> unlockParams
) {}
