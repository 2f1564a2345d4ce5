package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record TemplateRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String description,
        String category,
        @NotEmpty @Size(max = 30) List<@Valid Entry> missions
) {
    public record Entry(
            @NotBlank @Size(max = 200) String title,
            @Size(max = 1000) String note,
            int difficulty,
            int energy
    ) {}
}
