package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record InstantiateRequest(@NotEmpty @Size(max = 2) List<String> skillIds) {}
