package com.aiinpocket.ngplus.model.dto;

import jakarta.validation.constraints.Size;

public record RedeemRequest(@Size(max = 500) String note) {}
