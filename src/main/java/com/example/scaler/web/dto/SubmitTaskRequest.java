package com.example.scaler.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record SubmitTaskRequest(
        String queue,
        @NotNull @PositiveOrZero Integer durationSeconds
) {}
