package com.project.sketch.scoring.DTOs;

import jakarta.validation.constraints.NotBlank;

public record Base64ScoringRequest(
        @NotBlank(message = "Missing sketch") String sketch,      // base64, optionally a data URI
        @NotBlank(message = "Missing referenceUrl") String referenceUrl,
        String difficulty
) {}
