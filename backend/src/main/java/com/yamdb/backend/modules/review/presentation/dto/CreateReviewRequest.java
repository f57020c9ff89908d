package com.yamdb.backend.modules.review.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateReviewRequest(
        @NotBlank String text,
        @NotNull Integer score
) {
}
