package com.yamdb.backend.modules.review.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record CommentRequest(@NotBlank String text) {
}
