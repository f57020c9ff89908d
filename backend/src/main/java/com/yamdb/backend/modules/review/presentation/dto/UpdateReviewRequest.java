package com.yamdb.backend.modules.review.presentation.dto;

public record UpdateReviewRequest(String text, Integer score) {
}
