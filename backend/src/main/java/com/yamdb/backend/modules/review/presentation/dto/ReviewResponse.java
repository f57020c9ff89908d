package com.yamdb.backend.modules.review.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ReviewResponse(
        UUID id,
        UUID titleId,
        String author,
        String text,
        int score,
        OffsetDateTime pubDate
) {
}
