package com.yamdb.backend.modules.review.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CommentResponse(
        UUID id,
        UUID reviewId,
        String author,
        String text,
        OffsetDateTime pubDate
) {
}
