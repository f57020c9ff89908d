package com.yamdb.backend.modules.review.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Derives a title's rating from its review scores. Callers must hold the title row lock.
 */
@Service
public class TitleRatingService {

    static final int RATING_SCALE = 2;

    private final ReviewRepository reviewRepository;
    private final TitleRepository titleRepository;

    public TitleRatingService(ReviewRepository reviewRepository, TitleRepository titleRepository) {
        this.reviewRepository = reviewRepository;
        this.titleRepository = titleRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public BigDecimal recompute(UUID titleId) {
        reviewRepository.flush();
        BigDecimal rating = toRating(reviewRepository.averageScore(titleId));
        titleRepository.updateRating(titleId, rating);
        return rating;
    }

    /**
     * Mean rounded half-up to two decimals, or null for no reviews.
     */
    public static BigDecimal toRating(Double average) {
        if (average == null) {
            return null;
        }
        return BigDecimal.valueOf(average).setScale(RATING_SCALE, RoundingMode.HALF_UP);
    }
}
