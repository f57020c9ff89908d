package com.yamdb.backend.modules.review.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.UUID;

import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TitleRatingServiceTest {

    @Mock
    private ReviewRepository reviewRepository;

    @Mock
    private TitleRepository titleRepository;

    @Test
    void roundsMeanHalfUpToTwoDecimals() {
        assertThat(TitleRatingService.toRating(7.5)).isEqualByComparingTo("7.50");
        assertThat(TitleRatingService.toRating(20.0 / 3)).isEqualByComparingTo("6.67");
        assertThat(TitleRatingService.toRating(8.125)).isEqualByComparingTo("8.13");
        assertThat(TitleRatingService.toRating(10.0)).isEqualByComparingTo("10.00");
    }

    @Test
    void noReviewsMeansNoRating() {
        assertThat(TitleRatingService.toRating(null)).isNull();
    }

    @Test
    void recomputeFlushesBeforeAveraging() {
        UUID titleId = UUID.randomUUID();
        when(reviewRepository.averageScore(titleId)).thenReturn(8.0);
        TitleRatingService service = new TitleRatingService(reviewRepository, titleRepository);

        BigDecimal rating = service.recompute(titleId);

        InOrder order = inOrder(reviewRepository, titleRepository);
        order.verify(reviewRepository).flush();
        order.verify(reviewRepository).averageScore(titleId);
        order.verify(titleRepository).updateRating(titleId, rating);
        assertThat(rating).isEqualByComparingTo("8.00");
    }
}
