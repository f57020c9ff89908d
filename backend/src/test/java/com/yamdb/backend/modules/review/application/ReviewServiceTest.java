package com.yamdb.backend.modules.review.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.audit.application.AuditLogService;
import com.yamdb.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.auth.infrastructure.persistence.YamdbUserRepository;
import com.yamdb.backend.modules.catalog.domain.Title;
import com.yamdb.backend.modules.catalog.infrastructure.persistence.TitleRepository;
import com.yamdb.backend.modules.policy.application.PolicyEnforcer;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.Role;
import com.yamdb.backend.modules.review.domain.Review;
import com.yamdb.backend.modules.review.infrastructure.persistence.CommentRepository;
import com.yamdb.backend.modules.review.infrastructure.persistence.ReviewRepository;
import com.yamdb.backend.modules.review.presentation.dto.CreateReviewRequest;
import com.yamdb.backend.modules.review.presentation.dto.ReviewResponse;
import com.yamdb.backend.modules.review.presentation.dto.UpdateReviewRequest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class ReviewServiceTest {

    @Mock
    private ReviewRepository reviewRepository;

    @Mock
    private CommentRepository commentRepository;

    @Mock
    private TitleRepository titleRepository;

    @Mock
    private YamdbUserRepository userRepository;

    @Mock
    private TitleRatingService titleRatingService;

    @Mock
    private AuditLogService auditLogService;

    private ReviewService reviewService;
    private Title title;
    private YamdbUser alice;
    private Actor aliceActor;

    @BeforeEach
    void setUp() {
        reviewService = new ReviewService(reviewRepository, commentRepository, titleRepository, userRepository,
                titleRatingService, new PolicyEnforcer(), auditLogService);
        title = new Title();
        ReflectionTestUtils.setField(title, "id", UUID.randomUUID());
        title.setName("Solaris");
        title.setYear(1972);
        alice = new YamdbUser();
        ReflectionTestUtils.setField(alice, "id", UUID.randomUUID());
        alice.setUsername("alice");
        alice.setRole(Role.USER);
        aliceActor = new Actor(alice.getId(), "alice", Role.USER);
    }

    @Test
    void anonymousCannotReview() {
        assertThatThrownBy(() -> reviewService.createReview(Actor.anonymous(), title.getId(), new CreateReviewRequest("ok", 5)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        verifyNoInteractions(titleRepository, reviewRepository, titleRatingService);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 11, -3})
    void scoreOutsideRangeIsRejectedBeforeLocking(int score) {
        assertThatThrownBy(() -> reviewService.createReview(aliceActor, title.getId(), new CreateReviewRequest("text", score)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("review.score_out_of_range"));
        verifyNoInteractions(titleRepository);
    }

    @Test
    void missingTitleIsValidationError() {
        UUID missing = UUID.randomUUID();
        when(titleRepository.findByIdForUpdate(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reviewService.createReview(aliceActor, missing, new CreateReviewRequest("text", 7)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> {
                    ProblemException problem = (ProblemException) ex;
                    assertThat(problem.getKind()).isEqualTo(ErrorKind.VALIDATION);
                    assertThat(problem.getCode()).isEqualTo("title_not_found");
                });
    }

    @Test
    void secondReviewBySameAuthorConflicts() {
        when(titleRepository.findByIdForUpdate(title.getId())).thenReturn(Optional.of(title));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(reviewRepository.existsByTitle_IdAndAuthor_Id(title.getId(), alice.getId())).thenReturn(true);

        assertThatThrownBy(() -> reviewService.createReview(aliceActor, title.getId(), new CreateReviewRequest("again", 7)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.CONFLICT));
        verify(reviewRepository, never()).saveAndFlush(any());
        verifyNoInteractions(titleRatingService);
    }

    @Test
    void uniqueViolationFromRaceIsReportedAsConflict() {
        when(titleRepository.findByIdForUpdate(title.getId())).thenReturn(Optional.of(title));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(reviewRepository.existsByTitle_IdAndAuthor_Id(title.getId(), alice.getId())).thenReturn(false);
        when(reviewRepository.saveAndFlush(any(Review.class))).thenThrow(new DataIntegrityViolationException("insert",
                new SQLException("duplicate key value violates unique constraint \"uq_review_title_author\"")));

        assertThatThrownBy(() -> reviewService.createReview(aliceActor, title.getId(), new CreateReviewRequest("race", 7)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("review.already_exists"));
    }

    @Test
    void createRecomputesRating() {
        when(titleRepository.findByIdForUpdate(title.getId())).thenReturn(Optional.of(title));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(reviewRepository.existsByTitle_IdAndAuthor_Id(title.getId(), alice.getId())).thenReturn(false);
        when(reviewRepository.saveAndFlush(any(Review.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ReviewResponse response = reviewService.createReview(aliceActor, title.getId(), new CreateReviewRequest("  Great  ", 8));

        assertThat(response.text()).isEqualTo("Great");
        assertThat(response.score()).isEqualTo(8);
        assertThat(response.author()).isEqualTo("alice");
        verify(titleRatingService).recompute(title.getId());
    }

    @Test
    void otherUserCannotEditReview() {
        Review review = review(alice, 6);
        Actor bob = new Actor(UUID.randomUUID(), "bob", Role.USER);
        stubLockAndLoad(review);

        assertThatThrownBy(() -> reviewService.updateReview(bob, title.getId(), review.getId(), new UpdateReviewRequest("mine now", 1)))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        assertThat(review.getScore()).isEqualTo(6);
        verifyNoInteractions(titleRatingService);
    }

    @Test
    void moderatorDeleteIsAudited() {
        Review review = review(alice, 6);
        Actor moderator = new Actor(UUID.randomUUID(), "mod", Role.MODERATOR);
        stubLockAndLoad(review);
        when(commentRepository.deleteByReviewId(review.getId())).thenReturn(2);

        reviewService.deleteReview(moderator, title.getId(), review.getId());

        ArgumentCaptor<AuditLogCommand> command = ArgumentCaptor.forClass(AuditLogCommand.class);
        verify(auditLogService).record(command.capture());
        verify(reviewRepository).deleteById(review.getId());
        verify(titleRatingService).recompute(title.getId());
        assertThat(command.getValue().actionType()).isEqualTo("REVIEW_MODERATED_DELETE");
        assertThat(command.getValue().detail()).containsEntry("commentsDeleted", 2);
    }

    @Test
    void ownerDeleteIsNotAudited() {
        Review review = review(alice, 6);
        stubLockAndLoad(review);

        reviewService.deleteReview(aliceActor, title.getId(), review.getId());

        verify(titleRatingService).recompute(title.getId());
        verifyNoInteractions(auditLogService);
    }

    @Test
    void reviewOfAnotherTitleIsNotFound() {
        UUID reviewId = UUID.randomUUID();
        when(reviewRepository.findTitleIdById(reviewId)).thenReturn(Optional.of(UUID.randomUUID()));

        assertThatThrownBy(() -> reviewService.deleteReview(aliceActor, title.getId(), reviewId))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        verifyNoInteractions(titleRepository);
    }

    private Review review(YamdbUser author, int score) {
        Review review = new Review();
        ReflectionTestUtils.setField(review, "id", UUID.randomUUID());
        review.setTitle(title);
        review.setAuthor(author);
        review.setText("Solid");
        review.setScore(score);
        return review;
    }

    private void stubLockAndLoad(Review review) {
        when(reviewRepository.findTitleIdById(review.getId())).thenReturn(Optional.of(title.getId()));
        when(titleRepository.findByIdForUpdate(title.getId())).thenReturn(Optional.of(title));
        when(reviewRepository.findByIdAndTitle_Id(review.getId(), title.getId())).thenReturn(Optional.of(review));
    }
}
