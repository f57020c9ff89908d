package com.yamdb.backend.modules.review.domain;

import java.util.UUID;

import com.yamdb.backend.global.jpa.AbstractTimestampedEntity;
import com.yamdb.backend.modules.auth.domain.YamdbUser;
import com.yamdb.backend.modules.catalog.domain.Title;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * One author's scored review of a title. The author becomes null when the account is deleted.
 */
@Entity
@Table(
        name = "review",
        uniqueConstraints = @UniqueConstraint(name = "uq_review_title_author", columnNames = {"title_id", "author_id"})
)
public class Review extends AbstractTimestampedEntity {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "title_id", nullable = false, updatable = false)
    private Title title;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private YamdbUser author;

    @Column(name = "text", nullable = false)
    private String text;

    @Column(name = "score", nullable = false)
    private int score;

    public UUID getId() {
        return id;
    }

    public Title getTitle() {
        return title;
    }

    public void setTitle(Title title) {
        this.title = title;
    }

    public YamdbUser getAuthor() {
        return author;
    }

    public void setAuthor(YamdbUser author) {
        this.author = author;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public boolean isAuthoredBy(UUID userId) {
        return author != null && userId != null && userId.equals(author.getId());
    }
}
