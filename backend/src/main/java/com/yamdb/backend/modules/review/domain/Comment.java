package com.yamdb.backend.modules.review.domain;

import java.util.UUID;

import com.yamdb.backend.global.jpa.AbstractTimestampedEntity;
import com.yamdb.backend.modules.auth.domain.YamdbUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "comment")
public class Comment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "review_id", nullable = false, updatable = false)
    private Review review;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private YamdbUser author;

    @Column(name = "text", nullable = false)
    private String text;

    public UUID getId() {
        return id;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
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

    public boolean isAuthoredBy(UUID userId) {
        return author != null && userId != null && userId.equals(author.getId());
    }
}
