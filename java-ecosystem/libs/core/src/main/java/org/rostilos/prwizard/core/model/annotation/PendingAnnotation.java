package org.rostilos.prwizard.core.model.annotation;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * A posted reviewer comment whose fate is not decided yet.
 * <p>
 * Records are immutable once stored: they are created right after the comment is posted and
 * removed by exactly one of accept, reject or expiry. The code is assigned by the caller, so
 * {@link Persistable#isNew()} is tracked explicitly to make {@code save} issue an INSERT and
 * let the primary key reject a code that is still pending.
 */
@Entity
@Table(name = "pending_annotation",
    indexes = {
        @Index(name = "idx_pending_annotation_expiry", columnList = "expires_at")
    }
)
public class PendingAnnotation implements Persistable<String> {

    public static final int CODE_LENGTH = 6;

    @Id
    @Column(name = "code", nullable = false, updatable = false, length = CODE_LENGTH)
    private String code;

    @Column(name = "comment_id", nullable = false, updatable = false)
    private long commentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "comment_kind", nullable = false, updatable = false, length = 16)
    private CommentKind commentKind;

    @Column(name = "owner", nullable = false, updatable = false, length = 100)
    private String owner;

    @Column(name = "repo", nullable = false, updatable = false, length = 100)
    private String repo;

    @Column(name = "pr_number", nullable = false, updatable = false)
    private int pullRequestNumber;

    @Column(name = "installation_id", nullable = false, updatable = false)
    private long installationId;

    /** Decision deadline in epoch seconds. */
    @Column(name = "expires_at", nullable = false, updatable = false)
    private long expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Transient
    private boolean newEntity = true;

    protected PendingAnnotation() {
    }

    public PendingAnnotation(String code,
                             CommentLocation commentLocation,
                             OwnerRepo ownerRepo,
                             int pullRequestNumber,
                             long installationId,
                             long expiresAt) {
        this(code, commentLocation, ownerRepo, pullRequestNumber, installationId, expiresAt, Instant.now());
    }

    public PendingAnnotation(String code,
                             CommentLocation commentLocation,
                             OwnerRepo ownerRepo,
                             int pullRequestNumber,
                             long installationId,
                             long expiresAt,
                             Instant createdAt) {
        if (code == null || code.length() != CODE_LENGTH) {
            throw new IllegalArgumentException("Annotation code must be " + CODE_LENGTH + " characters: " + code);
        }
        this.code = code;
        this.commentId = commentLocation.commentId();
        this.commentKind = commentLocation.kind();
        this.owner = ownerRepo.owner();
        this.repo = ownerRepo.repo();
        this.pullRequestNumber = pullRequestNumber;
        this.installationId = installationId;
        this.expiresAt = expiresAt;
        this.createdAt = OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC);
    }

    @Override
    public String getId() {
        return code;
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.newEntity = false;
    }

    public String getCode() {
        return code;
    }

    public CommentLocation getCommentLocation() {
        return new CommentLocation(commentId, commentKind);
    }

    public OwnerRepo getOwnerRepo() {
        return new OwnerRepo(owner, repo);
    }

    public String getOwner() {
        return owner;
    }

    public String getRepo() {
        return repo;
    }

    public int getPullRequestNumber() {
        return pullRequestNumber;
    }

    public long getInstallationId() {
        return installationId;
    }

    public long getExpiresAt() {
        return expiresAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public boolean isExpired(long nowEpochSeconds) {
        return expiresAt <= nowEpochSeconds;
    }

    @Override
    public String toString() {
        return "PendingAnnotation{code=" + code
                + ", comment=" + commentKind + ":" + commentId
                + ", repo=" + owner + "/" + repo
                + ", pr=" + pullRequestNumber
                + ", expiresAt=" + expiresAt + "}";
    }
}
