package org.rostilos.prwizard.core.model.annotation;

import java.util.Objects;

/**
 * Platform comment id plus the kind needed to pick the right delete endpoint.
 */
public record CommentLocation(long commentId, CommentKind kind) {

    public CommentLocation {
        Objects.requireNonNull(kind, "kind");
    }

    public static CommentLocation inline(long commentId) {
        return new CommentLocation(commentId, CommentKind.INLINE);
    }

    public static CommentLocation thread(long commentId) {
        return new CommentLocation(commentId, CommentKind.THREAD);
    }
}
