package org.rostilos.prwizard.core.model.annotation;

/**
 * Where an annotation comment lives on the pull request.
 * Inline comments are review comments attached to a diff line and are deleted through the
 * pull request review comment endpoint; thread comments are regular conversation comments.
 */
public enum CommentKind {
    INLINE("inline"),
    THREAD("thread");

    private final String id;

    CommentKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static CommentKind fromId(String id) {
        for (CommentKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown comment kind: " + id);
    }
}
