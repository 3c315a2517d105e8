package org.rostilos.prwizard.core.model.annotation;

public record OwnerRepo(String owner, String repo) {

    public OwnerRepo {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }
        if (repo == null || repo.isBlank()) {
            throw new IllegalArgumentException("repo must not be blank");
        }
    }

    public String fullName() {
        return owner + "/" + repo;
    }
}
