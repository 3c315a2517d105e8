package org.rostilos.prwizard.vcsclient.github.dto;

/**
 * One changed file of a pull request. {@code patch} is absent for binary or very large diffs.
 */
public record PullRequestFile(
        String filename,
        String status,
        int additions,
        int deletions,
        int changes,
        String patch
) {}
