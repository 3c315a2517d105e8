package org.rostilos.prwizard.vcsclient.github.dto;

public record PullRequestInfo(
        int number,
        String title,
        String body,
        String authorLogin
) {}
