package org.rostilos.prwizard.pipelineagent.generic.annotation;

public final class DecisionFooter {

    private DecisionFooter() {
    }

    /**
     * Appends the decision instructions for {@code code} to a reply body.
     */
    public static String append(String body, String code, long ttlSeconds) {
        long minutes = Math.max(1, ttlSeconds / 60);
        return body + "\n\n---\n_Message ID: **" + code + "** • Reply with `/accept " + code
                + "` or `/reject " + code + "` within " + minutes + (minutes == 1 ? " minute_" : " minutes_");
    }
}
