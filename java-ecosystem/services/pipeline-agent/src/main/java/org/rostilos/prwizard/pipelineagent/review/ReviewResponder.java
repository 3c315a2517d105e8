package org.rostilos.prwizard.pipelineagent.review;

import java.util.Optional;

/**
 * Produces the reviewer's reply to a piece of pull request feedback.
 */
public interface ReviewResponder {

    /**
     * @return reply text, or empty when there is nothing to post
     */
    Optional<String> respond(ReviewRequest request);
}
