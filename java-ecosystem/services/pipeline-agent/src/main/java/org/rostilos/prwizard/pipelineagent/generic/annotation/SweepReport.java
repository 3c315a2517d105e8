package org.rostilos.prwizard.pipelineagent.generic.annotation;

import java.time.Instant;

/**
 * Counts for one sweep tick.
 *
 * @param listed          records reported expired by the store
 * @param expired         records this tick retired
 * @param alreadyResolved records another resolver removed between listing and deleting
 * @param failed          records left in place because of an error; retried next tick
 */
public record SweepReport(Instant sweptAt, int listed, int expired, int alreadyResolved, int failed) {

    public static SweepReport storeUnavailable(Instant sweptAt) {
        return new SweepReport(sweptAt, 0, 0, 0, 0);
    }
}
