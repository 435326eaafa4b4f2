package com.eainde.trace.hypothesis;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds coordinators that hand out predictable hypothesis ids
 * ({@code trace_hyp_00000001}, {@code trace_hyp_00000002}, ...).
 */
public final class RetryCoordinators {

    private RetryCoordinators() {
    }

    public static RetryCoordinator withSequentialIds(HypothesisGenerator generator, int maxRetries) {
        GroundingValidator validator = new GroundingValidator();
        AtomicInteger ids = new AtomicInteger();
        return new RetryCoordinator(generator, validator, new HypothesisRepairer(validator), maxRetries,
                () -> RetryCoordinator.ID_PREFIX + String.format("%08x", ids.incrementAndGet()));
    }
}
