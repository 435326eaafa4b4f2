package com.eainde.trace.hypothesis;

import com.eainde.trace.model.HypothesisRecord;
import com.eainde.trace.model.ValidationResult;
import lombok.extern.log4j.Log4j2;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Bounded generate / validate / repair loop for one hypothesis.
 *
 * <pre>
 *   GENERATE -> VALIDATE -> ACCEPT       valid
 *                        -> REGENERATE   invalid, attempt &lt; maxRetries
 *                        -> REPAIR       invalid, attempt == maxRetries
 * </pre>
 *
 * At most {@code maxRetries + 1} generation calls are made, one after another. Every generated
 * record gets a fresh {@code trace_hyp_} id. Capability and format failures propagate; they are
 * not retried here.
 */
@Log4j2
public class RetryCoordinator {

    public static final int DEFAULT_MAX_RETRIES = 2;
    static final String ID_PREFIX = "trace_hyp_";

    enum Transition {
        ACCEPT,
        REGENERATE,
        REPAIR;

        static Transition after(ValidationResult result, int attempt, int maxRetries) {
            if (result.valid()) {
                return ACCEPT;
            }
            return attempt < maxRetries ? REGENERATE : REPAIR;
        }
    }

    private final HypothesisGenerator generator;
    private final GroundingValidator validator;
    private final HypothesisRepairer repairer;
    private final int maxRetries;
    private final Supplier<String> idSupplier;

    public RetryCoordinator(HypothesisGenerator generator,
                            GroundingValidator validator,
                            HypothesisRepairer repairer,
                            int maxRetries) {
        this(generator, validator, repairer, maxRetries, RetryCoordinator::newHypothesisId);
    }

    RetryCoordinator(HypothesisGenerator generator,
                     GroundingValidator validator,
                     HypothesisRepairer repairer,
                     int maxRetries,
                     Supplier<String> idSupplier) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 but was " + maxRetries);
        }
        this.generator = generator;
        this.validator = validator;
        this.repairer = repairer;
        this.maxRetries = maxRetries;
        this.idSupplier = idSupplier;
    }

    public GenerationOutcome run(HypothesisContext context) {
        int attempt = 0;
        List<String> previousErrors = List.of();
        while (true) {
            HypothesisRecord candidate = generator.generate(context, attempt, previousErrors)
                    .withHypothesisId(idSupplier.get());
            ValidationResult result = validator.validate(candidate, context.reference());

            switch (Transition.after(result, attempt, maxRetries)) {
                case ACCEPT -> {
                    log.info("Hypothesis {} accepted on attempt {}", candidate.hypothesisId(), attempt + 1);
                    return new GenerationOutcome(candidate, attempt + 1, false, List.of());
                }
                case REGENERATE -> {
                    log.warn("Hypothesis {} failed grounding ({}), regenerating", candidate.hypothesisId(), result.errors());
                    previousErrors = result.errors();
                    attempt++;
                }
                case REPAIR -> {
                    log.warn("Retries exhausted for {}, repairing: {}", candidate.hypothesisId(), result.errors());
                    HypothesisRecord repaired = repairer.repair(candidate, context.reference(), context.fallbackSynergyId());
                    return new GenerationOutcome(repaired, attempt + 1, true, result.errors());
                }
                default -> throw new IllegalStateException("Unhandled transition");
            }
        }
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    static String newHypothesisId() {
        return ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
