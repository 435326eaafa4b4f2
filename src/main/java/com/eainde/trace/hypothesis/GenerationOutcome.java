package com.eainde.trace.hypothesis;

import com.eainde.trace.model.HypothesisRecord;

import java.io.Serializable;
import java.util.List;

/**
 * @param hypothesis the accepted or repaired record
 * @param attempts   generation calls made, between 1 and {@code maxRetries + 1}
 * @param repaired   whether the record came out of repair rather than acceptance
 * @param lastErrors validation errors of the final attempt, empty when accepted
 */
public record GenerationOutcome(
        HypothesisRecord hypothesis,
        int attempts,
        boolean repaired,
        List<String> lastErrors
) implements Serializable {

    public GenerationOutcome {
        lastErrors = List.copyOf(lastErrors);
    }
}
