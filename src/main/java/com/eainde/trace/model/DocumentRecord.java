package com.eainde.trace.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured extraction of one paper's scientific content.
 *
 * <p>Every list is required. A field absent from the extraction output stays {@code null} here so
 * that {@link #missingFields()} can report it; present lists are copied and frozen.</p>
 *
 * @param claims              ordered claims; claim {@code i} becomes node {@code X_claim_(i+1)}
 * @param methods             named methods or techniques
 * @param evidence            supporting evidence snippets
 * @param explicitLimitations limitations the authors state
 * @param implicitLimitations limitations inferred from the text
 * @param variables           measured or manipulated variables; variable {@code j} becomes node {@code X_var_(j+1)}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentRecord(
        @JsonProperty("claims")               List<String> claims,
        @JsonProperty("methods")              List<String> methods,
        @JsonProperty("evidence")             List<String> evidence,
        @JsonProperty("explicit_limitations") List<String> explicitLimitations,
        @JsonProperty("implicit_limitations") List<String> implicitLimitations,
        @JsonProperty("variables")            List<String> variables
) implements Serializable {

    public static final List<String> REQUIRED_FIELDS = List.of(
            "claims", "methods", "evidence", "explicit_limitations", "implicit_limitations", "variables");

    public DocumentRecord {
        claims = freeze(claims);
        methods = freeze(methods);
        evidence = freeze(evidence);
        explicitLimitations = freeze(explicitLimitations);
        implicitLimitations = freeze(implicitLimitations);
        variables = freeze(variables);
    }

    /**
     * JSON names of the required fields that are absent, in declaration order.
     */
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (claims == null) missing.add("claims");
        if (methods == null) missing.add("methods");
        if (evidence == null) missing.add("evidence");
        if (explicitLimitations == null) missing.add("explicit_limitations");
        if (implicitLimitations == null) missing.add("implicit_limitations");
        if (variables == null) missing.add("variables");
        return missing;
    }

    private static List<String> freeze(List<String> values) {
        return ModelLists.copyOrNull(values);
    }
}
