package com.eainde.trace.capability;

/**
 * Opaque text generation. The returned text is expected to contain a JSON object, possibly wrapped
 * in markdown fences or commentary. Calls are stateless: every prompt must carry its full context.
 */
@FunctionalInterface
public interface GenerationCapability {

    String generate(String prompt);
}
