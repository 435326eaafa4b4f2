package com.eainde.trace.capability;

import com.eainde.trace.model.DocumentRecord;

/**
 * Turns the raw text of one paper into a structured {@link DocumentRecord}.
 * Implementations raise on malformed or empty input.
 */
@FunctionalInterface
public interface ExtractionCapability {

    DocumentRecord extract(String text, String title);
}
