package com.eainde.trace.capability;

import java.io.Serializable;

/**
 * Raw text of one input paper.
 *
 * @param title may be empty when no title could be determined
 * @param text  document body handed to extraction
 */
public record SourceDocument(String title, String text) implements Serializable {

    public SourceDocument {
        title = title == null ? "" : title;
    }
}
