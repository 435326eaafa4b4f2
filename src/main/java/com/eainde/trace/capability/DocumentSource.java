package com.eainde.trace.capability;

import java.util.List;

/**
 * Supplies the two raw documents of a run.
 */
@FunctionalInterface
public interface DocumentSource {

    /**
     * @param location implementation-specific location (a folder for {@link FolderDocumentSource})
     * @return exactly two documents, A first
     */
    List<SourceDocument> read(String location);
}
