package com.eainde.trace.graph;

import com.eainde.trace.error.MissingFieldException;
import com.eainde.trace.model.DocumentRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that both documents carry every required field before anything is built from them.
 */
public final class DocumentRecordValidator {

    public static final String PAPER_A = "Paper A";
    public static final String PAPER_B = "Paper B";

    private DocumentRecordValidator() {
    }

    /**
     * @throws MissingFieldException naming every absent field of both documents, e.g. {@code Paper B.variables}
     */
    public static void requireComplete(DocumentRecord paperA, DocumentRecord paperB) {
        List<String> missing = new ArrayList<>();
        collect(PAPER_A, paperA, missing);
        collect(PAPER_B, paperB, missing);
        if (!missing.isEmpty()) {
            throw new MissingFieldException(missing);
        }
    }

    private static void collect(String label, DocumentRecord document, List<String> sink) {
        List<String> absent = document == null ? DocumentRecord.REQUIRED_FIELDS : document.missingFields();
        for (String field : absent) {
            sink.add(label + "." + field);
        }
    }
}
