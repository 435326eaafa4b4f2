package com.eainde.trace.workflow;

import com.eainde.trace.state.PipelineState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Input of one run: either a folder holding the two documents, or the two texts directly.
 *
 * @param runId optional; generated when {@code null}
 */
public record PipelineRequest(
        String inputFolder,
        String paperAText,
        String paperATitle,
        String paperBText,
        String paperBTitle,
        String author,
        String runId
) {

    public static PipelineRequest fromFolder(String inputFolder, String author) {
        return new PipelineRequest(inputFolder, null, null, null, null, author, null);
    }

    public static PipelineRequest fromTexts(String paperAText, String paperBText, String author) {
        return new PipelineRequest(null, paperAText, "", paperBText, "", author, null);
    }

    public PipelineRequest withRunId(String id) {
        return new PipelineRequest(inputFolder, paperAText, paperATitle, paperBText, paperBTitle, author, id);
    }

    Map<String, Object> toInitialState(String effectiveRunId, Instant startedAt) {
        Map<String, Object> state = new HashMap<>();
        state.put(PipelineState.RUN_ID, effectiveRunId);
        state.put(PipelineState.PIPELINE_STARTED_AT, startedAt);
        putIfPresent(state, PipelineState.INPUT_FOLDER, inputFolder);
        putIfPresent(state, PipelineState.AUTHOR, author);
        putIfPresent(state, PipelineState.PAPER_A_TEXT, paperAText);
        putIfPresent(state, PipelineState.PAPER_A_TITLE, paperATitle);
        putIfPresent(state, PipelineState.PAPER_B_TEXT, paperBText);
        putIfPresent(state, PipelineState.PAPER_B_TITLE, paperBTitle);
        return state;
    }

    private static void putIfPresent(Map<String, Object> state, String key, String value) {
        if (value != null) {
            state.put(key, value);
        }
    }
}
