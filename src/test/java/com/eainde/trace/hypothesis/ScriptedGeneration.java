package com.eainde.trace.hypothesis;

import com.eainde.trace.capability.GenerationCapability;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Replays canned generation output and records every prompt. The last reply repeats.
 */
class ScriptedGeneration implements GenerationCapability {

    private final Deque<String> replies;
    final List<String> prompts = new ArrayList<>();

    ScriptedGeneration(String... replies) {
        this.replies = new ArrayDeque<>(List.of(replies));
    }

    @Override
    public synchronized String generate(String prompt) {
        prompts.add(prompt);
        return replies.size() > 1 ? replies.poll() : replies.peek();
    }
}
