package com.sgr.runtime.common.service.prompt;

import java.util.List;

/**
 * Resolved instruction text for one role. {@code origin} names the concrete
 * store or file (e.g. {@code litellm}, {@code registry}, {@code analyst.txt}).
 * {@code degradations} lists the lookups that were skipped because a store was
 * unreachable.
 */
public record PromptResolution(String text, PromptSource source, String origin, List<String> degradations) {

    public PromptResolution {
        degradations = degradations == null ? List.of() : List.copyOf(degradations);
    }

    public static PromptResolution inline(String text) {
        return new PromptResolution(text, PromptSource.INLINE, "inline", List.of());
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }
}
