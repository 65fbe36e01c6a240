package com.sgr.runtime.common.service.prompt;

/**
 * Where a role's instruction text came from, in fallback order.
 */
public enum PromptSource {
    INLINE,
    EXTERNAL_PROMPT_ID,
    PROMPT_REF,
    LOCAL_FILE;

    public String value() {
        return name().toLowerCase();
    }
}
