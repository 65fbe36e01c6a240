package com.sgr.runtime.common.service.tool;

import java.util.List;

/**
 * The tools of one role: callable bindings plus their redacted snapshots.
 */
public record ToolResolution(List<ToolBinding> bindings, List<ToolSnapshot> snapshots) {

    public static final ToolResolution EMPTY = new ToolResolution(List.of(), List.of());

    public ToolResolution {
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
        snapshots = snapshots == null ? List.of() : List.copyOf(snapshots);
    }
}
