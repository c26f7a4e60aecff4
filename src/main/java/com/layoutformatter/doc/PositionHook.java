package com.layoutformatter.doc;

/**
 * Callback invoked by the renderer when it reaches a {@link Doc.Mark}.
 */
@FunctionalInterface
public interface PositionHook {
    void reached(RenderPosition position);
}
