package com.prettydoc.core.renderer;

/**
 * Ambient wrap mode under which a subtree is rendered.
 */
public enum WrapMode {
    /** Line breaks are emitted and indentation applies */
    ENABLE,
    /** Content renders flat; nested groups still decide for themselves */
    DETECT
}
