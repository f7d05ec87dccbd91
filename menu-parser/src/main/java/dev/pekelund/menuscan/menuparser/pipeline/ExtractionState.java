package dev.pekelund.menuscan.menuparser.pipeline;

/**
 * Stages of one extraction run. {@link #REGION_DETECTING} and {@link #MATCHING} only occur for image input.
 */
public enum ExtractionState {
    IDLE,
    DECODING,
    EXTRACTING,
    REGION_DETECTING,
    MATCHING,
    DONE,
    FAILED
}
