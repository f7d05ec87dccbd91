package dev.pekelund.menuscan.menuparser.pipeline;

public enum ExtractionFailure {
    DECODE_FAILURE,
    NO_ITEMS_FOUND,
    TIMEOUT,
    SUPERSEDED
}
