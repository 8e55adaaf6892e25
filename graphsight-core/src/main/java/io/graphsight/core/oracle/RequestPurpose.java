package io.graphsight.core.oracle;

/// What an oracle request is asking for. Used for logging and by scripted oracles.
public enum RequestPurpose {
    CLASSIFY,
    INITIAL_FOCUS,
    STEP,
    AUDIT,
    REFINE
}
