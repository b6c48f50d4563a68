package io.github.yok.flexpipeline.core;

/**
 * Terminal status of a pipeline run.
 *
 * @author Yasuharu.Okawauchi
 */
public enum RunStatus {

    // All stages ran; projections were built and exported.
    COMPLETED,

    // Schema errors were found under stop mode; nothing after schema validation ran.
    HALTED_SCHEMA,

    // A custom rule was violated under stop mode; no projections were built.
    HALTED_RULE
}
