package com.invoice.memory.core.model;

/**
 * Stages of the decision pipeline, in execution order.
 */
public enum PipelineStep {
    RECALL,
    APPLY,
    DECIDE,
    LEARN
}
