package com.keyforge.node.pool;

/**
 * Kinds of CPU-bound work the worker pool runs.
 */
public enum TaskType {
    GENERATE_KEY_MATERIAL,
    SIGN,
    VERIFY,
    CALCULATE_ENERGY
}
