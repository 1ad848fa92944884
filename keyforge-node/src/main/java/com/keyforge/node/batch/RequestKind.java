package com.keyforge.node.batch;

/**
 * Partition a batched request is flushed in.
 */
public enum RequestKind {
    SIGN,
    VERIFY
}
