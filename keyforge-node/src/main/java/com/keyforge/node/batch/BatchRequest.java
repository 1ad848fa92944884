package com.keyforge.node.batch;

import com.keyforge.core.spi.CryptoBackend;
import com.keyforge.node.pool.TaskType;

import java.time.Clock;

/**
 * A signature-like request that can be batched, deduplicated and cached.
 * Two requests with the same {@link #cacheKey()} are the same request.
 *
 * @param <R> result type
 */
public sealed interface BatchRequest<R> permits SignRequest, VerifyRequest {

    RequestKind kind();

    String cacheKey();

    Class<R> resultType();

    TaskType taskType();

    /**
     * Runs the request against the backend. Called on a worker thread.
     */
    R execute(CryptoBackend backend, Clock clock);
}
