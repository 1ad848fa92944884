package com.keyforge.core.config;

import com.keyforge.core.error.ConfigurationException;

import java.time.Duration;

/**
 * Batch window and result caching settings for sign/verify requests.
 */
public record BatchSettings(
        int batchSize,
        Duration batchTimeout,
        Duration signatureTtl,
        Duration verificationTtl,
        int taskPriority
) {
    public BatchSettings {
        if (batchSize < 1) {
            throw new ConfigurationException("batch.batchSize must be at least 1, was " + batchSize);
        }
        Settings.requirePositive(batchTimeout, "batch.batchTimeout");
        Settings.requirePositive(signatureTtl, "batch.signatureTtl");
        Settings.requirePositive(verificationTtl, "batch.verificationTtl");
    }

    public static BatchSettings defaults() {
        return new BatchSettings(
                100,                         // batchSize
                Duration.ofSeconds(1),       // batchTimeout
                Duration.ofMinutes(15),      // signatureTtl
                Duration.ofMinutes(30),      // verificationTtl
                5                            // taskPriority (medium)
        );
    }

    public BatchSettings withBatchSize(int size) {
        return new BatchSettings(size, batchTimeout, signatureTtl, verificationTtl, taskPriority);
    }

    public BatchSettings withBatchTimeout(Duration timeout) {
        return new BatchSettings(batchSize, timeout, signatureTtl, verificationTtl, taskPriority);
    }
}
