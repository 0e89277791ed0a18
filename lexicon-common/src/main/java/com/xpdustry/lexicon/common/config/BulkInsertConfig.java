package com.xpdustry.lexicon.common.config;

import com.google.common.base.Preconditions;
import java.time.Duration;
import org.spongepowered.configurate.objectmapping.ConfigSerializable;

/**
 * Tuning of the bulk insertion path.
 *
 * @param chunkSize         the default number of words handed to the worker at once
 * @param workerThreshold   batches larger than this go through the worker even when not requested
 * @param syncFallbackLimit the largest batch re-inserted on the calling thread after a worker failure
 * @param workerTimeout     how long a single chunk may take in the worker
 * @param workerIdleTime    how long the worker threads are kept without submissions
 * @param workerThreads     the size of the worker pool
 */
@ConfigSerializable
public record BulkInsertConfig(
        int chunkSize,
        int workerThreshold,
        int syncFallbackLimit,
        Duration workerTimeout,
        Duration workerIdleTime,
        int workerThreads) {

    public static final BulkInsertConfig DEFAULT =
            new BulkInsertConfig(100_000, 500_000, 500_000, Duration.ofSeconds(30), Duration.ofSeconds(30), 1);

    public BulkInsertConfig {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive, got %s", chunkSize);
        Preconditions.checkArgument(workerThreshold >= 0, "workerThreshold must be positive or zero");
        Preconditions.checkArgument(syncFallbackLimit >= 0, "syncFallbackLimit must be positive or zero");
        Preconditions.checkArgument(
                !workerTimeout.isNegative() && !workerTimeout.isZero(), "workerTimeout must be positive");
        Preconditions.checkArgument(
                !workerIdleTime.isNegative() && !workerIdleTime.isZero(), "workerIdleTime must be positive");
        Preconditions.checkArgument(workerThreads > 0, "workerThreads must be positive, got %s", workerThreads);
    }
}
