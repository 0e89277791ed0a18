package com.xpdustry.lexicon.common.bulk;

import com.google.common.base.Preconditions;
import org.jspecify.annotations.Nullable;

/**
 * @param useWorker  forces the background worker regardless of the batch size
 * @param chunkSize  the number of words per worker submission, {@code 0} for the configured default
 * @param onProgress notified after each processed chunk
 */
public record BulkInsertOptions(
        boolean useWorker, int chunkSize, BulkInsertService.@Nullable ProgressListener onProgress) {

    public static final BulkInsertOptions DEFAULT = new BulkInsertOptions(false, 0, null);

    public BulkInsertOptions {
        Preconditions.checkArgument(chunkSize >= 0, "chunkSize must be positive or zero, got %s", chunkSize);
    }

    public BulkInsertOptions withWorker(final boolean useWorker) {
        return new BulkInsertOptions(useWorker, this.chunkSize, this.onProgress);
    }

    public BulkInsertOptions withChunkSize(final int chunkSize) {
        return new BulkInsertOptions(this.useWorker, chunkSize, this.onProgress);
    }

    public BulkInsertOptions withProgress(final BulkInsertService.@Nullable ProgressListener onProgress) {
        return new BulkInsertOptions(this.useWorker, this.chunkSize, onProgress);
    }
}
