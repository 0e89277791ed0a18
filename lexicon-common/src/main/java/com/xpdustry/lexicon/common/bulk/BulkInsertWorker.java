package com.xpdustry.lexicon.common.bulk;

import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.jspecify.annotations.Nullable;

public interface BulkInsertWorker {

    /**
     * Indexes the chunk away from the calling thread.
     *
     * @return the distinct words of the chunk, to be merged into the primary trie
     * @throws RejectedExecutionException if the worker cannot accept the chunk
     */
    Future<List<String>> submit(final List<? extends @Nullable CharSequence> chunk);
}
