package com.xpdustry.lexicon.common.bulk;

import com.xpdustry.lexicon.common.functional.Result;
import com.xpdustry.lexicon.common.trie.WordTrie;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Inserts large batches of words, optionally offloading the work to a background worker. The resulting trie is the
 * same as with sequential single-word inserts, and words merged before a failure stay in the trie.
 */
public interface BulkInsertService {

    /**
     * Inserts every non-empty word of the batch into the trie, blocking until done.
     *
     * @return the number of processed words, or a description of the failure
     */
    Result<Integer, String> insert(
            final WordTrie.Mutable trie,
            final List<? extends @Nullable CharSequence> words,
            final BulkInsertOptions options);

    default Result<Integer, String> insert(
            final WordTrie.Mutable trie, final List<? extends @Nullable CharSequence> words) {
        return this.insert(trie, words, BulkInsertOptions.DEFAULT);
    }

    @FunctionalInterface
    interface ProgressListener {

        void onProgress(final BulkInsertProgress progress);
    }
}
