package com.xpdustry.lexicon.common.bulk;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.xpdustry.lexicon.common.config.LexiconConfig;
import com.xpdustry.lexicon.common.functional.Result;
import com.xpdustry.lexicon.common.trie.WordTrie;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class BulkInsertServiceImpl implements BulkInsertService {

    private static final Logger LOGGER = LoggerFactory.getLogger(BulkInsertServiceImpl.class);

    private final BulkInsertWorker worker;
    private final LexiconConfig config;

    @Inject
    public BulkInsertServiceImpl(final BulkInsertWorker worker, final LexiconConfig config) {
        this.worker = worker;
        this.config = config;
    }

    @Override
    public Result<Integer, String> insert(
            final WordTrie.Mutable trie,
            final List<? extends @Nullable CharSequence> words,
            final BulkInsertOptions options) {
        Preconditions.checkNotNull(trie, "trie");
        Preconditions.checkNotNull(words, "words");
        Preconditions.checkNotNull(options, "options");

        if (options.useWorker() || words.size() > this.config.bulk().workerThreshold()) {
            final var chunkSize = options.chunkSize() == 0 ? this.config.bulk().chunkSize() : options.chunkSize();
            LOGGER.debug("Using background worker for {} words in chunks of {}", words.size(), chunkSize);
            return this.insertWithWorker(trie, words, chunkSize, options.onProgress());
        } else {
            LOGGER.debug("Using calling thread for {} words", words.size());
            return this.insertBatch(trie, words, options.onProgress());
        }
    }

    private Result<Integer, String> insertWithWorker(
            final WordTrie.Mutable trie,
            final List<? extends @Nullable CharSequence> words,
            final int chunkSize,
            final @Nullable ProgressListener listener) {
        final var timeout = this.config.bulk().workerTimeout();
        final var chunks = Lists.partition(words, chunkSize);
        var processed = 0;

        try {
            for (int i = 0; i < chunks.size(); i++) {
                final var chunk = chunks.get(i);
                LOGGER.trace("Processing chunk {}/{} with {} words", i + 1, chunks.size(), chunk.size());

                final var future = this.worker.submit(chunk);
                final List<String> indexed;
                try {
                    indexed = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                } catch (final TimeoutException e) {
                    future.cancel(true);
                    throw e;
                }

                for (final var word : indexed) {
                    trie.insert(word);
                }
                processed += chunk.size();
                notify(listener, processed, words.size());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while waiting for the bulk insert worker", e);
            return Result.failure("Interrupted after " + processed + " of " + words.size() + " words");
        } catch (final TimeoutException | ExecutionException | RejectedExecutionException e) {
            LOGGER.warn("Worker insertion failed after {} of {} words", processed, words.size(), e);
            final var limit = this.config.bulk().syncFallbackLimit();
            if (words.size() <= limit) {
                LOGGER.info("Falling back to calling thread for {} words", words.size());
                return this.insertBatch(trie, words, listener);
            }
            return Result.failure(describe(e));
        }

        LOGGER.debug("Worker processing complete, {} words processed", processed);
        return Result.success(processed);
    }

    private Result<Integer, String> insertBatch(
            final WordTrie.Mutable trie,
            final List<? extends @Nullable CharSequence> words,
            final @Nullable ProgressListener listener) {
        trie.insertAll(words);
        notify(listener, words.size(), words.size());
        return Result.success(words.size());
    }

    private static void notify(final @Nullable ProgressListener listener, final int processed, final int total) {
        if (listener != null) {
            listener.onProgress(BulkInsertProgress.of(processed, total));
        }
    }

    private static String describe(final Exception exception) {
        if (exception instanceof TimeoutException) {
            return "Worker timeout";
        }
        final var cause = Throwables.getRootCause(exception);
        return Objects.requireNonNullElse(cause.getMessage(), cause.getClass().getSimpleName());
    }
}
