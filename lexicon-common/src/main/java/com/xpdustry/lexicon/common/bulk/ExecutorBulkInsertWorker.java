package com.xpdustry.lexicon.common.bulk;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.xpdustry.lexicon.common.config.LexiconConfig;
import com.xpdustry.lexicon.common.lifecycle.LifecycleListener;
import com.xpdustry.lexicon.common.trie.WordTrie;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ExecutorBulkInsertWorker implements BulkInsertWorker, LifecycleListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorBulkInsertWorker.class);

    private final LexiconConfig config;
    private final Object lock = new Object();
    private @Nullable ThreadPoolExecutor executor = null;
    private boolean closed = false;

    @Inject
    public ExecutorBulkInsertWorker(final LexiconConfig config) {
        this.config = config;
    }

    @Override
    public Future<List<String>> submit(final List<? extends @Nullable CharSequence> chunk) {
        return this.executor().submit(() -> {
            final var scratch = WordTrie.create();
            for (final var word : chunk) {
                // A timed out chunk is cancelled with an interrupt, stop before indexing the rest
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("Indexing of a chunk of " + chunk.size() + " words was cancelled");
                }
                if (word != null && word.length() > 0) {
                    scratch.insert(word);
                }
            }
            final var words = scratch.listWords();
            LOGGER.trace("Indexed {} distinct words out of {}", words.size(), chunk.size());
            return words;
        });
    }

    @Override
    public void onLexiconExit() {
        final ThreadPoolExecutor executor;
        synchronized (this.lock) {
            this.closed = true;
            executor = this.executor;
            this.executor = null;
        }
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            LOGGER.error("Interrupted while shutting down the bulk insert worker", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    int poolSize() {
        synchronized (this.lock) {
            return this.executor == null ? 0 : this.executor.getPoolSize();
        }
    }

    private ExecutorService executor() {
        synchronized (this.lock) {
            if (this.closed) {
                throw new RejectedExecutionException("The bulk insert worker has been shut down");
            }
            if (this.executor == null) {
                final var bulk = this.config.bulk();
                LOGGER.debug("Starting bulk insert worker with {} threads", bulk.workerThreads());
                final var executor = new ThreadPoolExecutor(
                        bulk.workerThreads(),
                        bulk.workerThreads(),
                        bulk.workerIdleTime().toMillis(),
                        TimeUnit.MILLISECONDS,
                        new LinkedBlockingQueue<>(),
                        new ThreadFactoryBuilder()
                                .setDaemon(true)
                                .setNameFormat("lexicon-bulk-worker-%d")
                                .build());
                // Idle threads die off, the pool respawns them on the next submission
                executor.allowCoreThreadTimeOut(true);
                this.executor = executor;
            }
            return this.executor;
        }
    }
}
