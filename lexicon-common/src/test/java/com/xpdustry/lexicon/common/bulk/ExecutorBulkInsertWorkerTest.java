package com.xpdustry.lexicon.common.bulk;

import static org.assertj.core.api.Assertions.assertThat;

import com.xpdustry.lexicon.common.config.BulkInsertConfig;
import com.xpdustry.lexicon.common.config.LexiconConfig;
import java.time.Duration;
import java.util.AbstractList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ExecutorBulkInsertWorkerTest {

    @Test
    void test_submit() {
        this.withWorker(Duration.ofSeconds(30), worker -> {
            final var future = worker.submit(List.of("apple", "app", "apple", ""));
            assertThat(get(future)).containsExactlyInAnyOrder("apple", "app");
            Assertions.assertEquals(1, worker.poolSize());
        });
    }

    @Test
    void test_cancelled_chunk_releases_thread() {
        this.withWorker(Duration.ofSeconds(30), worker -> {
            final var endless = worker.submit(endless());
            Assertions.assertTrue(endless.cancel(true));
            Assertions.assertThrows(CancellationException.class, endless::get);

            // The pool has a single thread, it must drop the cancelled chunk to index this one
            assertThat(get(worker.submit(List.of("banana")))).containsExactly("banana");
        });
    }

    @Test
    void test_idle_threads_respawn() {
        this.withWorker(Duration.ofMillis(50), worker -> {
            assertThat(get(worker.submit(List.of("apple")))).containsExactly("apple");
            awaitPoolSize(worker, 0);

            assertThat(get(worker.submit(List.of("banana", "bath")))).containsExactlyInAnyOrder("banana", "bath");
            awaitPoolSize(worker, 0);
        });
    }

    private void withWorker(final Duration idleTime, final Consumer<ExecutorBulkInsertWorker> consumer) {
        final var worker = new ExecutorBulkInsertWorker(
                new LexiconConfig(new BulkInsertConfig(4, 20, 20, Duration.ofSeconds(5), idleTime, 1)));
        try {
            consumer.accept(worker);
        } finally {
            worker.onLexiconExit();
        }
    }

    private static List<String> get(final Future<List<String>> future) {
        try {
            return future.get(5, TimeUnit.SECONDS);
        } catch (final Exception e) {
            throw new AssertionError("The worker did not index the chunk", e);
        }
    }

    private static void awaitPoolSize(final ExecutorBulkInsertWorker worker, final int expected) {
        final var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (worker.poolSize() != expected && System.nanoTime() < deadline) {
            try {
                Thread.sleep(10);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError(e);
            }
        }
        Assertions.assertEquals(expected, worker.poolSize());
    }

    // Cycles through a thousand words, indexing it never finishes unless cancelled
    static List<String> endless() {
        return new AbstractList<>() {
            @Override
            public String get(final int index) {
                return "word" + (index % 1000);
            }

            @Override
            public int size() {
                return Integer.MAX_VALUE;
            }
        };
    }
}
