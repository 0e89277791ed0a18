package com.xpdustry.lexicon.common;

import static org.assertj.core.api.Assertions.assertThat;

import com.xpdustry.lexicon.common.bulk.BulkInsertModule;
import com.xpdustry.lexicon.common.bulk.BulkInsertOptions;
import com.xpdustry.lexicon.common.bulk.BulkInsertService;
import com.xpdustry.lexicon.common.config.LexiconConfig;
import com.xpdustry.lexicon.common.factory.ObjectFactory;
import com.xpdustry.lexicon.common.lifecycle.LifecycleModule;
import com.xpdustry.lexicon.common.lifecycle.LifecycleService;
import com.xpdustry.lexicon.common.trie.WordTrie;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class LexiconModuleTest {

    @Test
    void test_wiring(final @TempDir Path directory) throws IOException {
        Files.writeString(directory.resolve("lexicon.yml"), "bulk:\n  chunk-size: 2\n");
        final var factory =
                ObjectFactory.create(new LexiconModule(directory), new LifecycleModule(), new BulkInsertModule());
        final var lifecycle = factory.get(LifecycleService.class);
        lifecycle.load();
        try {
            Assertions.assertEquals(2, factory.get(LexiconConfig.class).bulk().chunkSize());
            Assertions.assertEquals(directory, factory.get(Path.class, "directory"));

            final var trie = WordTrie.create();
            final var result = factory.get(BulkInsertService.class)
                    .insert(
                            trie,
                            List.of("apple", "app", "application", "banana", "bat"),
                            BulkInsertOptions.DEFAULT.withWorker(true));
            Assertions.assertEquals(5, result.value());
            assertThat(trie.autocomplete("ap")).containsExactlyInAnyOrder("apple", "app", "application");
            assertThat(trie.wildcardSearch("app..")).containsExactly("apple");
        } finally {
            Assertions.assertTrue(lifecycle.exit());
        }
    }
}
