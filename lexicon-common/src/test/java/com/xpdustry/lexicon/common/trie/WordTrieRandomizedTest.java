package com.xpdustry.lexicon.common.trie;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.RepetitionInfo;

// Checks the trie against naive scans over a plain set
final class WordTrieRandomizedTest {

    private static final char[] ALPHABET = {'a', 'b', 'c', 'd'};

    @RepeatedTest(10)
    void test_against_set(final RepetitionInfo info) {
        final var random = new Random(info.getCurrentRepetition());
        final var trie = WordTrie.create();
        final Set<String> expected = new HashSet<>();

        for (int i = 0; i < 200; i++) {
            final var word = randomWord(random, 0, 6);
            trie.insert(word);
            expected.add(word);
        }

        final List<String> inserted = new ArrayList<>(expected);
        for (int i = 0; i < 60; i++) {
            final var word = random.nextBoolean()
                    ? inserted.get(random.nextInt(inserted.size()))
                    : randomWord(random, 1, 6);
            Assertions.assertEquals(expected.remove(word), trie.delete(word), word);
        }

        Assertions.assertEquals(expected.size(), trie.countWords());
        assertThat(trie.listWords()).containsExactlyInAnyOrderElementsOf(expected);

        for (int i = 0; i < 30; i++) {
            final var query = randomWord(random, 0, 6);
            Assertions.assertEquals(expected.contains(query), trie.search(query), query);
            Assertions.assertEquals(
                    expected.stream().anyMatch(word -> word.startsWith(query)), trie.startsWith(query), query);
            assertThat(trie.autocomplete(query))
                    .containsExactlyInAnyOrderElementsOf(expected.stream()
                            .filter(word -> word.startsWith(query))
                            .toList());

            // The empty word sits on the root, which never takes part in fuzzy matching
            final var distance = random.nextInt(3);
            assertThat(trie.fuzzySearch(query, distance))
                    .as("fuzzy %s within %s", query, distance)
                    .containsExactlyInAnyOrderElementsOf(expected.stream()
                            .filter(word -> !word.isEmpty() && levenshtein(word, query) <= distance)
                            .toList());

            final var pattern = randomPattern(random);
            assertThat(trie.wildcardSearch(pattern))
                    .as("wildcard %s", pattern)
                    .containsExactlyInAnyOrderElementsOf(expected.stream()
                            .filter(word -> matches(word, pattern))
                            .toList());
        }
    }

    private static String randomWord(final Random random, final int min, final int max) {
        final var length = min + random.nextInt(max - min + 1);
        final var builder = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            builder.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return builder.toString();
    }

    private static String randomPattern(final Random random) {
        final var builder = new StringBuilder(randomWord(random, 1, 5));
        for (int i = 0; i < builder.length(); i++) {
            if (random.nextInt(3) == 0) {
                builder.setCharAt(i, '.');
            }
        }
        return builder.toString();
    }

    private static boolean matches(final String word, final String pattern) {
        if (word.length() != pattern.length()) {
            return false;
        }
        for (int i = 0; i < word.length(); i++) {
            if (pattern.charAt(i) != '.' && pattern.charAt(i) != word.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static int levenshtein(final String a, final String b) {
        final var matrix = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) {
            matrix[i][0] = i;
        }
        for (int j = 0; j <= b.length(); j++) {
            matrix[0][j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                final var cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                matrix[i][j] = Math.min(
                        Math.min(matrix[i - 1][j] + 1, matrix[i][j - 1] + 1), matrix[i - 1][j - 1] + cost);
            }
        }
        return matrix[a.length()][b.length()];
    }
}
