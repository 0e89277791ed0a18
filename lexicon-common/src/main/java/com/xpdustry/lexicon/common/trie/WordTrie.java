package com.xpdustry.lexicon.common.trie;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A character tree indexing a set of words. Characters are handled by code point, so a surrogate pair is a single
 * edge of the tree. Result lists are never ordered.
 */
public interface WordTrie {

    int DEFAULT_FUZZY_DISTANCE = 1;

    int WILDCARD = '.';

    static WordTrie.Mutable create() {
        return new WordTrieImpl();
    }

    boolean search(final CharSequence word);

    boolean startsWith(final CharSequence prefix);

    /**
     * Returns every stored word starting with the given prefix, the prefix itself included if it is stored.
     */
    List<String> autocomplete(final CharSequence prefix);

    /**
     * Returns every stored word within the given Levenshtein distance of {@code word}.
     *
     * @throws IllegalArgumentException if {@code maxDistance} is negative
     */
    List<String> fuzzySearch(final CharSequence word, final int maxDistance);

    default List<String> fuzzySearch(final CharSequence word) {
        return this.fuzzySearch(word, DEFAULT_FUZZY_DISTANCE);
    }

    /**
     * Returns every stored word with the same length as the pattern, where {@code .} matches any character.
     */
    List<String> wildcardSearch(final CharSequence pattern);

    int countWords();

    List<String> listWords();

    boolean isEmpty();

    interface Mutable extends WordTrie {

        void insert(final CharSequence word);

        /**
         * Inserts every word of the batch, silently skipping {@code null} and empty elements.
         */
        default void insertAll(final Iterable<? extends @Nullable CharSequence> words) {
            for (final var word : words) {
                if (word != null && !word.isEmpty()) {
                    this.insert(word);
                }
            }
        }

        /**
         * Removes the word and prunes the branches it leaves dead.
         *
         * @return {@code true} if the word was stored
         */
        boolean delete(final CharSequence word);

        void clear();
    }
}
