package com.xpdustry.lexicon.common.trie;

import com.google.common.base.Preconditions;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.jspecify.annotations.Nullable;

final class WordTrieImpl implements WordTrie.Mutable {

    private Node root = new Node();

    @Override
    public void insert(final CharSequence word) {
        Preconditions.checkNotNull(word, "word");

        var node = this.root;
        for (int i = 0; i < word.length(); ) {
            final var c = Character.codePointAt(word, i);
            var next = node.child(c);
            if (next == null) {
                next = new Node();
                node.put(c, next);
            }
            node = next;
            i += Character.charCount(c);
        }

        node.terminal = true;
    }

    @Override
    public boolean search(final CharSequence word) {
        Preconditions.checkNotNull(word, "word");
        final var node = this.find(word);
        return node != null && node.terminal;
    }

    @Override
    public boolean startsWith(final CharSequence prefix) {
        Preconditions.checkNotNull(prefix, "prefix");
        return this.find(prefix) != null;
    }

    @Override
    public boolean delete(final CharSequence word) {
        Preconditions.checkNotNull(word, "word");

        final var chars = word.codePoints().toArray();
        final var path = new Node[chars.length + 1];
        path[0] = this.root;
        for (int i = 0; i < chars.length; i++) {
            final var next = path[i].child(chars[i]);
            if (next == null) {
                return false;
            }
            path[i + 1] = next;
        }

        final var last = path[chars.length];
        if (!last.terminal) {
            return false;
        }
        last.terminal = false;

        // Detach nodes that no longer lead to a word, up to the first terminal or branching ancestor
        for (int i = chars.length; i > 0 && !path[i].terminal && path[i].isLeaf(); i--) {
            path[i - 1].remove(chars[i - 1]);
        }
        return true;
    }

    @Override
    public void clear() {
        this.root = new Node();
    }

    @Override
    public List<String> autocomplete(final CharSequence prefix) {
        Preconditions.checkNotNull(prefix, "prefix");

        final var node = this.find(prefix);
        if (node == null) {
            return List.of();
        }

        final List<String> words = new ArrayList<>();
        collect(node, new StringBuilder(prefix), words);
        return words;
    }

    @Override
    public List<String> fuzzySearch(final CharSequence word, final int maxDistance) {
        Preconditions.checkNotNull(word, "word");
        Preconditions.checkArgument(maxDistance >= 0, "maxDistance must be positive or zero, got %s", maxDistance);

        final var target = word.codePoints().toArray();
        final var row = new int[target.length + 1];
        for (int i = 0; i < row.length; i++) {
            row[i] = i;
        }

        final List<String> words = new ArrayList<>();
        final var path = new StringBuilder();
        final Deque<FuzzyStep> stack = new ArrayDeque<>();

        // The root only seeds the first row, an empty word is never matched through it
        pushChildren(this.root, (child, c) -> stack.push(new FuzzyStep(child, c, 0, row)));

        while (!stack.isEmpty()) {
            final var step = stack.pop();
            final var current = new int[row.length];
            current[0] = step.previous[0] + 1;
            var minimum = current[0];

            for (int i = 1; i < current.length; i++) {
                final var insertion = current[i - 1] + 1;
                final var deletion = step.previous[i] + 1;
                final var substitution = step.previous[i - 1] + (target[i - 1] == step.c ? 0 : 1);
                current[i] = Math.min(insertion, Math.min(deletion, substitution));
                minimum = Math.min(minimum, current[i]);
            }

            path.setLength(step.offset);
            path.appendCodePoint(step.c);

            if (step.node.terminal && current[target.length] <= maxDistance) {
                words.add(path.toString());
            }

            // The row minimum is a lower bound for every extension of this path
            if (minimum <= maxDistance) {
                final var offset = path.length();
                pushChildren(step.node, (child, c) -> stack.push(new FuzzyStep(child, c, offset, current)));
            }
        }

        return words;
    }

    @Override
    public List<String> wildcardSearch(final CharSequence pattern) {
        Preconditions.checkNotNull(pattern, "pattern");

        final var chars = pattern.codePoints().toArray();
        final List<String> words = new ArrayList<>();
        final var path = new StringBuilder();
        final Deque<Cursor> stack = new ArrayDeque<>();
        stack.push(new Cursor(this.root, Cursor.NONE, 0, 0));

        while (!stack.isEmpty()) {
            final var cursor = stack.pop();
            cursor.moveTo(path);

            if (cursor.depth == chars.length) {
                if (cursor.node.terminal) {
                    words.add(path.toString());
                }
                continue;
            }

            final var offset = path.length();
            final var depth = cursor.depth + 1;
            final var c = chars[cursor.depth];
            if (c == WordTrie.WILDCARD) {
                pushChildren(cursor.node, (child, key) -> stack.push(new Cursor(child, key, offset, depth)));
            } else {
                final var child = cursor.node.child(c);
                if (child != null) {
                    stack.push(new Cursor(child, c, offset, depth));
                }
            }
        }

        return words;
    }

    @Override
    public int countWords() {
        var count = 0;
        final Deque<Node> stack = new ArrayDeque<>();
        stack.push(this.root);
        while (!stack.isEmpty()) {
            final var node = stack.pop();
            if (node.terminal) {
                count++;
            }
            if (node.children != null) {
                node.children.forEachValue(child -> {
                    stack.push(child);
                    return true;
                });
            }
        }
        return count;
    }

    @Override
    public List<String> listWords() {
        final List<String> words = new ArrayList<>();
        collect(this.root, new StringBuilder(), words);
        return words;
    }

    @Override
    public boolean isEmpty() {
        return !this.root.terminal && this.root.isLeaf();
    }

    private @Nullable Node find(final CharSequence chars) {
        var node = this.root;
        for (int i = 0; i < chars.length(); ) {
            final var c = Character.codePointAt(chars, i);
            node = node.child(c);
            if (node == null) {
                return null;
            }
            i += Character.charCount(c);
        }
        return node;
    }

    private static void collect(final Node start, final StringBuilder path, final List<String> words) {
        final Deque<Cursor> stack = new ArrayDeque<>();
        stack.push(new Cursor(start, Cursor.NONE, path.length(), 0));
        while (!stack.isEmpty()) {
            final var cursor = stack.pop();
            cursor.moveTo(path);
            if (cursor.node.terminal) {
                words.add(path.toString());
            }
            final var offset = path.length();
            pushChildren(cursor.node, (child, c) -> stack.push(new Cursor(child, c, offset, cursor.depth + 1)));
        }
    }

    private static void pushChildren(final Node node, final ChildVisitor visitor) {
        if (node.children == null) {
            return;
        }
        for (final var iterator = node.children.iterator(); iterator.hasNext(); ) {
            iterator.advance();
            visitor.visit(iterator.value(), iterator.key());
        }
    }

    private static final class Node {

        private @Nullable TIntObjectMap<Node> children = null;
        private boolean terminal = false;

        private @Nullable Node child(final int c) {
            return this.children == null ? null : this.children.get(c);
        }

        private void put(final int c, final Node child) {
            if (this.children == null) {
                this.children = new TIntObjectHashMap<>();
            }
            this.children.put(c, child);
        }

        private void remove(final int c) {
            if (this.children == null) {
                return;
            }
            this.children.remove(c);
            if (this.children.isEmpty()) {
                this.children = null;
            }
        }

        private boolean isLeaf() {
            return this.children == null;
        }
    }

    @FunctionalInterface
    private interface ChildVisitor {
        void visit(Node child, int c);
    }

    // A pending node of a depth-first walk, offset is the path length of its parent
    private record Cursor(Node node, int c, int offset, int depth) {

        private static final int NONE = -1;

        private void moveTo(final StringBuilder path) {
            path.setLength(this.offset);
            if (this.c != NONE) {
                path.appendCodePoint(this.c);
            }
        }
    }

    private record FuzzyStep(Node node, int c, int offset, int[] previous) {}
}
