package org.sn.triedfa.automaton;

import static java.lang.System.Logger.Level.TRACE;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;
import org.sn.triedfa.util.Iterables;


/**
 * Deterministic finite automaton built as a character trie.
 *
 * <p>Each inserted word is a path from the root, and words with a common prefix share the states of that prefix.
 * The last state of each word is accepting.
 * Matching walks one state per symbol and ignores symbols in the skip set (ASCII punctuation by default).
 * A symbol with no transition sends the walk to the sink state, which is never left, so the text is rejected.
 *
 * <p>States are stored in a list and referenced by index. The root is index 0 and the sink is the sentinel index -1,
 * which is never stored as a transition.
 *
 * <p>Build the automaton with insert, then use it for matching and export.
 * Inserting while another thread reads the automaton is not supported.
 */
@NotThreadSafe
public class TrieDfa {
    private static final System.Logger LOGGER = System.getLogger(TrieDfa.class.getName());

    static final int ROOT = 0;
    static final int SINK = -1;

    public static Builder builder() {
        return new Builder();
    }

    private final List<TrieDfaState> states = new ArrayList<>();
    private final PunctuationSet skipSymbols;
    private final DotStyle dotStyle;
    private int size;

    /**
     * Create an empty automaton that skips ASCII punctuation and exports with the default style.
     */
    public TrieDfa() {
        this(PunctuationSet.ascii(), DotStyle.defaults());
    }

    public TrieDfa(@Nonnull PunctuationSet skipSymbols, @Nonnull DotStyle dotStyle) {
        this.skipSymbols = Objects.requireNonNull(skipSymbols);
        this.dotStyle = Objects.requireNonNull(dotStyle);
        states.add(new TrieDfaState());
    }

    /**
     * Add a word to the automaton.
     * Existing states along the word's path are reused, and the last state is marked accepting.
     * The empty word marks the root accepting.
     *
     * @throws NullPointerException if word is null
     */
    public void insert(@Nonnull CharSequence word) {
        insert(Iterables.charsIteratorAsChar(word));
    }

    /**
     * Add a word to the automaton.
     *
     * @throws NullPointerException if word or any symbol in it is null
     */
    public void insert(@Nonnull Iterable<Character> word) {
        int current = ROOT;
        int statesBefore = states.size();
        StringBuilder loggedWord = LOGGER.isLoggable(TRACE) ? new StringBuilder() : null;
        for (Character symbol : word) {
            char ch = symbol;
            if (loggedWord != null) {
                loggedWord.append(ch);
            }
            int child = states.get(current).next(ch);
            if (child == SINK) {
                child = states.size();
                states.add(new TrieDfaState());
                states.get(current).addTransition(ch, child);
            }
            current = child;
        }
        if (states.get(current).markAccepting()) {
            size++;
        }
        if (loggedWord != null) {
            LOGGER.log(TRACE, "Inserted word: word=" + loggedWord + ", newStates=" + (states.size() - statesBefore));
        }
    }

    public void insertAll(@Nonnull Iterable<? extends CharSequence> words) {
        for (CharSequence word : words) {
            insert(word);
        }
    }

    /**
     * Test whether the text is one of the inserted words, ignoring the skip symbols.
     * For example if "cat" was inserted then "c,a.t" is accepted, but "ca" and "cats" are not.
     *
     * @throws NullPointerException if text is null
     */
    public boolean accepts(@Nonnull CharSequence text) {
        return accepts(Iterables.charsIteratorAsChar(text));
    }

    /**
     * Test whether the text is one of the inserted words, ignoring the skip symbols.
     *
     * @throws NullPointerException if text or any symbol in it is null
     */
    public boolean accepts(@Nonnull Iterable<Character> text) {
        int current = ROOT;
        int index = 0;
        for (Character symbol : text) {
            char ch = symbol;
            if (!skipSymbols.contains(ch)) {
                current = states.get(current).next(ch);
                if (current == SINK) {
                    int sinkIndex = index;
                    LOGGER.log(TRACE, () -> "No transition, rejecting: index=" + sinkIndex + ", symbol=" + ch);
                    break;
                }
            }
            index++;
        }
        return current != SINK && states.get(current).isAccepting();
    }

    /**
     * Find the longest inserted word that starts at the given index of text.
     * Skip symbols inside the text are ignored as in accepts, and the scan stops at the first symbol without a transition.
     *
     * @param text the text to scan
     * @param start the index at which the word must start
     * @return the index one past the last char of the longest match, or -1 if no word starts at start.
     *         If the empty word was inserted, start itself is a match of length zero.
     * @throws IndexOutOfBoundsException if start is negative or greater than the length of text
     */
    public int findLongest(@Nonnull CharSequence text, int start) {
        Objects.checkFromToIndex(start, text.length(), text.length());
        int current = ROOT;
        int longestEnd = states.get(ROOT).isAccepting() ? start : -1;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (skipSymbols.contains(ch)) {
                continue;
            }
            current = states.get(current).next(ch);
            if (current == SINK) {
                break;
            }
            if (states.get(current).isAccepting()) {
                longestEnd = i + 1;
            }
        }
        return longestEnd;
    }

    /**
     * Find all inserted words in the text, scanning left to right.
     * At each position the longest word is taken and scanning resumes after it, so matches do not overlap.
     * A match never starts with a skip symbol, and zero length matches are not reported.
     */
    public List<Match> findAll(@Nonnull CharSequence text) {
        List<Match> matches = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            if (skipSymbols.contains(text.charAt(start))) {
                start++;
                continue;
            }
            int end = findLongest(text, start);
            if (end > start) {
                matches.add(new Match(start, end, text.subSequence(start, end).toString()));
                start = end;
            } else {
                start++;
            }
        }
        return matches;
    }

    /**
     * Render this automaton as a GraphViz DOT document.
     * States are named Q0, Q1, etc. in breadth first order, and accepting states are drawn as double circles.
     * The sink state is not part of the output.
     */
    public String toDot() {
        return new DotExporter(dotStyle).export(this);
    }

    /**
     * Return the number of states, including the root but not the sink.
     */
    public int stateCount() {
        return states.size();
    }

    /**
     * Return the number of distinct words inserted.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Return all the inserted words in depth first order, visiting the children of each state in insertion order.
     * A word comes before the words it is a prefix of.
     */
    public List<String> words() {
        List<String> words = new ArrayList<>(size);
        TrieDfaState root = states.get(ROOT);
        if (root.isAccepting()) {
            words.add("");
        }
        Deque<WordPosition> stack = new ArrayDeque<>();
        stack.push(new WordPosition("", root.transitions().entrySet().iterator()));
        while (!stack.isEmpty()) {
            WordPosition top = stack.peek();
            if (top.children().hasNext()) {
                Map.Entry<Character, Integer> child = top.children().next();
                String pathToHere = top.pathToHere() + child.getKey();
                TrieDfaState state = states.get(child.getValue());
                if (state.isAccepting()) {
                    words.add(pathToHere);
                }
                stack.push(new WordPosition(pathToHere, state.transitions().entrySet().iterator()));
            } else {
                stack.pop();
            }
        }
        return words;
    }

    public PunctuationSet getSkipSymbols() {
        return skipSymbols;
    }

    public DotStyle getDotStyle() {
        return dotStyle;
    }

    TrieDfaState state(int index) {
        return states.get(index);
    }

    /**
     * A path from the root and the iteration position over the children of the state at the end of the path.
     */
    private record WordPosition(String pathToHere, Iterator<Map.Entry<Character, Integer>> children) {
    }


    /**
     * A word found by findAll.
     *
     * @param start the index of the first char of the match
     * @param end one past the index of the last char of the match
     * @param text the matched chars exactly as they appear in the text, including any skip symbols
     */
    public record Match(int start, int end, String text) {
    }


    /**
     * Builder for TrieDfa.
     * Words added to the builder are inserted in the order they were added.
     */
    public static class Builder {
        private PunctuationSet skipSymbols = PunctuationSet.ascii();
        private DotStyle dotStyle = DotStyle.defaults();
        private final List<CharSequence> words = new ArrayList<>();

        private Builder() {
        }

        /**
         * Set the symbols ignored during matching. Default is PunctuationSet.ascii().
         */
        public Builder setSkipSymbols(@Nonnull PunctuationSet skipSymbols) {
            this.skipSymbols = Objects.requireNonNull(skipSymbols);
            return this;
        }

        public Builder setDotStyle(@Nonnull DotStyle dotStyle) {
            this.dotStyle = Objects.requireNonNull(dotStyle);
            return this;
        }

        public Builder addWord(@Nonnull CharSequence word) {
            words.add(Objects.requireNonNull(word));
            return this;
        }

        public Builder addWords(@Nonnull Iterable<? extends CharSequence> words) {
            for (CharSequence word : words) {
                addWord(word);
            }
            return this;
        }

        public TrieDfa build() {
            TrieDfa dfa = new TrieDfa(skipSymbols, dotStyle);
            dfa.insertAll(words);
            return dfa;
        }
    }
}
