package org.sn.triedfa.automaton;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;


/**
 * The set of symbols that matching ignores.
 * A symbol in this set causes no state transition, so "c,a.t" matches the word "cat".
 *
 * <p>Instances are immutable.
 */
public final class PunctuationSet {
    private static final String ASCII_PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";
    private static final PunctuationSet ASCII = of(ASCII_PUNCTUATION);
    private static final PunctuationSet NONE = new PunctuationSet(Set.of());

    private final Set<Character> symbols;

    private PunctuationSet(Set<Character> symbols) {
        this.symbols = symbols;
    }

    /**
     * The 32 ASCII punctuation characters. This is the default skip set.
     */
    public static PunctuationSet ascii() {
        return ASCII;
    }

    /**
     * An empty skip set, so every symbol takes part in matching.
     */
    public static PunctuationSet none() {
        return NONE;
    }

    /**
     * Create a skip set from each char in the given string.
     * Duplicates are allowed and ignored.
     *
     * @throws NullPointerException if chars is null
     */
    public static PunctuationSet of(@Nonnull CharSequence chars) {
        Set<Character> symbols = new HashSet<>(chars.length());
        chars.chars().forEach(ch -> symbols.add((char) ch));
        return new PunctuationSet(Set.copyOf(symbols));
    }

    public boolean contains(char symbol) {
        return symbols.contains(symbol);
    }

    public PunctuationSet union(@Nonnull PunctuationSet other) {
        Set<Character> combined = new HashSet<>(symbols);
        combined.addAll(other.symbols);
        return new PunctuationSet(Set.copyOf(combined));
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PunctuationSet other)) {
            return false;
        }
        return symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols);
    }

    /**
     * Return the symbols in sorted order, for example <code>PunctuationSet[!,.?]</code>.
     */
    @Override
    public String toString() {
        return new TreeSet<>(symbols).stream()
                                     .map(String::valueOf)
                                     .collect(Collectors.joining("", "PunctuationSet[", "]"));
    }
}
