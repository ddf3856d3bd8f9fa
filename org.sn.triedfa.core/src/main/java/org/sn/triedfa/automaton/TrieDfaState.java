package org.sn.triedfa.automaton;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;


/**
 * One state of a TrieDfa.
 * Children are referenced by their index in the automaton's list of states.
 * The map preserves insertion order, which fixes the order of the exported graph.
 */
final class TrieDfaState {
    private final Map<Character, Integer> transitions = new LinkedHashMap<>();
    private boolean accepting;

    /**
     * Return the index of the child reached by symbol, or TrieDfa.SINK if there is no such transition.
     */
    int next(char symbol) {
        Integer child = transitions.get(symbol);
        return child != null ? child : TrieDfa.SINK;
    }

    void addTransition(char symbol, int child) {
        transitions.put(symbol, child);
    }

    Map<Character, Integer> transitions() {
        return Collections.unmodifiableMap(transitions);
    }

    boolean isAccepting() {
        return accepting;
    }

    /**
     * Mark this state accepting.
     * There is no way to make a state non-accepting again.
     *
     * @return true if the state was not accepting before
     */
    boolean markAccepting() {
        boolean changed = !accepting;
        accepting = true;
        return changed;
    }
}
