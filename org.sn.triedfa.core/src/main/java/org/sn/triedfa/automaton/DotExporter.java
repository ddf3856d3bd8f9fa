package org.sn.triedfa.automaton;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;


/**
 * Writes a TrieDfa as a GraphViz DOT document.
 *
 * <p>The states are traversed breadth first starting at the root, and each state is named when it is first seen
 * as the target of an edge, so the root is Q0, its children are Q1, Q2, etc. in insertion order, and so on.
 * Given the same sequence of inserts, the output is always the same.
 */
class DotExporter {
    private static final System.Logger LOGGER = System.getLogger(DotExporter.class.getName());
    private static final String START = "__start__";

    private final DotStyle style;

    DotExporter(DotStyle style) {
        this.style = style;
    }

    String export(TrieDfa dfa) {
        List<String> lines = new ArrayList<>();
        lines.add("digraph " + style.getGraphName() + " {");
        lines.add("  rankdir=" + style.getRankDirection() + ";");
        lines.add("  graph [bgcolor=" + quote(style.getBackgroundColor()) + "];");
        lines.add("  node [shape=circle, style=filled, fillcolor=" + quote(style.getNodeFillColor())
                          + ", color=" + quote(style.getNodeBorderColor())
                          + ", fontcolor=" + quote(style.getNodeFontColor())
                          + ", fontname=" + quote(style.getFontName()) + "];");
        lines.add("  edge [fontcolor=" + quote(style.getEdgeFontColor())
                          + ", color=" + quote(style.getEdgeColor())
                          + ", fontname=" + quote(style.getFontName()) + "];");
        lines.add("  " + START + " [shape=none,label=\"\"];");

        // stateIds[i] is the number n in the name Qn of the state at index i, or -1 if not seen yet
        int[] stateIds = new int[dfa.stateCount()];
        Arrays.fill(stateIds, -1);
        int nextId = 0;
        stateIds[TrieDfa.ROOT] = nextId++;
        lines.add("  " + START + " -> " + name(stateIds[TrieDfa.ROOT]) + ";");

        int edges = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(TrieDfa.ROOT);
        while (!queue.isEmpty()) {
            int index = queue.remove();
            TrieDfaState state = dfa.state(index);
            String from = name(stateIds[index]);
            if (state.isAccepting()) {
                lines.add("  " + from + " [shape=doublecircle, style=filled, fillcolor=" + quote(style.getAcceptingFillColor())
                                  + ", color=" + quote(style.getAcceptingBorderColor())
                                  + ", fontcolor=" + quote(style.getAcceptingFontColor()) + "];");
            }
            for (Map.Entry<Character, Integer> transition : state.transitions().entrySet()) {
                int child = transition.getValue();
                if (stateIds[child] < 0) {
                    stateIds[child] = nextId++;
                    queue.add(child);
                }
                lines.add("  " + from + " -> " + name(stateIds[child]) + " [label=" + quote(escapeLabel(transition.getKey())) + "];");
                edges++;
            }
        }
        lines.add("}");

        int stateCount = nextId;
        int edgeCount = edges;
        LOGGER.log(DEBUG, () -> "Exported automaton: states=" + stateCount + ", edges=" + edgeCount);
        return String.join("\n", lines);
    }

    private static String name(int id) {
        return "Q" + id;
    }

    private static String quote(String value) {
        return '"' + value + '"';
    }

    /**
     * Escape a symbol so that it can be written between double quotes.
     * Backslash becomes two backslashes and a double quote becomes backslash double quote.
     */
    static String escapeLabel(char symbol) {
        return switch (symbol) {
            case '\\' -> "\\\\";
            case '"' -> "\\\"";
            default -> String.valueOf(symbol);
        };
    }
}
