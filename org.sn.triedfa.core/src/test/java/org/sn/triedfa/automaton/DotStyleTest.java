package org.sn.triedfa.automaton;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.sn.triedfa.testutils.TestUtil.assertException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.triedfa.testutils.TestBase;


public class DotStyleTest extends TestBase {
    @Test
    void testDefaults() {
        DotStyle style = DotStyle.defaults();
        assertSame(style, DotStyle.defaults());
        assertEquals("DFA", style.getGraphName());
        assertEquals("LR", style.getRankDirection());
        assertEquals("#131a2e", style.getBackgroundColor());
        assertEquals("#103c69", style.getNodeFillColor());
        assertEquals("#2B65EC", style.getNodeBorderColor());
        assertEquals("white", style.getNodeFontColor());
        assertEquals("Courier", style.getFontName());
        assertEquals("#00f7ff", style.getEdgeColor());
        assertEquals("#00f7ff", style.getEdgeFontColor());
        assertEquals("#66CC66", style.getAcceptingFillColor());
        assertEquals("#339933", style.getAcceptingBorderColor());
        assertEquals("white", style.getAcceptingFontColor());
    }

    @Test
    void testToBuilder() {
        DotStyle style = DotStyle.defaults().toBuilder().setGraphName("Trie").setAcceptingFillColor("red").build();
        assertEquals("Trie", style.getGraphName());
        assertEquals("red", style.getAcceptingFillColor());
        assertEquals("#339933", style.getAcceptingBorderColor());
        assertEquals("DFA", DotStyle.defaults().getGraphName());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "1abc", "my graph", "a-b", "\"DFA\"" })
    void testInvalidGraphName(String graphName) {
        assertException(() -> DotStyle.builder().setGraphName(graphName),
                        IllegalArgumentException.class,
                        "graphName is not a DOT identifier: graphName=" + graphName);
    }

    @ParameterizedTest
    @ValueSource(strings = { "LR", "RL", "TB", "BT" })
    void testRankDirection(String rankDirection) {
        assertEquals(rankDirection, DotStyle.builder().setRankDirection(rankDirection).build().getRankDirection());
    }

    @Test
    void testInvalidValues() {
        assertException(() -> DotStyle.builder().setRankDirection("lr"), IllegalArgumentException.class,
                        "Unknown rank direction: rankDirection=lr");
        assertException(() -> DotStyle.builder().setNodeFillColor("a\"b"), IllegalArgumentException.class);
        assertException(() -> DotStyle.builder().setEdgeColor(""), IllegalArgumentException.class);
        assertException(() -> DotStyle.builder().setFontName("C:\\fonts"), IllegalArgumentException.class);
        assertException(() -> DotStyle.builder().setBackgroundColor(null), NullPointerException.class,
                        "backgroundColor");
        assertException(() -> DotStyle.builder().setGraphName(null), NullPointerException.class, "graphName");
        assertException(() -> DotStyle.builder().setRankDirection(null), NullPointerException.class, "rankDirection");
    }
}
