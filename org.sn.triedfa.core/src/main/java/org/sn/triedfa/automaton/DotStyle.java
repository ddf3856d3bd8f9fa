package org.sn.triedfa.automaton;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;


/**
 * Cosmetic settings used when rendering a TrieDfa as a GraphViz DOT document.
 * None of these settings change the structure of the graph.
 *
 * <p>The defaults are a dark background with blue states and green accepting states.
 */
public final class DotStyle {
    private static final Pattern DOT_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> RANK_DIRECTIONS = Set.of("LR", "RL", "TB", "BT");
    private static final DotStyle DEFAULT = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    public static DotStyle defaults() {
        return DEFAULT;
    }

    private final String graphName;
    private final String rankDirection;
    private final String backgroundColor;
    private final String nodeFillColor;
    private final String nodeBorderColor;
    private final String nodeFontColor;
    private final String fontName;
    private final String edgeColor;
    private final String edgeFontColor;
    private final String acceptingFillColor;
    private final String acceptingBorderColor;
    private final String acceptingFontColor;

    private DotStyle(Builder builder) {
        this.graphName = builder.graphName;
        this.rankDirection = builder.rankDirection;
        this.backgroundColor = builder.backgroundColor;
        this.nodeFillColor = builder.nodeFillColor;
        this.nodeBorderColor = builder.nodeBorderColor;
        this.nodeFontColor = builder.nodeFontColor;
        this.fontName = builder.fontName;
        this.edgeColor = builder.edgeColor;
        this.edgeFontColor = builder.edgeFontColor;
        this.acceptingFillColor = builder.acceptingFillColor;
        this.acceptingBorderColor = builder.acceptingBorderColor;
        this.acceptingFontColor = builder.acceptingFontColor;
    }

    public String getGraphName() {
        return graphName;
    }

    public String getRankDirection() {
        return rankDirection;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public String getNodeFillColor() {
        return nodeFillColor;
    }

    public String getNodeBorderColor() {
        return nodeBorderColor;
    }

    public String getNodeFontColor() {
        return nodeFontColor;
    }

    public String getFontName() {
        return fontName;
    }

    public String getEdgeColor() {
        return edgeColor;
    }

    public String getEdgeFontColor() {
        return edgeFontColor;
    }

    public String getAcceptingFillColor() {
        return acceptingFillColor;
    }

    public String getAcceptingBorderColor() {
        return acceptingBorderColor;
    }

    public String getAcceptingFontColor() {
        return acceptingFontColor;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }


    /**
     * Builder for DotStyle.
     * Colors may be any value GraphViz understands, such as "white" or "#131a2e".
     * They are written inside double quotes, so they must not contain a double quote.
     */
    public static class Builder {
        private String graphName = "DFA";
        private String rankDirection = "LR";
        private String backgroundColor = "#131a2e";
        private String nodeFillColor = "#103c69";
        private String nodeBorderColor = "#2B65EC";
        private String nodeFontColor = "white";
        private String fontName = "Courier";
        private String edgeColor = "#00f7ff";
        private String edgeFontColor = "#00f7ff";
        private String acceptingFillColor = "#66CC66";
        private String acceptingBorderColor = "#339933";
        private String acceptingFontColor = "white";

        private Builder() {
        }

        private Builder(DotStyle style) {
            this.graphName = style.graphName;
            this.rankDirection = style.rankDirection;
            this.backgroundColor = style.backgroundColor;
            this.nodeFillColor = style.nodeFillColor;
            this.nodeBorderColor = style.nodeBorderColor;
            this.nodeFontColor = style.nodeFontColor;
            this.fontName = style.fontName;
            this.edgeColor = style.edgeColor;
            this.edgeFontColor = style.edgeFontColor;
            this.acceptingFillColor = style.acceptingFillColor;
            this.acceptingBorderColor = style.acceptingBorderColor;
            this.acceptingFontColor = style.acceptingFontColor;
        }

        /**
         * Set the name written after "digraph". Default is DFA.
         *
         * @throws IllegalArgumentException if graphName is not a DOT identifier
         */
        public Builder setGraphName(@Nonnull String graphName) {
            Objects.requireNonNull(graphName, "graphName");
            if (!DOT_IDENTIFIER.matcher(graphName).matches()) {
                throw new IllegalArgumentException("graphName is not a DOT identifier: graphName=" + graphName);
            }
            this.graphName = graphName;
            return this;
        }

        /**
         * Set the layout direction. Default is LR (left to right).
         *
         * @throws IllegalArgumentException if rankDirection is not one of LR, RL, TB, BT
         */
        public Builder setRankDirection(@Nonnull String rankDirection) {
            Objects.requireNonNull(rankDirection, "rankDirection");
            if (!RANK_DIRECTIONS.contains(rankDirection)) {
                throw new IllegalArgumentException("Unknown rank direction: rankDirection=" + rankDirection);
            }
            this.rankDirection = rankDirection;
            return this;
        }

        public Builder setBackgroundColor(@Nonnull String backgroundColor) {
            this.backgroundColor = checkQuotable("backgroundColor", backgroundColor);
            return this;
        }

        public Builder setNodeFillColor(@Nonnull String nodeFillColor) {
            this.nodeFillColor = checkQuotable("nodeFillColor", nodeFillColor);
            return this;
        }

        public Builder setNodeBorderColor(@Nonnull String nodeBorderColor) {
            this.nodeBorderColor = checkQuotable("nodeBorderColor", nodeBorderColor);
            return this;
        }

        public Builder setNodeFontColor(@Nonnull String nodeFontColor) {
            this.nodeFontColor = checkQuotable("nodeFontColor", nodeFontColor);
            return this;
        }

        public Builder setFontName(@Nonnull String fontName) {
            this.fontName = checkQuotable("fontName", fontName);
            return this;
        }

        public Builder setEdgeColor(@Nonnull String edgeColor) {
            this.edgeColor = checkQuotable("edgeColor", edgeColor);
            return this;
        }

        public Builder setEdgeFontColor(@Nonnull String edgeFontColor) {
            this.edgeFontColor = checkQuotable("edgeFontColor", edgeFontColor);
            return this;
        }

        public Builder setAcceptingFillColor(@Nonnull String acceptingFillColor) {
            this.acceptingFillColor = checkQuotable("acceptingFillColor", acceptingFillColor);
            return this;
        }

        public Builder setAcceptingBorderColor(@Nonnull String acceptingBorderColor) {
            this.acceptingBorderColor = checkQuotable("acceptingBorderColor", acceptingBorderColor);
            return this;
        }

        public Builder setAcceptingFontColor(@Nonnull String acceptingFontColor) {
            this.acceptingFontColor = checkQuotable("acceptingFontColor", acceptingFontColor);
            return this;
        }

        public DotStyle build() {
            return new DotStyle(this);
        }

        private static String checkQuotable(String name, String value) {
            Objects.requireNonNull(value, name);
            if (value.isEmpty() || value.indexOf('"') >= 0 || value.indexOf('\\') >= 0) {
                throw new IllegalArgumentException(name + " must be non-empty and contain no quote or backslash: " + name + "=" + value);
            }
            return value;
        }
    }
}
