package com.syntaxformatter.core;

import com.syntaxformatter.api.FormatRules;
import com.syntaxformatter.api.TreeFormatter;
import com.syntaxformatter.config.FormatterConfig;
import com.syntaxformatter.metadata.FormatMetadata;
import com.syntaxformatter.metadata.MetadataLoader;
import com.syntaxformatter.syntax.Node;
import com.syntaxformatter.syntax.Trivia;
import com.syntaxformatter.syntax.ViewMode;
import com.syntaxformatter.util.LoggerUtil;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Rewrites the trivia of a tree so that it reads as consistently formatted
 * source: newlines where the grammar wants them, single blanks between
 * tokens that need separating, and indentation following the nesting of
 * indenting scopes. Indentation the user already wrote is kept and used as
 * the reference for the lines below it.
 *
 * <p>Instances are immutable and every call to {@link #format(Node)} runs on
 * its own state, so one formatter can be shared between threads.</p>
 */
public class BasicFormatter implements TreeFormatter {
    private static final Logger logger = LoggerUtil.getLogger(BasicFormatter.class);

    private final Trivia indentationIncrement;
    private final Trivia initialIndentation;
    private final ViewMode viewMode;
    private final FormatRules rules;

    private final AtomicInteger formattedTreeCount = new AtomicInteger(0);

    public BasicFormatter() {
        this(builder());
    }

    private BasicFormatter(Builder builder) {
        this.indentationIncrement = builder.indentationIncrement;
        this.initialIndentation = builder.initialIndentation;
        this.viewMode = builder.viewMode;
        this.rules = builder.rules != null ? builder.rules : new DefaultFormatRules();
    }

    /**
     * Creates a formatter from the {@code general} configuration values.
     */
    public BasicFormatter(FormatterConfig config) {
        this(fromConfig(config));
    }

    /**
     * Formats {@code tree} with the default settings.
     */
    public static Node formatted(Node tree) {
        return new BasicFormatter().format(tree);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Node format(Node tree) {
        Objects.requireNonNull(tree, "tree");
        FormatRun run = new FormatRun(indentationIncrement, initialIndentation, viewMode, rules);
        Node result = run.rewrite(tree);

        int count = formattedTreeCount.incrementAndGet();
        logger.fine("Formatted " + tree.getKind() + " tree #" + count + ": "
                + run.getVisitedTokenCount() + " tokens visited, "
                + run.getAnchorCount() + " anchor points, indentation depth "
                + run.getMaxIndentationDepth() + " (" + run.getUserIndentedScopeCount() + " user-indented)");
        return result;
    }

    public Trivia getIndentationIncrement() {
        return indentationIncrement;
    }

    public Trivia getInitialIndentation() {
        return initialIndentation;
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public FormatRules getRules() {
        return rules;
    }

    public int getFormattedTreeCount() {
        return formattedTreeCount.get();
    }

    private static Builder fromConfig(FormatterConfig config) {
        Objects.requireNonNull(config, "config");
        Builder builder = builder();
        if (config.isUseTabs()) {
            // One tab per level; indentSize only applies to spaces
            builder.indentationIncrement(Trivia.tabs(1));
            builder.initialIndentation(Trivia.tabs(config.getInitialIndentSize()));
        } else {
            builder.indentationIncrement(Trivia.spaces(config.getIndentSize()));
            builder.initialIndentation(Trivia.spaces(config.getInitialIndentSize()));
        }
        builder.viewMode(config.getViewMode());

        Path metadataFile = config.getMetadataFile();
        FormatMetadata metadata = metadataFile != null
                ? MetadataLoader.loadMetadata(metadataFile)
                : FormatMetadata.defaults();
        builder.rules(new DefaultFormatRules(metadata));
        return builder;
    }

    public static class Builder {
        private Trivia indentationIncrement = Trivia.spaces(4);
        private Trivia initialIndentation = Trivia.EMPTY;
        private ViewMode viewMode = ViewMode.SOURCE_ACCURATE;
        private FormatRules rules;

        private Builder() {
        }

        /**
         * The whitespace one indenting scope adds.
         */
        public Builder indentationIncrement(Trivia indentationIncrement) {
            this.indentationIncrement = Objects.requireNonNull(indentationIncrement, "indentationIncrement");
            return this;
        }

        /**
         * The indentation lines at the top level of the tree start at. The
         * tree's first token is left as it is.
         */
        public Builder initialIndentation(Trivia initialIndentation) {
            this.initialIndentation = Objects.requireNonNull(initialIndentation, "initialIndentation");
            return this;
        }

        public Builder viewMode(ViewMode viewMode) {
            this.viewMode = Objects.requireNonNull(viewMode, "viewMode");
            return this;
        }

        public Builder rules(FormatRules rules) {
            this.rules = Objects.requireNonNull(rules, "rules");
            return this;
        }

        public BasicFormatter build() {
            return new BasicFormatter(this);
        }
    }
}
