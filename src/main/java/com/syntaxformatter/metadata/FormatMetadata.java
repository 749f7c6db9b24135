package com.syntaxformatter.metadata;

import com.syntaxformatter.syntax.Slot;
import com.syntaxformatter.syntax.SyntaxKind;
import com.syntaxformatter.syntax.TokenKind;

import java.util.*;

/**
 * Immutable table of structural formatting facts for a grammar. Lookups for
 * slots, kinds or token pairs the table does not mention answer "no special
 * requirement", so grammar additions without metadata still format.
 */
public final class FormatMetadata {
    private final Map<Slot, SlotMetadata> slots;
    private final Set<SyntaxKind> newlineSeparatedKinds;
    private final List<WhitespaceRule> whitespaceRules;
    private final boolean defaultWhitespace;

    private FormatMetadata(Builder builder) {
        this.slots = Collections.unmodifiableMap(new HashMap<>(builder.slots));
        this.newlineSeparatedKinds = builder.newlineSeparatedKinds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.newlineSeparatedKinds));
        this.whitespaceRules = List.copyOf(builder.whitespaceRules);
        this.defaultWhitespace = builder.defaultWhitespace;
    }

    /**
     * The table bundled for the shipped grammar.
     */
    public static FormatMetadata defaults() {
        return MetadataLoader.loadDefaultMetadata();
    }

    public static Builder builder() {
        return new Builder();
    }

    public SlotMetadata slot(Slot slot) {
        if (slot == null) {
            return SlotMetadata.NONE;
        }
        return slots.getOrDefault(slot, SlotMetadata.NONE);
    }

    public Map<Slot, SlotMetadata> getSlots() {
        return slots;
    }

    public boolean childrenSeparatedByNewline(SyntaxKind kind) {
        return newlineSeparatedKinds.contains(kind);
    }

    public Set<SyntaxKind> getNewlineSeparatedKinds() {
        return newlineSeparatedKinds;
    }

    public List<WhitespaceRule> getWhitespaceRules() {
        return whitespaceRules;
    }

    public boolean getDefaultWhitespace() {
        return defaultWhitespace;
    }

    /**
     * Whether a blank belongs between two adjacent tokens. The first matching
     * rule decides; without a match the table default applies.
     *
     * @param first  kind of the earlier token, null at the start of the stream
     * @param second kind of the later token, null at the end of the stream
     */
    public boolean requiresWhitespace(TokenKind first, TokenKind second) {
        for (WhitespaceRule rule : whitespaceRules) {
            if (rule.matches(first, second)) {
                return rule.requiresWhitespace();
            }
        }
        return defaultWhitespace;
    }

    /**
     * A builder holding a copy of this table, for deriving a variant.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.slots.putAll(slots);
        builder.newlineSeparatedKinds.addAll(newlineSeparatedKinds);
        builder.whitespaceRules.addAll(whitespaceRules);
        builder.defaultWhitespace = defaultWhitespace;
        return builder;
    }

    public static class Builder {
        private final Map<Slot, SlotMetadata> slots = new HashMap<>();
        private final Set<SyntaxKind> newlineSeparatedKinds = EnumSet.noneOf(SyntaxKind.class);
        private final List<WhitespaceRule> whitespaceRules = new ArrayList<>();
        private boolean defaultWhitespace = true;

        private Builder() {
        }

        public Builder requiresIndent(Slot slot, boolean value) {
            slots.put(slot, _current(slot).withRequiresIndent(value));
            return this;
        }

        public Builder requiresLeadingNewline(Slot slot, boolean value) {
            slots.put(slot, _current(slot).withRequiresLeadingNewline(value));
            return this;
        }

        public Builder leadingSpace(Slot slot, TriState value) {
            slots.put(slot, _current(slot).withLeadingSpace(value));
            return this;
        }

        public Builder trailingSpace(Slot slot, TriState value) {
            slots.put(slot, _current(slot).withTrailingSpace(value));
            return this;
        }

        public Builder childrenSeparatedByNewline(SyntaxKind kind, boolean value) {
            if (value) {
                newlineSeparatedKinds.add(kind);
            } else {
                newlineSeparatedKinds.remove(kind);
            }
            return this;
        }

        /**
         * Appends a rule; it only applies where no earlier rule matched.
         */
        public Builder addWhitespaceRule(WhitespaceRule rule) {
            whitespaceRules.add(rule);
            return this;
        }

        /**
         * Inserts a rule ahead of all others, overriding them for its pair.
         */
        public Builder overrideWhitespace(WhitespaceRule rule) {
            whitespaceRules.add(0, rule);
            return this;
        }

        public Builder defaultWhitespace(boolean value) {
            this.defaultWhitespace = value;
            return this;
        }

        public FormatMetadata build() {
            return new FormatMetadata(this);
        }

        private SlotMetadata _current(Slot slot) {
            return slots.getOrDefault(slot, SlotMetadata.NONE);
        }
    }
}
