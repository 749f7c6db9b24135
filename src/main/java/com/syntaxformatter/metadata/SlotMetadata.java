package com.syntaxformatter.metadata;

import java.util.Objects;

/**
 * Static formatting facts about one grammar slot.
 */
public final class SlotMetadata {
    public static final SlotMetadata NONE = new SlotMetadata(false, false, TriState.UNSET, TriState.UNSET);

    private final boolean requiresIndent;
    private final boolean requiresLeadingNewline;
    private final TriState leadingSpace;
    private final TriState trailingSpace;

    public SlotMetadata(boolean requiresIndent, boolean requiresLeadingNewline,
                        TriState leadingSpace, TriState trailingSpace) {
        this.requiresIndent = requiresIndent;
        this.requiresLeadingNewline = requiresLeadingNewline;
        this.leadingSpace = Objects.requireNonNull(leadingSpace, "leadingSpace");
        this.trailingSpace = Objects.requireNonNull(trailingSpace, "trailingSpace");
    }

    /**
     * Whether a node in this slot opens a new indentation scope.
     */
    public boolean requiresIndent() {
        return requiresIndent;
    }

    /**
     * Whether a token in this slot must start on a new line.
     */
    public boolean requiresLeadingNewline() {
        return requiresLeadingNewline;
    }

    public TriState getLeadingSpace() {
        return leadingSpace;
    }

    public TriState getTrailingSpace() {
        return trailingSpace;
    }

    public SlotMetadata withRequiresIndent(boolean value) {
        return new SlotMetadata(value, requiresLeadingNewline, leadingSpace, trailingSpace);
    }

    public SlotMetadata withRequiresLeadingNewline(boolean value) {
        return new SlotMetadata(requiresIndent, value, leadingSpace, trailingSpace);
    }

    public SlotMetadata withLeadingSpace(TriState value) {
        return new SlotMetadata(requiresIndent, requiresLeadingNewline, value, trailingSpace);
    }

    public SlotMetadata withTrailingSpace(TriState value) {
        return new SlotMetadata(requiresIndent, requiresLeadingNewline, leadingSpace, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SlotMetadata)) {
            return false;
        }
        SlotMetadata other = (SlotMetadata) o;
        return requiresIndent == other.requiresIndent
                && requiresLeadingNewline == other.requiresLeadingNewline
                && leadingSpace == other.leadingSpace
                && trailingSpace == other.trailingSpace;
    }

    @Override
    public int hashCode() {
        return Objects.hash(requiresIndent, requiresLeadingNewline, leadingSpace, trailingSpace);
    }

    @Override
    public String toString() {
        return "SlotMetadata{indent=" + requiresIndent + ", leadingNewline=" + requiresLeadingNewline
                + ", leadingSpace=" + leadingSpace + ", trailingSpace=" + trailingSpace + "}";
    }
}
