package com.syntaxformatter.syntax;

import java.util.Objects;

/**
 * Identity of a position in the grammar: field {@code name} of a node of
 * kind {@code parentKind}. Elements of collection nodes share the
 * {@link #ELEMENT} field.
 */
public final class Slot {
    public static final String ELEMENT = "element";

    private final SyntaxKind parentKind;
    private final String name;

    private Slot(SyntaxKind parentKind, String name) {
        this.parentKind = Objects.requireNonNull(parentKind, "parentKind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static Slot of(SyntaxKind parentKind, String name) {
        return new Slot(parentKind, name);
    }

    /**
     * Parses the {@code KIND.field} notation used by metadata files.
     *
     * @throws IllegalArgumentException if the text is malformed or names an unknown kind
     */
    public static Slot parse(String text) {
        int dot = text == null ? -1 : text.indexOf('.');
        if (dot <= 0 || dot == text.length() - 1) {
            throw new IllegalArgumentException("Expected KIND.field but got: " + text);
        }
        SyntaxKind kind = SyntaxKind.valueOf(text.substring(0, dot).trim());
        return new Slot(kind, text.substring(dot + 1).trim());
    }

    public SyntaxKind getParentKind() {
        return parentKind;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Slot)) {
            return false;
        }
        Slot other = (Slot) o;
        return parentKind == other.parentKind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentKind, name);
    }

    @Override
    public String toString() {
        return parentKind.name() + "." + name;
    }
}
