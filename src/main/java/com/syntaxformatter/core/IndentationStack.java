package com.syntaxformatter.core;

import com.syntaxformatter.syntax.Trivia;

import java.util.ArrayList;
import java.util.List;

/**
 * Indentation levels of the scopes a formatting run is currently inside.
 * The bottom entry is the caller's initial indentation and is never popped.
 */
final class IndentationStack {
    private final List<Level> levels = new ArrayList<>();

    IndentationStack(Trivia initialIndentation) {
        levels.add(new Level(initialIndentation, false));
    }

    Trivia current() {
        return levels.get(levels.size() - 1).indentation;
    }

    boolean isCurrentUserDefined() {
        return levels.get(levels.size() - 1).userDefined;
    }

    int depth() {
        return levels.size() - 1;
    }

    /**
     * Opens a scope one increment deeper than the current one.
     */
    void pushIncrement(Trivia increment) {
        levels.add(new Level(current().append(increment), false));
    }

    /**
     * Opens a scope at indentation the user wrote. It is taken relative to
     * the innermost computed level, so user indentation never stacks on top
     * of other user indentation.
     */
    void pushUserDefined(Trivia userIndentation) {
        levels.add(new Level(lastComputed().append(userIndentation), true));
    }

    void pop() {
        if (levels.size() == 1) {
            throw new IllegalStateException("Indentation stack underflow: scope exit without matching entry");
        }
        levels.remove(levels.size() - 1);
    }

    private Trivia lastComputed() {
        for (int i = levels.size() - 1; i >= 0; i--) {
            if (!levels.get(i).userDefined) {
                return levels.get(i).indentation;
            }
        }
        // The base level is never user defined
        throw new IllegalStateException("Indentation stack lost its base level");
    }

    private static final class Level {
        private final Trivia indentation;
        private final boolean userDefined;

        private Level(Trivia indentation, boolean userDefined) {
            this.indentation = indentation;
            this.userDefined = userDefined;
        }
    }
}
