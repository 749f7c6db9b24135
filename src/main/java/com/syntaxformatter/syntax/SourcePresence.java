package com.syntaxformatter.syntax;

public enum SourcePresence {
    PRESENT,  // Written in the source
    MISSING   // Placeholder synthesized by the parser for recovery
}
