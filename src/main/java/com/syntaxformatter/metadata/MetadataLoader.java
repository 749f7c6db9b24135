package com.syntaxformatter.metadata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.syntaxformatter.syntax.Slot;
import com.syntaxformatter.syntax.SyntaxKind;
import com.syntaxformatter.util.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads structural formatting metadata from YAML. Entries naming kinds or
 * slots the grammar does not know are skipped with a warning instead of
 * failing the load.
 */
public class MetadataLoader {
    private static final Logger logger = LoggerUtil.getLogger(MetadataLoader.class);
    private static final String DEFAULT_METADATA_RESOURCE = "/grammar/format-metadata.yml";

    private static volatile FormatMetadata _cachedDefaultMetadata = null;

    /**
     * Loads the metadata bundled for the shipped grammar. The table is read
     * once and cached.
     *
     * @throws IllegalStateException if the bundled resource is missing or unreadable
     */
    public static FormatMetadata loadDefaultMetadata() {
        FormatMetadata cached = _cachedDefaultMetadata;
        if (cached != null) {
            return cached;
        }
        synchronized (MetadataLoader.class) {
            if (_cachedDefaultMetadata != null) {
                return _cachedDefaultMetadata;
            }
            try (InputStream stream = MetadataLoader.class.getResourceAsStream(DEFAULT_METADATA_RESOURCE)) {
                if (stream == null) {
                    logger.severe("Default metadata resource not found: " + DEFAULT_METADATA_RESOURCE);
                    throw new IllegalStateException("Missing bundled metadata: " + DEFAULT_METADATA_RESOURCE);
                }
                _cachedDefaultMetadata = loadMetadata(stream);
                logger.fine("Default format metadata loaded with "
                        + _cachedDefaultMetadata.getSlots().size() + " slot entries");
                return _cachedDefaultMetadata;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to load default metadata", e);
                throw new IllegalStateException("Unreadable bundled metadata: " + DEFAULT_METADATA_RESOURCE, e);
            }
        }
    }

    /**
     * Loads a metadata table from a file, falling back to the bundled table
     * when the file is missing or malformed.
     */
    public static FormatMetadata loadMetadata(Path metadataPath) {
        if (metadataPath == null || !Files.exists(metadataPath)) {
            logger.warning("Metadata file not found: " + metadataPath + ", using default metadata");
            return loadDefaultMetadata();
        }

        try (InputStream stream = Files.newInputStream(metadataPath)) {
            logger.info("Loading format metadata from: " + metadataPath);
            return loadMetadata(stream);
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing metadata file: " + e.getMessage(), e);
            logger.info("Falling back to default metadata");
            return loadDefaultMetadata();
        }
    }

    /**
     * Parses a metadata table from a YAML stream.
     */
    public static FormatMetadata loadMetadata(InputStream stream) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        @SuppressWarnings("unchecked")
        Map<String, Object> document = mapper.readValue(stream, Map.class);
        return _createMetadataFromMap(document == null ? Map.of() : document);
    }

    @SuppressWarnings("unchecked")
    private static FormatMetadata _createMetadataFromMap(Map<String, Object> document) {
        FormatMetadata.Builder builder = FormatMetadata.builder();

        for (String entry : _stringList(document, "indentation")) {
            Slot slot = _parseSlot(entry);
            if (slot != null) {
                builder.requiresIndent(slot, true);
            }
        }

        for (String entry : _stringList(document, "leadingNewline")) {
            Slot slot = _parseSlot(entry);
            if (slot != null) {
                builder.requiresLeadingNewline(slot, true);
            }
        }

        for (Map.Entry<String, Object> entry : _map(document, "leadingSpace").entrySet()) {
            Slot slot = _parseSlot(entry.getKey());
            TriState value = _parseTriState(entry.getKey(), entry.getValue());
            if (slot != null && value != null) {
                builder.leadingSpace(slot, value);
            }
        }

        for (Map.Entry<String, Object> entry : _map(document, "trailingSpace").entrySet()) {
            Slot slot = _parseSlot(entry.getKey());
            TriState value = _parseTriState(entry.getKey(), entry.getValue());
            if (slot != null && value != null) {
                builder.trailingSpace(slot, value);
            }
        }

        for (String entry : _stringList(document, "newlineSeparatedChildren")) {
            try {
                builder.childrenSeparatedByNewline(SyntaxKind.valueOf(entry.trim()), true);
            } catch (IllegalArgumentException e) {
                logger.warning("Unknown node kind in newlineSeparatedChildren: '" + entry + "', skipping");
            }
        }

        Map<String, Object> whitespace = _map(document, "whitespace");
        Object defaultValue = whitespace.get("default");
        if (defaultValue instanceof Boolean) {
            builder.defaultWhitespace((Boolean) defaultValue);
        } else if (defaultValue != null) {
            logger.warning("Invalid whitespace default '" + defaultValue + "', using true");
        }

        Object rules = whitespace.get("rules");
        if (rules instanceof List) {
            for (Object rule : (List<Object>) rules) {
                WhitespaceRule parsed = _parseRule(rule);
                if (parsed != null) {
                    builder.addWhitespaceRule(parsed);
                }
            }
        } else if (rules != null) {
            logger.warning("Invalid 'whitespace.rules' section in metadata, expected a list");
        }

        return builder.build();
    }

    private static WhitespaceRule _parseRule(Object rule) {
        if (!(rule instanceof List) || ((List<?>) rule).size() != 3) {
            logger.warning("Invalid whitespace rule " + rule + ", expected [left, right, boolean]");
            return null;
        }
        List<?> parts = (List<?>) rule;
        if (!(parts.get(2) instanceof Boolean)) {
            logger.warning("Invalid whitespace decision in rule " + rule + ", skipping");
            return null;
        }
        try {
            return new WhitespaceRule(
                    WhitespaceRule.Side.parse(String.valueOf(parts.get(0))),
                    WhitespaceRule.Side.parse(String.valueOf(parts.get(1))),
                    (Boolean) parts.get(2));
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown token kind in whitespace rule " + rule + ", skipping");
            return null;
        }
    }

    private static Slot _parseSlot(String text) {
        try {
            return Slot.parse(text);
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown slot '" + text + "' in metadata, skipping");
            return null;
        }
    }

    private static TriState _parseTriState(String key, Object value) {
        if (value == null) {
            return TriState.UNSET;
        }
        if (value instanceof Boolean) {
            return TriState.of((Boolean) value);
        }
        logger.warning("Invalid value '" + value + "' for '" + key + "', skipping");
        return null;
    }

    @SuppressWarnings("unchecked")
    private static List<String> _stringList(Map<String, Object> document, String key) {
        Object value = document.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            logger.warning("Invalid '" + key + "' section in metadata, expected a list");
            return List.of();
        }
        return ((List<Object>) value).stream().map(String::valueOf).toList();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> _map(Map<String, Object> document, String key) {
        Object value = document.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            logger.warning("Invalid '" + key + "' section in metadata, expected a mapping");
            return Map.of();
        }
        return (Map<String, Object>) value;
    }
}
