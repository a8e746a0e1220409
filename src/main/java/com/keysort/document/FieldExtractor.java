package com.keysort.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.keysort.exception.RuleFormatException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the typed fields of a rule object and rewrites its condition literal in place.
 * <p>
 * Parsing is lenient: comments, trailing commas, single quotes and unquoted member
 * names are accepted, as they commonly appear in hand-edited binding files.
 */
public class FieldExtractor {

    private final JsonMapper mapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build();

    private final RuleFieldNames names;

    public FieldExtractor(RuleFieldNames names) {
        this.names = names;
    }

    /**
     * Extract trigger, action and condition from one object.
     *
     * @param objectText Object source, braces included
     * @return Typed fields
     * @throws RuleFormatException if the text is not a well-formed object
     */
    public RuleFields extract(String objectText) {
        JsonNode node;
        try {
            node = mapper.readTree(objectText);
        } catch (JsonProcessingException e) {
            throw new RuleFormatException("Malformed rule object: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new RuleFormatException("Rule is not a JSON object");
        }
        return new RuleFields(
                text(node.get(names.trigger())),
                text(node.get(names.action())),
                text(node.get(names.condition())));
    }

    /**
     * Replace the condition member's string literal with {@code value}.
     * Returns the text unchanged when the object has no string-valued condition member.
     */
    public String rewriteCondition(String objectText, String value) {
        return locateStringMember(objectText, names.condition())
                .map(span -> objectText.substring(0, span.start())
                        + '"' + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + '"'
                        + objectText.substring(span.end()))
                .orElse(objectText);
    }

    /**
     * Locate the string literal value of a top-level member, quotes included.
     * Members inside comments or nested values are never matched; when a member
     * repeats, the last occurrence wins.
     */
    public Optional<Span> locateStringMember(String objectText, String member) {
        List<Lexeme> lexemes = topLevelLexemes(objectText);
        Span found = null;
        for (int i = 0; i + 2 < lexemes.size(); i++) {
            Lexeme name = lexemes.get(i);
            if ((name.kind() == LexemeKind.STRING || name.kind() == LexemeKind.NAME)
                    && lexemes.get(i + 1).kind() == LexemeKind.COLON
                    && lexemes.get(i + 2).kind() == LexemeKind.STRING
                    && member.equals(memberName(objectText, name))) {
                Lexeme value = lexemes.get(i + 2);
                found = new Span(value.start(), value.end());
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Decode a quoted JSON string literal.
     */
    public String decodeString(String literal) {
        try {
            return mapper.readValue(literal, String.class);
        } catch (JsonProcessingException e) {
            throw new RuleFormatException("Malformed string literal: " + literal, e);
        }
    }

    private String memberName(String objectText, Lexeme lexeme) {
        String raw = objectText.substring(lexeme.start(), lexeme.end());
        return lexeme.kind() == LexemeKind.STRING ? decodeString(raw) : raw;
    }

    private static String text(JsonNode value) {
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    private static List<Lexeme> topLevelLexemes(String text) {
        List<Lexeme> lexemes = new ArrayList<>();
        JsoncScanner scanner = new JsoncScanner(text);
        int depth = 0;
        int stringStart = -1;
        int nameStart = -1;

        while (scanner.hasNext()) {
            int at = scanner.position();
            char c = text.charAt(at);
            JsoncScanner.State state = scanner.next();

            if (state != JsoncScanner.State.CODE && nameStart >= 0) {
                if (depth == 1) {
                    lexemes.add(new Lexeme(LexemeKind.NAME, nameStart, at));
                }
                nameStart = -1;
            }
            if (state.isString()) {
                if (stringStart < 0) {
                    stringStart = at;
                }
                if (scanner.state() == JsoncScanner.State.CODE) {
                    if (depth == 1) {
                        lexemes.add(new Lexeme(LexemeKind.STRING, stringStart, at + 1));
                    }
                    stringStart = -1;
                }
                continue;
            }
            if (state.isComment()) {
                continue;
            }

            if (Character.isLetterOrDigit(c) || c == '_' || c == '$') {
                if (nameStart < 0) {
                    nameStart = at;
                }
                continue;
            }
            if (nameStart >= 0) {
                if (depth == 1) {
                    lexemes.add(new Lexeme(LexemeKind.NAME, nameStart, at));
                }
                nameStart = -1;
            }

            switch (c) {
                case '{', '[' -> {
                    if (depth == 1) {
                        lexemes.add(new Lexeme(LexemeKind.OTHER, at, at + 1));
                    }
                    depth++;
                }
                case '}', ']' -> depth--;
                case ':' -> {
                    if (depth == 1) {
                        lexemes.add(new Lexeme(LexemeKind.COLON, at, at + 1));
                    }
                }
                default -> {
                    if (depth == 1 && !Character.isWhitespace(c)) {
                        lexemes.add(new Lexeme(LexemeKind.OTHER, at, at + 1));
                    }
                }
            }
        }
        return lexemes;
    }

    /**
     * Half-open source range.
     */
    public record Span(int start, int end) {
    }

    private enum LexemeKind {STRING, NAME, COLON, OTHER}

    private record Lexeme(LexemeKind kind, int start, int end) {
    }
}
