package io.harmonia.core.expression;

import io.harmonia.core.exception.ExpressionSyntaxException;
import java.util.ArrayList;
import java.util.List;

/// Recursive-descent parser for strings containing `${...}` references.
///
/// ### Grammar
/// ```
/// reference := '${' name ( '.' name | '[' index ']' )* '}'
/// index     := digits | '\'' chars '\'' | '"' chars '"'
/// name      := [A-Za-z0-9_-]+
/// ```
///
/// Text outside markers is literal. A `$` not followed by `{` is literal too.
/// There is no escape syntax.
///
/// @implNote Stateless and thread-safe.
public final class ReferenceParser {

    static final String OPEN = "${";

    private ReferenceParser() {}

    /// Cheap pre-check that avoids a full parse for plain strings.
    public static boolean containsMarker(String value) {
        return value != null && value.contains(OPEN);
    }

    /// Parses a string into literal and marker parts.
    ///
    /// @param input the string to parse, not null
    /// @return the parsed template, never null
    /// @throws ExpressionSyntaxException if a marker is unterminated or malformed
    public static Template parse(String input) throws ExpressionSyntaxException {
        List<Template.Part> parts = new ArrayList<>();
        int pos = 0;
        while (pos < input.length()) {
            int start = input.indexOf(OPEN, pos);
            if (start < 0) {
                parts.add(new Template.Literal(input.substring(pos)));
                break;
            }
            if (start > pos) {
                parts.add(new Template.Literal(input.substring(pos, start)));
            }
            Cursor cursor = new Cursor(input, start + OPEN.length());
            List<PathSegment> segments = cursor.parsePath();
            parts.add(
                    new Template.Marker(
                            new Reference(segments, input.substring(start, cursor.pos))));
            pos = cursor.pos;
        }
        return new Template(input, parts);
    }

    /// Parses a string that must consist of exactly one reference.
    public static Reference parseReference(String input) throws ExpressionSyntaxException {
        Template template = parse(input);
        if (!template.isSingleMarker()) {
            throw new ExpressionSyntaxException("Expected a single reference", input, 0);
        }
        return template.references().get(0);
    }

    private static final class Cursor {
        private final String input;
        private int pos;

        Cursor(String input, int pos) {
            this.input = input;
            this.pos = pos;
        }

        List<PathSegment> parsePath() throws ExpressionSyntaxException {
            List<PathSegment> segments = new ArrayList<>();
            segments.add(new PathSegment.Key(name()));
            while (true) {
                if (pos >= input.length()) {
                    throw error("Unterminated reference");
                }
                char c = input.charAt(pos);
                if (c == '}') {
                    pos++;
                    return segments;
                } else if (c == '.') {
                    pos++;
                    segments.add(new PathSegment.Key(name()));
                } else if (c == '[') {
                    pos++;
                    segments.add(index());
                } else {
                    throw error("Unexpected character '" + c + "'");
                }
            }
        }

        private String name() throws ExpressionSyntaxException {
            int start = pos;
            while (pos < input.length() && isNameChar(input.charAt(pos))) {
                pos++;
            }
            if (pos == start) {
                throw error(pos >= input.length() ? "Unterminated reference" : "Expected a name");
            }
            return input.substring(start, pos);
        }

        private PathSegment index() throws ExpressionSyntaxException {
            if (pos >= input.length()) {
                throw error("Unterminated index");
            }
            char c = input.charAt(pos);
            PathSegment segment;
            if (Character.isDigit(c)) {
                int start = pos;
                while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
                    pos++;
                }
                try {
                    segment = new PathSegment.Index(Integer.parseInt(input.substring(start, pos)));
                } catch (NumberFormatException e) {
                    throw error("Index out of range");
                }
            } else if (c == '\'' || c == '"') {
                int close = input.indexOf(c, pos + 1);
                if (close < 0) {
                    throw error("Unterminated quoted key");
                }
                segment = new PathSegment.Key(input.substring(pos + 1, close));
                pos = close + 1;
            } else {
                throw error("Index must be a number or a quoted key");
            }
            if (pos >= input.length() || input.charAt(pos) != ']') {
                throw error("Expected ']'");
            }
            pos++;
            return segment;
        }

        private ExpressionSyntaxException error(String message) {
            return new ExpressionSyntaxException(message, input, pos);
        }

        private static boolean isNameChar(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '-';
        }
    }
}
