// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.aptos4j.core.error.TypeTagParseException;

/**
 * Recursive-descent parser for Move type strings.
 *
 * <pre>
 * T ::= primitive
 *     | "vector" "&lt;" T "&gt;"
 *     | "&amp;" T
 *     | address "::" ident "::" ident ("&lt;" T ("," T)* "&gt;")?
 *     | "T" digits
 * </pre>
 *
 * Whitespace between tokens is ignored. Identifiers match {@code [A-Za-z_0-9]+}.
 *
 * @since 0.1.0
 */
public final class TypeTagParser {

    private static final Pattern GENERIC = Pattern.compile("T[0-9]+");

    private final String input;
    private int pos;

    private TypeTagParser(final String input) {
        this.input = input;
    }

    /**
     * Parses a complete type string.
     *
     * @param text the type text
     * @return the tag
     * @throws TypeTagParseException if the text is empty, malformed or has trailing tokens
     */
    public static TypeTag parse(final String text) {
        Objects.requireNonNull(text, "type cannot be null");
        final TypeTagParser parser = new TypeTagParser(text);
        parser.skipWhitespace();
        if (parser.atEnd()) {
            throw new TypeTagParseException("empty type string");
        }
        final TypeTag tag = parser.parseType();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("unexpected trailing input '" + text.substring(parser.pos) + "'");
        }
        return tag;
    }

    private TypeTag parseType() {
        skipWhitespace();
        if (atEnd()) {
            throw error("unexpected end of input, expected a type");
        }
        final char c = input.charAt(pos);
        if (c == '&') {
            pos++;
            return new ReferenceTag(parseType());
        }
        if (c == '<' || c == '>' || c == ',' || c == ':') {
            throw error("unexpected '" + c + "'");
        }
        final int start = pos;
        final String ident = readIdentifier();
        skipWhitespace();
        if (lookingAt("::")) {
            return parseStruct(ident, start);
        }
        if ("vector".equals(ident)) {
            final List<TypeTag> params = parseTypeParams();
            if (params.size() != 1) {
                throw error("vector takes exactly one type parameter, got " + params.size());
            }
            return new VectorTag(params.get(0));
        }
        final PrimitiveTypeTag primitive = PrimitiveTypeTag.fromText(ident);
        if (primitive != null) {
            rejectTypeParams(ident);
            return primitive;
        }
        if (GENERIC.matcher(ident).matches()) {
            rejectTypeParams(ident);
            try {
                return new GenericTag(Integer.parseInt(ident.substring(1)));
            } catch (IllegalArgumentException e) {
                throw error("invalid generic index in '" + ident + "'");
            }
        }
        throw new TypeTagParseException("unknown type '" + ident + "' at position " + start);
    }

    private TypeTag parseStruct(final String addressText, final int start) {
        final AccountAddress address;
        try {
            address = AccountAddress.fromString(addressText);
        } catch (IllegalArgumentException e) {
            throw new TypeTagParseException("invalid struct address '" + addressText + "' at position " + start, e);
        }
        expect("::");
        skipWhitespace();
        final String module = readIdentifier();
        skipWhitespace();
        if (!lookingAt("::")) {
            throw error("malformed struct name, expected '::' after module '" + module + "'");
        }
        expect("::");
        skipWhitespace();
        final String name = readIdentifier();
        skipWhitespace();
        final List<TypeTag> params = lookingAt("<") ? parseTypeParams() : List.of();
        return new StructTag(address, module, name, params);
    }

    private List<TypeTag> parseTypeParams() {
        skipWhitespace();
        expect("<");
        final List<TypeTag> params = new ArrayList<>();
        while (true) {
            params.add(parseType());
            skipWhitespace();
            if (atEnd()) {
                throw error("missing '>'");
            }
            final char c = input.charAt(pos);
            if (c == ',') {
                pos++;
                continue;
            }
            if (c == '>') {
                pos++;
                return params;
            }
            throw error("unexpected '" + c + "', expected ',' or '>'");
        }
    }

    private void rejectTypeParams(final String ident) {
        skipWhitespace();
        if (lookingAt("<")) {
            throw error("type '" + ident + "' does not take type parameters");
        }
    }

    private String readIdentifier() {
        final int start = pos;
        while (!atEnd()) {
            final char c = input.charAt(pos);
            if (!(Character.isLetterOrDigit(c) && c < 128) && c != '_') {
                break;
            }
            pos++;
        }
        if (start == pos) {
            if (atEnd()) {
                throw error("unexpected end of input, expected an identifier");
            }
            throw error("unexpected '" + input.charAt(pos) + "', expected an identifier");
        }
        return input.substring(start, pos);
    }

    private void expect(final String token) {
        if (!lookingAt(token)) {
            throw error(atEnd() ? "missing '" + token + "'" : "expected '" + token + "'");
        }
        pos += token.length();
    }

    private boolean lookingAt(final String token) {
        return input.startsWith(token, pos);
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private TypeTagParseException error(final String message) {
        return new TypeTagParseException(message + " at position " + pos + " in '" + input + "'");
    }
}
