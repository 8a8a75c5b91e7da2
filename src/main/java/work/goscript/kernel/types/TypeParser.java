package work.goscript.kernel.types;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for type expressions such as {@code [3]struct { a int; b string }} or
 * {@code map[*Point]any}.
 */
public final class TypeParser {
    private final String source;
    private final TypeRegistry registry;
    private int pos;

    private TypeParser(String source, TypeRegistry registry) {
        this.source = source;
        this.registry = registry;
    }

    public static GosType parse(String expression, TypeRegistry registry) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("empty type expression");
        }
        var parser = new TypeParser(expression, registry == null ? new TypeRegistry() : registry);
        var type = parser.parseType();
        parser.skipSpace();
        if (parser.pos < parser.source.length()) {
            throw parser.error("unexpected trailing input");
        }
        return type;
    }

    private GosType parseType() {
        skipSpace();
        if (consume("*")) {
            return new PointerType(parseType());
        }
        if (consume("[")) {
            skipSpace();
            if (consume("]")) {
                return ArrayType.inferred(parseType());
            }
            if (consume("...")) {
                expect("]");
                return ArrayType.ellipsis(parseType());
            }
            int length = parseLength();
            expect("]");
            return ArrayType.fixed(parseType(), length);
        }
        var word = identifier();
        switch (word) {
            case "map" -> {
                expect("[");
                var key = parseType();
                expect("]");
                return new MapType(key, parseType());
            }
            case "struct" -> {
                return StructType.anonymous(parseFields());
            }
            case "interface" -> {
                expect("{");
                expect("}");
                return AnyType.ANY;
            }
            case "any" -> {
                return AnyType.ANY;
            }
            default -> {
                var basic = BasicType.lookup(word);
                if (basic != null) {
                    return basic;
                }
                var declared = registry.lookup(word);
                if (declared == null) {
                    throw error("undefined type " + word);
                }
                return declared;
            }
        }
    }

    private List<StructType.Field> parseFields() {
        expect("{");
        var fields = new ArrayList<StructType.Field>();
        while (true) {
            skipSeparators();
            if (consume("}")) {
                return fields;
            }
            var names = new ArrayList<String>();
            names.add(identifier());
            skipSpace();
            while (consume(",")) {
                names.add(identifier());
                skipSpace();
            }
            var type = parseType();
            for (String name : names) {
                fields.add(new StructType.Field(name, type));
            }
        }
    }

    private int parseLength() {
        skipSpace();
        int start = pos;
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("expected array length");
        }
        try {
            return Integer.parseInt(source.substring(start, pos));
        } catch (NumberFormatException ex) {
            throw error("array length too large");
        }
    }

    private String identifier() {
        skipSpace();
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetter(c) || c == '_' || (pos > start && Character.isDigit(c))) {
                pos++;
            } else {
                break;
            }
        }
        if (start == pos) {
            throw error("expected identifier");
        }
        return source.substring(start, pos);
    }

    private void expect(String token) {
        skipSpace();
        if (!consume(token)) {
            throw error("expected '" + token + "'");
        }
    }

    private boolean consume(String token) {
        skipSpace();
        if (source.startsWith(token, pos)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private void skipSeparators() {
        while (true) {
            skipSpace();
            if (pos < source.length() && source.charAt(pos) == ';') {
                pos++;
            } else {
                return;
            }
        }
    }

    private void skipSpace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(message + " at offset " + pos + " in type expression: " + source);
    }
}
