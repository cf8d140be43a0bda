package com.luacomposer.core.ast;

/**
 * Decodes Lua string literals as written in source into their values.
 */
final class LuaStrings {

    private LuaStrings() {
        // Utility class
    }

    /**
     * Decodes a quoted or long-bracket string literal.
     *
     * @param raw literal text including delimiters
     * @return decoded value
     */
    static String decode(String raw) {
        if (raw.startsWith("[")) {
            return decodeLong(raw);
        }
        return decodeQuoted(raw.substring(1, raw.length() - 1));
    }

    private static String decodeLong(String raw) {
        int level = raw.indexOf('[', 1) - 1;
        String body = raw.substring(level + 2, raw.length() - level - 2);
        // A line break right after the opening bracket is not part of the string.
        if (body.startsWith("\r\n") || body.startsWith("\n\r")) {
            return body.substring(2);
        }
        if (body.startsWith("\n") || body.startsWith("\r")) {
            return body.substring(1);
        }
        return body;
    }

    private static String decodeQuoted(String body) {
        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char e = body.charAt(i + 1);
            i += 2;
            switch (e) {
                case 'a' -> out.append('\u0007');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'v' -> out.append('\u000B');
                case '\n' -> out.append('\n');
                case '\r' -> {
                    out.append('\n');
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case 'z' -> {
                    while (i < body.length() && Character.isWhitespace(body.charAt(i))) {
                        i++;
                    }
                }
                case 'x' -> {
                    out.append((char) Integer.parseInt(body.substring(i, i + 2), 16));
                    i += 2;
                }
                case 'u' -> {
                    int close = body.indexOf('}', i);
                    out.appendCodePoint(Integer.parseInt(body.substring(i + 1, close), 16));
                    i = close + 1;
                }
                default -> {
                    if (Character.isDigit(e)) {
                        int endDigits = i - 1;
                        while (endDigits < body.length() && endDigits < i + 2 && Character.isDigit(body.charAt(endDigits))) {
                            endDigits++;
                        }
                        out.append((char) Integer.parseInt(body.substring(i - 1, endDigits)));
                        i = endDigits;
                    } else {
                        out.append(e);
                    }
                }
            }
        }
        return out.toString();
    }
}
