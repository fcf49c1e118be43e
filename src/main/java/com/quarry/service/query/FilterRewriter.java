package com.quarry.service.query;

import com.quarry.model.StreamFieldSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes a user filter expression before it is embedded in a WHERE clause.
 *
 * Comparison operators outside quoted literals get exactly one space on each side,
 * spaced spellings such as {@code ! =} are fused, and bare tokens naming a known stream
 * field are double-quoted so the backend reads them as identifiers.
 * Quoted literals are copied untouched.
 */
public final class FilterRewriter {

    private FilterRewriter() {
    }

    public static String rewrite(String expression, StreamFieldSet streamFields) {
        if (expression == null || expression.isBlank()) {
            return "";
        }
        List<String> tokens = tokenize(expression);
        List<String> rewritten = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            rewritten.add(streamFields.contains(token) ? quoteIdentifier(token) : token);
        }
        return String.join(" ", rewritten);
    }

    static List<String> tokenize(String expression) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        int length = expression.length();

        for (int i = 0; i < length; i++) {
            char c = expression.charAt(i);

            if (quote != 0) {
                current.append(c);
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }

            if (c == '"' || c == '\'') {
                quote = c;
                current.append(c);
            } else if (Character.isWhitespace(c)) {
                flush(current, tokens);
            } else if (c == '=') {
                flush(current, tokens);
                tokens.add("=");
            } else if (c == '<' || c == '>' || c == '!') {
                int next = skipSpaces(expression, i + 1);
                if (next < length && expression.charAt(next) == '=') {
                    flush(current, tokens);
                    tokens.add(c + "=");
                    i = next;
                } else if (c == '!') {
                    current.append(c);
                } else {
                    flush(current, tokens);
                    tokens.add(String.valueOf(c));
                }
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);
        return tokens;
    }

    private static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        return i;
    }

    private static void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }

    private static String quoteIdentifier(String token) {
        return '"' + token.replace("\"", "") + '"';
    }
}
