package com.quarry.service.query;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces dashboard variables in a query: {@code $name}, {@code ${name}} and {@code [[name]]}.
 * Unknown variables are left as written.
 */
@Component
public class TemplateVariableResolver {

    private static final Pattern VARIABLE = Pattern.compile(
            "\\$\\{(\\w+)}|\\[\\[(\\w+)]]|\\$(\\w+)");

    public String resolve(String query, Map<String, String> variables) {
        if (query == null || query.isEmpty()) {
            return query == null ? "" : query;
        }
        if (variables == null || variables.isEmpty()) {
            return query;
        }

        Matcher matcher = VARIABLE.matcher(query);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = firstNonNull(matcher.group(1), matcher.group(2), matcher.group(3));
            String value = variables.get(name);
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
