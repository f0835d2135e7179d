package com.paramguard.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.paramguard.utils.HttpUtils;

/**
 * Compiled path template such as {@code /users/{id}/posts}. Each variable matches one
 * non-empty path segment.
 */
public final class RoutePattern {
    private static final Pattern VARIABLE = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private final String template;
    private final Pattern regex;
    private final List<String> variables;

    private RoutePattern(final String template, final Pattern regex, final List<String> variables) {
        this.template = template;
        this.regex = regex;
        this.variables = variables;
    }

    /**
     * @throws IllegalArgumentException if the template does not start with '/' or repeats a variable
     */
    public static RoutePattern compile(final String template) {
        if (template == null || !template.startsWith("/")) {
            throw new IllegalArgumentException("Path template must start with '/': " + template);
        }
        final StringBuilder regex = new StringBuilder();
        final List<String> variables = new ArrayList<>();
        final Matcher m = VARIABLE.matcher(template);
        int last = 0;
        while (m.find()) {
            regex.append(Pattern.quote(template.substring(last, m.start())));
            final String name = m.group(1);
            if (variables.contains(name)) {
                throw new IllegalArgumentException("Duplicate path variable '" + name + "' in " + template);
            }
            variables.add(name);
            regex.append("([^/]+)");
            last = m.end();
        }
        final String tail = template.substring(last);
        if (tail.contains("{") || tail.contains("}")) {
            throw new IllegalArgumentException("Malformed path variable in " + template);
        }
        regex.append(Pattern.quote(tail));
        return new RoutePattern(template, Pattern.compile(regex.toString()), Collections.unmodifiableList(variables));
    }

    /**
     * Match a raw request path.
     *
     * @return decoded variable values by name, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(final String rawPath) {
        final Matcher m = regex.matcher(rawPath);
        if (!m.matches()) return Optional.empty();
        final Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            // a literal plus in a path segment is not a space
            values.put(variables.get(i), HttpUtils.decodeUrlParameter(m.group(i + 1).replace("+", "%2B")));
        }
        return Optional.of(values);
    }

    /** Literal part of the template before the first variable; used as the server context path. */
    public String staticPrefix() {
        final int brace = template.indexOf('{');
        return brace < 0 ? template : template.substring(0, brace);
    }

    public List<String> variables() {
        return variables;
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return template;
    }
}
