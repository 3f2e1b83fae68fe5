package com.logfire.sdk.encoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parsed message template.
 *
 * <p>Supported syntax:</p>
 * <ul>
 *   <li>{@code {name}}: display form of the argument</li>
 *   <li>{@code {name=}}: {@code name=<display form>}</li>
 *   <li>{@code {name:spec}}: argument formatted with {@code String.format("%" + spec)}</li>
 *   <li><code>{{</code> and <code>}}</code>: literal braces</li>
 * </ul>
 */
public final class MessageTemplate {
    private static final Logger log = LoggerFactory.getLogger(MessageTemplate.class);

    private static final int MAX_CACHED = 1024;
    private static final Map<String, MessageTemplate> CACHE = new ConcurrentHashMap<>();

    private final String source;
    private final List<Part> parts;

    private MessageTemplate(String source, List<Part> parts) {
        this.source = source;
        this.parts = List.copyOf(parts);
    }

    /**
     * Parses a template, reusing a cached parse for templates seen before.
     *
     * @throws TemplateArgumentException if the template is malformed
     */
    public static MessageTemplate parse(String template) {
        Objects.requireNonNull(template, "template is required");
        MessageTemplate cached = CACHE.get(template);
        if (cached != null) {
            return cached;
        }
        MessageTemplate parsed = doParse(template);
        if (CACHE.size() < MAX_CACHED) {
            CACHE.putIfAbsent(template, parsed);
        }
        return parsed;
    }

    private static MessageTemplate doParse(String template) {
        List<Part> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        int length = template.length();
        while (i < length) {
            char c = template.charAt(i);
            if (c == '{') {
                if (i + 1 < length && template.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i + 1);
                if (close < 0) {
                    throw new TemplateArgumentException("Unterminated placeholder in template: " + template);
                }
                if (literal.length() > 0) {
                    parts.add(new Literal(literal.toString()));
                    literal.setLength(0);
                }
                parts.add(placeholder(template.substring(i + 1, close), template));
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < length && template.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new TemplateArgumentException("Single '}' encountered in template: " + template);
            } else {
                literal.append(c);
                i++;
            }
        }
        if (literal.length() > 0) {
            parts.add(new Literal(literal.toString()));
        }
        return new MessageTemplate(template, parts);
    }

    private static Placeholder placeholder(String field, String template) {
        String name = field;
        String spec = null;
        int colon = field.indexOf(':');
        if (colon >= 0) {
            name = field.substring(0, colon);
            spec = field.substring(colon + 1);
        }
        boolean selfDocumenting = name.endsWith("=");
        if (selfDocumenting) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.isEmpty()) {
            throw new TemplateArgumentException("Empty placeholder in template: " + template);
        }
        return new Placeholder(name, selfDocumenting, spec);
    }

    /**
     * Renders this template.
     *
     * @param values named values available to placeholders
     * @throws TemplateArgumentException if a placeholder names an unbound argument
     */
    public String render(Map<String, ?> values) {
        StringBuilder out = new StringBuilder(source.length() + 16);
        for (Part part : parts) {
            if (part instanceof Literal literal) {
                out.append(literal.text());
            } else if (part instanceof Placeholder placeholder) {
                if (!values.containsKey(placeholder.name())) {
                    throw new TemplateArgumentException("'" + placeholder.name()
                            + "' is not bound for template: " + source);
                }
                Object value = values.get(placeholder.name());
                if (placeholder.selfDocumenting()) {
                    out.append(placeholder.name()).append('=');
                }
                out.append(format(value, placeholder.spec()));
            }
        }
        return out.toString();
    }

    /**
     * Names referenced by placeholders, in template order.
     */
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>();
        for (Part part : parts) {
            if (part instanceof Placeholder placeholder) {
                names.add(placeholder.name());
            }
        }
        return names;
    }

    public String source() {
        return source;
    }

    private static String format(Object value, String spec) {
        if (spec == null || spec.isEmpty() || value == null) {
            return display(value);
        }
        try {
            return String.format(Locale.ROOT, "%" + spec, value);
        } catch (IllegalFormatException e) {
            log.debug("template.format.fallback spec='{}' type={} error={}",
                    spec, value.getClass().getName(), e.getMessage());
            return display(value);
        }
    }

    /**
     * Display form used in rendered messages: strings as-is, {@code null} as the
     * literal {@code null}, anything else via {@code toString()}.
     */
    public static String display(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String s) {
            return s;
        }
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            EncodingException failure = new EncodingException(
                    "toString() failed for " + value.getClass().getName(), e);
            log.debug("template.display.fallback error={}", failure.getMessage());
            return "<unrepresentable " + value.getClass().getSimpleName() + ">";
        }
    }

    private interface Part {
    }

    private record Literal(String text) implements Part {
    }

    private record Placeholder(String name, boolean selfDocumenting, String spec) implements Part {
    }
}
