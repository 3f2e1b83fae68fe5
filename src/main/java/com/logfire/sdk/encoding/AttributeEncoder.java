package com.logfire.sdk.encoding;

import com.logfire.sdk.core.model.AttributeKeys;
import com.logfire.sdk.core.model.AttributeValue;
import com.logfire.sdk.core.model.Attributes;
import com.logfire.sdk.core.model.CodeLocation;
import com.logfire.sdk.core.model.LogLevel;
import com.logfire.sdk.core.model.SpanKind;
import com.logfire.sdk.core.model.TagList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a message template plus named values into a rendered message and a flat,
 * typed attribute map.
 *
 * <p>Primitive values (strings, integral and floating point numbers, booleans) are stored
 * as-is. Null values are not stored; their names go to {@code logfire.null_args} and they
 * render as {@code null}. Any other value is stored as JSON under {@code <name>__JSON}
 * (see {@link JsonValueEncoder}).</p>
 *
 * <p>Attribute order is fixed:</p>
 * <pre>
 * span, start_span:  code.filepath, code.lineno, code.function, &lt;user values&gt;,
 *                    logfire.null_args, logfire.tags, logfire.msg_template, logfire.msg,
 *                    logfire.span_type[, logfire.start_parent_id]
 * log:               logfire.span_type, logfire.level, logfire.msg_template, logfire.msg,
 *                    code.filepath, code.lineno, code.function, &lt;user values&gt;,
 *                    logfire.null_args, logfire.tags
 * </pre>
 *
 * <p>Encoding is deterministic: the same template, tags and values always give the same
 * message and attributes.</p>
 */
public class AttributeEncoder {

    /**
     * Name under which an explicit span name is visible to the template.
     */
    public static final String SPAN_NAME_ARG = "span_name";

    private final JsonValueEncoder jsonEncoder;

    public AttributeEncoder() {
        this(new JsonValueEncoder());
    }

    public AttributeEncoder(JsonValueEncoder jsonEncoder) {
        this.jsonEncoder = Objects.requireNonNull(jsonEncoder, "jsonEncoder is required");
    }

    /**
     * Renders {@code template} and encodes {@code namedValues}.
     *
     * @param template     message template
     * @param explicitName optional span name, bound as {@value #SPAN_NAME_ARG} for formatting only
     * @param tags         tags to record, omitted when empty
     * @param namedValues  named values in call order; may contain null values
     * @throws TemplateArgumentException if a placeholder is unbound or a name is reserved
     */
    public EncodedMessage encode(String template, String explicitName, TagList tags, Map<String, ?> namedValues) {
        Objects.requireNonNull(template, "template is required");
        Map<String, ?> values = namedValues != null ? namedValues : Map.of();

        Map<String, Object> formatValues = new LinkedHashMap<>(values);
        if (explicitName != null && !formatValues.containsKey(SPAN_NAME_ARG)) {
            formatValues.put(SPAN_NAME_ARG, explicitName);
        }
        String message = MessageTemplate.parse(template).render(formatValues);

        Attributes.Builder attributes = Attributes.builder();
        List<String> nullArgs = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String name = entry.getKey();
            if (AttributeKeys.isReserved(name)) {
                throw new TemplateArgumentException("'" + name + "' is a reserved attribute name");
            }
            putValue(attributes, name, entry.getValue(), nullArgs);
        }
        if (!nullArgs.isEmpty()) {
            attributes.put(AttributeKeys.NULL_ARGS, AttributeValue.ofStrings(nullArgs));
        }
        if (tags != null && !tags.isEmpty()) {
            attributes.put(AttributeKeys.TAGS, AttributeValue.ofStrings(tags.asList()));
        }
        return new EncodedMessage(template, message, attributes.build(), nullArgs);
    }

    /**
     * Encodes a single value under {@code name} following the primitive / null / JSON rules.
     *
     * @param nullArgs receives {@code name} when {@code value} is null
     */
    public void putValue(Attributes.Builder attributes, String name, Object value, List<String> nullArgs) {
        if (value == null) {
            nullArgs.add(name);
            return;
        }
        AttributeValue primitive = primitive(value);
        if (primitive != null) {
            attributes.put(name, primitive);
        } else {
            attributes.put(name + AttributeKeys.JSON_SUFFIX, jsonEncoder.encode(value));
        }
    }

    /**
     * Attributes of a {@code span} or {@code start_span} record.
     *
     * @param startParentId decimal id of the previously active span, only used for {@code start_span}
     */
    public Attributes spanAttributes(EncodedMessage encoded, CodeLocation location, SpanKind kind,
                                     String startParentId) {
        Attributes.Builder attributes = Attributes.builder();
        putCodeLocation(attributes, location);
        attributes.putAll(encoded.attributes());
        attributes.put(AttributeKeys.MESSAGE_TEMPLATE, encoded.template());
        attributes.put(AttributeKeys.MESSAGE, encoded.message());
        attributes.put(AttributeKeys.SPAN_TYPE, kind.wireName());
        if (kind == SpanKind.START_SPAN) {
            attributes.put(AttributeKeys.START_PARENT_ID, startParentId != null ? startParentId : "0");
        }
        return attributes.build();
    }

    /**
     * Attributes of a {@code log} record.
     */
    public Attributes logAttributes(EncodedMessage encoded, LogLevel level, CodeLocation location) {
        Attributes.Builder attributes = Attributes.builder();
        attributes.put(AttributeKeys.SPAN_TYPE, SpanKind.LOG.wireName());
        attributes.put(AttributeKeys.LEVEL, level.wireName());
        attributes.put(AttributeKeys.MESSAGE_TEMPLATE, encoded.template());
        attributes.put(AttributeKeys.MESSAGE, encoded.message());
        putCodeLocation(attributes, location);
        attributes.putAll(encoded.attributes());
        return attributes.build();
    }

    private static void putCodeLocation(Attributes.Builder attributes, CodeLocation location) {
        if (location == null) {
            return;
        }
        if (location.filepath() != null) {
            attributes.put(AttributeKeys.CODE_FILEPATH, location.filepath());
        }
        if (location.lineno() >= 0) {
            attributes.put(AttributeKeys.CODE_LINENO, location.lineno());
        }
        if (location.function() != null) {
            attributes.put(AttributeKeys.CODE_FUNCTION, location.function());
        }
    }

    static AttributeValue primitive(Object value) {
        if (value instanceof String s) {
            return AttributeValue.of(s);
        }
        if (value instanceof Character c) {
            return AttributeValue.of(String.valueOf(c));
        }
        if (value instanceof Boolean b) {
            return AttributeValue.of(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return AttributeValue.of(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return AttributeValue.of(((Number) value).doubleValue());
        }
        return null;
    }
}
