package com.logfire.sdk.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Base64;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Encodes arbitrary values as JSON for {@code <name>__JSON} attributes.
 *
 * <p>Values are classified into a closed set of variants, each with a fixed encoding:</p>
 * <ul>
 *   <li><b>Primitive</b>: strings, numbers, booleans and null become JSON scalars</li>
 *   <li><b>Sequence</b>: lists and arrays become JSON arrays; sets become
 *       {@code {"$__datatype__":"set","data":[...]}}</li>
 *   <li><b>Mapping</b>: maps become JSON objects with stringified keys</li>
 *   <li><b>Record</b>: Java records and beans become
 *       {@code {"$__datatype__":"dataclass","data":{...},"cls":"Name"}}</li>
 *   <li><b>Opaque</b>: enums, temporal values, decimals, UUIDs, bytes, paths, throwables
 *       and anything unrecognised, tagged with a type name and a string or numeric payload</li>
 * </ul>
 *
 * <p>The type tags follow the vocabulary the Logfire backend already renders.</p>
 */
public class JsonValueEncoder {
    private static final Logger log = LoggerFactory.getLogger(JsonValueEncoder.class);

    static final String DATATYPE_KEY = "$__datatype__";
    private static final int MAX_DEPTH = 32;

    private final ObjectMapper objectMapper;
    private final JsonNodeFactory nodes;

    public JsonValueEncoder() {
        this(new ObjectMapper());
    }

    public JsonValueEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.nodes = objectMapper.getNodeFactory();
    }

    /**
     * Encodes {@code value} to a compact JSON string. Never throws: values that cannot
     * be encoded degrade to an {@code unknown} placeholder.
     */
    public String encode(Object value) {
        JsonNode node;
        try {
            node = toNode(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
        } catch (RuntimeException e) {
            log.debug("encoding.json.fallback type={} error={}",
                    value == null ? "null" : value.getClass().getName(), e.getMessage());
            node = placeholder(value);
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.debug("encoding.json.write_failed error={}", e.getMessage());
            return "{\"" + DATATYPE_KEY + "\":\"unknown\",\"data\":null}";
        }
    }

    /**
     * Converts {@code value} to a Jackson tree following the variant rules.
     *
     * @throws EncodingException on reference cycles, excessive nesting or failing accessors
     */
    public JsonNode toNode(Object value) {
        return toNode(value, Collections.newSetFromMap(new IdentityHashMap<>()), 0);
    }

    private JsonNode toNode(Object value, Set<Object> inProgress, int depth) {
        if (depth > MAX_DEPTH) {
            throw new EncodingException("Value nested deeper than " + MAX_DEPTH + " levels");
        }
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof String s) {
            return nodes.textNode(s);
        }
        if (value instanceof Character c) {
            return nodes.textNode(String.valueOf(c));
        }
        if (value instanceof Boolean b) {
            return nodes.booleanNode(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return nodes.numberNode(((Number) value).longValue());
        }
        if (value instanceof Float || value instanceof Double) {
            return nodes.numberNode(((Number) value).doubleValue());
        }
        if (value instanceof Optional<?> optional) {
            return toNode(optional.orElse(null), inProgress, depth + 1);
        }

        JsonNode opaque = opaque(value);
        if (opaque != null) {
            return opaque;
        }

        if (!inProgress.add(value)) {
            throw new EncodingException("Reference cycle through " + value.getClass().getName());
        }
        try {
            if (value instanceof Map<?, ?> map) {
                ObjectNode object = nodes.objectNode();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    object.set(String.valueOf(entry.getKey()), toNode(entry.getValue(), inProgress, depth + 1));
                }
                return object;
            }
            if (value instanceof Set<?> set) {
                return tagged("set", sequence(set, inProgress, depth), null);
            }
            if (value instanceof Iterable<?> iterable) {
                return sequence(iterable, inProgress, depth);
            }
            if (value.getClass().isArray()) {
                ArrayNode array = nodes.arrayNode();
                int length = Array.getLength(value);
                for (int i = 0; i < length; i++) {
                    array.add(toNode(Array.get(value, i), inProgress, depth + 1));
                }
                return array;
            }
            if (value.getClass().isRecord()) {
                return tagged("dataclass", recordFields(value, inProgress, depth), value.getClass().getSimpleName());
            }
            ObjectNode bean = beanFields(value, inProgress, depth);
            if (bean != null) {
                return tagged("dataclass", bean, value.getClass().getSimpleName());
            }
            return tagged("unknown", nodes.textNode(MessageTemplate.display(value)), value.getClass().getSimpleName());
        } finally {
            inProgress.remove(value);
        }
    }

    private JsonNode opaque(Object value) {
        if (value instanceof Enum<?> e) {
            return tagged("Enum", nodes.textNode(e.name()), e.getDeclaringClass().getSimpleName());
        }
        if (value instanceof Instant || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime || value instanceof LocalDateTime) {
            return tagged("datetime", nodes.textNode(value.toString()), null);
        }
        if (value instanceof LocalDate) {
            return tagged("date", nodes.textNode(value.toString()), null);
        }
        if (value instanceof LocalTime) {
            return tagged("time", nodes.textNode(value.toString()), null);
        }
        if (value instanceof Duration d) {
            double seconds = d.getSeconds() + d.getNano() / 1_000_000_000.0;
            return tagged("timedelta", nodes.numberNode(seconds), null);
        }
        if (value instanceof BigDecimal d) {
            return tagged("Decimal", nodes.textNode(d.toPlainString()), null);
        }
        if (value instanceof BigInteger i) {
            return tagged("int", nodes.textNode(i.toString()), null);
        }
        if (value instanceof UUID u) {
            return tagged("UUID", nodes.textNode(u.toString()), null);
        }
        if (value instanceof byte[] bytes) {
            String utf8 = decodeUtf8(bytes);
            return utf8 != null
                    ? tagged("bytes-utf8", nodes.textNode(utf8), null)
                    : tagged("bytes-base64", nodes.textNode(Base64.getEncoder().encodeToString(bytes)), null);
        }
        if (value instanceof Path p) {
            return tagged("PosixPath", nodes.textNode(p.toString()), null);
        }
        if (value instanceof Throwable t) {
            return tagged("Exception", nodes.textNode(String.valueOf(t.getMessage())), t.getClass().getSimpleName());
        }
        return null;
    }

    private ArrayNode sequence(Iterable<?> items, Set<Object> inProgress, int depth) {
        ArrayNode array = nodes.arrayNode();
        for (Object item : items) {
            array.add(toNode(item, inProgress, depth + 1));
        }
        return array;
    }

    private ObjectNode recordFields(Object record, Set<Object> inProgress, int depth) {
        ObjectNode fields = nodes.objectNode();
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Method accessor = component.getAccessor();
            Object fieldValue;
            try {
                accessor.setAccessible(true);
                fieldValue = accessor.invoke(record);
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new EncodingException("Cannot read record component " + component.getName(), e);
            }
            fields.set(component.getName(), toNode(fieldValue, inProgress, depth + 1));
        }
        return fields;
    }

    private ObjectNode beanFields(Object bean, Set<Object> inProgress, int depth) {
        BeanDescription description = objectMapper.getSerializationConfig()
                .introspect(objectMapper.constructType(bean.getClass()));
        List<BeanPropertyDefinition> properties = description.findProperties();
        ObjectNode fields = nodes.objectNode();
        for (BeanPropertyDefinition property : properties) {
            AnnotatedMember accessor = property.getAccessor();
            if (accessor == null) {
                continue;
            }
            Object fieldValue;
            try {
                accessor.fixAccess(true);
                fieldValue = accessor.getValue(bean);
            } catch (RuntimeException e) {
                throw new EncodingException("Cannot read property " + property.getName(), e);
            }
            fields.set(property.getName(), toNode(fieldValue, inProgress, depth + 1));
        }
        return fields.isEmpty() ? null : fields;
    }

    private ObjectNode tagged(String datatype, JsonNode data, String cls) {
        ObjectNode node = nodes.objectNode();
        node.put(DATATYPE_KEY, datatype);
        node.set("data", data);
        if (cls != null) {
            node.put("cls", cls);
        }
        return node;
    }

    private ObjectNode placeholder(Object value) {
        String cls = value == null ? null : value.getClass().getSimpleName();
        String text = value == null ? "null" : "<unrepresentable " + cls + ">";
        return tagged("unknown", nodes.textNode(text), cls);
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
