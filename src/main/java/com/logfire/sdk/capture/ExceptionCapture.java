package com.logfire.sdk.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logfire.sdk.core.model.AttributeKeys;
import com.logfire.sdk.core.model.Attributes;
import com.logfire.sdk.encoding.JsonValueEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Converts a throwable into the attributes of an {@code exception} span event.
 *
 * <p>The event carries the exception type, message and stack trace text, and a
 * structured trace under {@code exception.logfire.trace}:</p>
 * <pre>
 * {"stacks":[{"exc_type":..,"exc_value":..,"syntax_error":null,"is_cause":false,
 *             "frames":[{"filename":..,"lineno":..,"name":..,"line":"","locals":null}, ...]}, ...]}
 * </pre>
 *
 * <p>Stacks run from the captured throwable down its cause chain. Frames are ordered
 * outermost call first. Each throwable appears once, so cause cycles terminate, and a
 * cause omits the frames it shares with its enclosing throwable.</p>
 *
 * <p>Capture never throws.</p>
 */
public class ExceptionCapture {
    private static final Logger log = LoggerFactory.getLogger(ExceptionCapture.class);

    private final ObjectMapper objectMapper;
    private final JsonValueEncoder valueEncoder;

    public ExceptionCapture() {
        this(new ObjectMapper());
    }

    public ExceptionCapture(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.valueEncoder = new JsonValueEncoder(objectMapper);
    }

    /**
     * Exception attributes for {@code throwable}, degraded to type and message if the
     * structured parts cannot be built.
     */
    public Attributes attributes(Throwable throwable) {
        try {
            Attributes.Builder attributes = Attributes.builder()
                    .put(AttributeKeys.EXCEPTION_TYPE, throwable.getClass().getSimpleName())
                    .put(AttributeKeys.EXCEPTION_MESSAGE, messageOf(throwable))
                    .put(AttributeKeys.EXCEPTION_STACKTRACE, stackTraceText(throwable));
            String data = validationData(throwable);
            if (data != null) {
                attributes.put(AttributeKeys.EXCEPTION_DATA, data);
            }
            attributes.put(AttributeKeys.EXCEPTION_TRACE, trace(throwable));
            return attributes.build();
        } catch (RuntimeException e) {
            log.debug("capture.degraded type={} error={}", throwable.getClass().getName(), e.toString());
            return Attributes.builder()
                    .put(AttributeKeys.EXCEPTION_TYPE, throwable.getClass().getSimpleName())
                    .put(AttributeKeys.EXCEPTION_MESSAGE, safeMessage(throwable))
                    .put(AttributeKeys.EXCEPTION_TRACE, "{\"stacks\":[]}")
                    .build();
        }
    }

    /**
     * JSON text of the structured trace for {@code throwable}.
     *
     * @throws CaptureException if the trace cannot be serialized
     */
    String trace(Throwable throwable) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode stacks = root.putArray("stacks");

        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        StackTraceElement[] enclosing = null;
        boolean isCause = false;
        for (Throwable current = throwable; current != null && seen.add(current); current = current.getCause()) {
            StackTraceElement[] elements = current.getStackTrace();
            int unique = enclosing == null ? elements.length : elements.length - framesInCommon(elements, enclosing);

            ObjectNode stack = stacks.addObject();
            stack.put("exc_type", current.getClass().getSimpleName());
            stack.put("exc_value", messageOf(current));
            stack.putNull("syntax_error");
            stack.put("is_cause", isCause);
            ArrayNode frames = stack.putArray("frames");
            for (int i = unique - 1; i >= 0; i--) {
                StackTraceElement element = elements[i];
                ObjectNode frame = frames.addObject();
                frame.put("filename", element.getFileName() != null ? element.getFileName() : "<unknown>");
                frame.put("lineno", element.getLineNumber());
                frame.put("name", element.getClassName() + "." + element.getMethodName());
                frame.put("line", "");
                frame.putNull("locals");
            }

            enclosing = elements;
            isCause = true;
        }
        return write(root);
    }

    /**
     * JSON list of field errors from the outermost validation failure in the cause chain,
     * or {@code null} if there is none.
     */
    String validationData(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = throwable; current != null && seen.add(current); current = current.getCause()) {
            List<FieldError> errors = fieldErrors(current);
            if (errors != null) {
                ArrayNode data = objectMapper.createArrayNode();
                for (FieldError error : errors) {
                    ObjectNode entry = data.addObject();
                    entry.put("type", error.type());
                    ArrayNode loc = entry.putArray("loc");
                    for (Object segment : error.loc()) {
                        if (segment instanceof Number n) {
                            loc.add(n.longValue());
                        } else {
                            loc.add(String.valueOf(segment));
                        }
                    }
                    entry.put("msg", error.msg());
                    entry.set("input", valueEncoder.toNode(error.input()));
                }
                return write(data);
            }
        }
        return null;
    }

    private static List<FieldError> fieldErrors(Throwable throwable) {
        if (throwable instanceof ValidationFailure failure) {
            return failure.fieldErrors();
        }
        if (throwable instanceof JsonMappingException mapping) {
            List<Object> loc = new ArrayList<>();
            for (JsonMappingException.Reference reference : mapping.getPath()) {
                if (reference.getFieldName() != null) {
                    loc.add(reference.getFieldName());
                } else if (reference.getIndex() >= 0) {
                    loc.add(reference.getIndex());
                }
            }
            String type;
            Object input = null;
            if (mapping instanceof InvalidFormatException invalid) {
                type = "invalid_format";
                input = invalid.getValue();
            } else if (mapping instanceof MismatchedInputException) {
                type = "mismatched_input";
            } else {
                type = "json_mapping";
            }
            return List.of(new FieldError(type, loc, mapping.getOriginalMessage(), input));
        }
        return null;
    }

    // Same rule printStackTrace uses for "... n more".
    private static int framesInCommon(StackTraceElement[] trace, StackTraceElement[] enclosing) {
        int m = trace.length - 1;
        int n = enclosing.length - 1;
        int common = 0;
        while (m >= 0 && n >= 0 && trace[m].equals(enclosing[n])) {
            m--;
            n--;
            common++;
        }
        return common;
    }

    private String write(Object node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new CaptureException("Cannot serialize exception data", e);
        }
    }

    private static String stackTraceText(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : "";
    }

    private static String safeMessage(Throwable throwable) {
        try {
            return messageOf(throwable);
        } catch (RuntimeException e) {
            return "<unrepresentable " + throwable.getClass().getSimpleName() + ">";
        }
    }
}
