package com.logfire.sdk.encoding;

import com.logfire.sdk.core.model.Attributes;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link AttributeEncoder#encode}.
 *
 * @param template   the message template as supplied
 * @param message    the rendered message
 * @param attributes user attributes followed by {@code logfire.null_args} and {@code logfire.tags}
 * @param nullArgs   names of arguments whose value was null, in call order
 */
public record EncodedMessage(String template, String message, Attributes attributes, List<String> nullArgs) {

    public EncodedMessage {
        Objects.requireNonNull(template, "template is required");
        Objects.requireNonNull(message, "message is required");
        attributes = attributes != null ? attributes : Attributes.empty();
        nullArgs = nullArgs != null ? List.copyOf(nullArgs) : List.of();
    }
}
