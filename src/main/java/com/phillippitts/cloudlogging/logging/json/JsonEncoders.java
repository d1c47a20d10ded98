package com.phillippitts.cloudlogging.logging.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phillippitts.cloudlogging.exception.LogEncodingException;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.status.StatusLogger;

/**
 * Factory for the encoders selectable from configuration.
 */
public final class JsonEncoders {

    private static final Logger STATUS = StatusLogger.getLogger();
    private static final ObjectMapper TREE_MAPPER = new ObjectMapper();

    /** Encoders selectable by name in application properties. */
    public enum Kind { ORG_JSON, JACKSON }

    private JsonEncoders() {}

    public static JsonEncoder defaultEncoder() {
        return new OrgJsonEncoder();
    }

    public static JsonEncoder of(Kind kind) {
        if (kind == Kind.JACKSON) {
            return new JacksonJsonEncoder();
        }
        return defaultEncoder();
    }

    /**
     * Converts an attachment (record, bean, map, collection) into maps, lists and scalars, so
     * every encoder writes the same fields and values for it.
     *
     * @param value attachment, may be {@code null}
     * @return plain tree, or {@code null} for {@code null}
     * @throws LogEncodingException if the value cannot be serialized
     */
    public static Object toPlainTree(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return TREE_MAPPER.convertValue(value, Object.class);
        } catch (IllegalArgumentException e) {
            throw new LogEncodingException("Failed to convert attachment", JacksonJsonEncoder.NAME, e);
        }
    }

    /**
     * Instantiates an encoder class through its public no-arg constructor. Used by the Log4j2
     * plugin attribute {@code encoderClass}; status-logs and falls back to the default encoder
     * when the class is missing or unusable.
     *
     * @param className fully qualified {@link JsonEncoder} implementation, may be blank
     * @return encoder instance, never {@code null}
     */
    public static JsonEncoder fromClassName(String className) {
        if (className == null || className.isBlank()) {
            return defaultEncoder();
        }
        try {
            Class<?> type = Class.forName(className.trim(), true, JsonEncoders.class.getClassLoader());
            if (!JsonEncoder.class.isAssignableFrom(type)) {
                STATUS.warn("{} does not implement {}; using the default encoder",
                        className, JsonEncoder.class.getName());
                return defaultEncoder();
            }
            return (JsonEncoder) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            STATUS.warn("Cannot instantiate JSON encoder {}; using the default encoder", className, e);
            return defaultEncoder();
        }
    }
}
