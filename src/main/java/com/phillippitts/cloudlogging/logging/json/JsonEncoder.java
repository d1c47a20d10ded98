package com.phillippitts.cloudlogging.logging.json;

import com.phillippitts.cloudlogging.exception.LogEncodingException;

import java.util.Map;

/**
 * Serializes one log entry to a single line of JSON.
 *
 * <p>Implementations must not add, drop or rename fields; only the byte form may differ
 * between encoders.
 */
@FunctionalInterface
public interface JsonEncoder {

    /**
     * @param entry field name to value; values are strings, numbers, booleans or the caller attachment
     * @return JSON text without a trailing line separator
     * @throws LogEncodingException if a value cannot be serialized
     */
    String encode(Map<String, ?> entry);
}
