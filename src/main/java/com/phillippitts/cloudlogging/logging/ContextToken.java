package com.phillippitts.cloudlogging.logging;

/**
 * Handle returned by {@link RequestContextStore#set(RequestLogs)}. Holds the binding that was
 * active before, so {@link RequestContextStore#reset(ContextToken)} can put it back.
 *
 * @param previous binding active before the set, or {@code null}
 * @param threadId id of the thread that created the token
 */
public record ContextToken(RequestLogs previous, long threadId) {}
