package com.phillippitts.cloudlogging.logging;

import com.phillippitts.cloudlogging.exception.InvalidContextTokenException;

import java.util.Optional;

/**
 * Binds the active {@link RequestLogs} to the thread handling the request.
 *
 * <p>Each thread has its own binding, so concurrent requests never see each other's logs.
 * Servlet containers reuse threads, so every {@link #set(RequestLogs)} must be paired with
 * {@link #reset(ContextToken)} or {@link #clear()} on the same thread.
 */
public final class RequestContextStore {

    private final ThreadLocal<RequestLogs> active = new ThreadLocal<>();

    /**
     * Makes {@code requestLogs} the active binding of the calling thread.
     *
     * @param requestLogs logs to bind; {@code null} unbinds
     * @return token restoring the previous binding
     */
    public ContextToken set(RequestLogs requestLogs) {
        ContextToken token = new ContextToken(active.get(), Thread.currentThread().getId());
        bind(requestLogs);
        return token;
    }

    public Optional<RequestLogs> current() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Restores the binding recorded in {@code token}.
     *
     * @throws InvalidContextTokenException if the token was created on another thread
     */
    public void reset(ContextToken token) {
        long caller = Thread.currentThread().getId();
        if (token.threadId() != caller) {
            throw new InvalidContextTokenException(token.threadId(), caller);
        }
        bind(token.previous());
    }

    public void clear() {
        active.remove();
    }

    private void bind(RequestLogs requestLogs) {
        if (requestLogs == null) {
            active.remove();
        } else {
            active.set(requestLogs);
        }
    }
}
