package com.baskettecase.credvault.audit;

import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Request origin of the vault call running on the current thread.
 *
 * Set by the layer that receives a request (see {@link #callWith}); read by {@link AuditLog}
 * to fill the origin fields of each entry. Calls made outside {@code callWith} are
 * recorded with an unknown origin.
 */
@Component
public class AuditContext {

    private final ThreadLocal<RequestOrigin> current = new ThreadLocal<>();

    /**
     * Run an action with the given origin bound to this thread, restoring the previous one after
     */
    public <T> T callWith(RequestOrigin origin, Supplier<T> action) {
        RequestOrigin previous = current.get();
        current.set(origin != null ? origin : RequestOrigin.UNKNOWN);
        try {
            return action.get();
        } finally {
            if (previous != null) {
                current.set(previous);
            } else {
                current.remove();
            }
        }
    }

    public RequestOrigin current() {
        RequestOrigin origin = current.get();
        return origin != null ? origin : RequestOrigin.UNKNOWN;
    }
}
