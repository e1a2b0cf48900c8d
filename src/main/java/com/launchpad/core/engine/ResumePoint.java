package com.launchpad.core.engine;

import com.launchpad.core.registry.HandlerSpec;

import java.util.Objects;

/**
 * Where an in-progress launch picks up.
 *
 * @param kind    what the run does next
 * @param handler the next handler to execute, only for {@link Kind#NEXT}
 */
public record ResumePoint(Kind kind, HandlerSpec handler) {

    public enum Kind {
        /** Execute {@code handler}. */
        NEXT,
        /** Every handler completed but the launch was never marked completed. */
        FINALIZE,
        /** The last result failed but the launch was never marked failed. */
        ABORT
    }

    public ResumePoint {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.NEXT) != (handler != null)) {
            throw new IllegalArgumentException("Only NEXT carries a handler");
        }
    }

    public static ResumePoint next(HandlerSpec handler) {
        return new ResumePoint(Kind.NEXT, handler);
    }

    public static ResumePoint finalizeRun() {
        return new ResumePoint(Kind.FINALIZE, null);
    }

    public static ResumePoint abort() {
        return new ResumePoint(Kind.ABORT, null);
    }
}
