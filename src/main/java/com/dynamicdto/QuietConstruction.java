package com.dynamicdto;

import java.util.function.Supplier;

/**
 * Thread-confined scope in which newly constructed Dtos start in silent mode.
 *
 * Lets a caller run a Dto's own {@code (Map)} constructor while policy
 * failures during its fill are dropped instead of thrown. The scope covers
 * every Dto constructed on the current thread until {@link #run} returns.
 */
public final class QuietConstruction {

    private static final ThreadLocal<Boolean> ACTIVE = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private QuietConstruction() {
        // Utility class
    }

    public static <T> T run(Supplier<T> construction) {
        boolean outer = ACTIVE.get();
        ACTIVE.set(Boolean.TRUE);
        try {
            return construction.get();
        } finally {
            if (outer) {
                ACTIVE.set(Boolean.TRUE);
            } else {
                ACTIVE.remove();
            }
        }
    }

    public static boolean isActive() {
        return ACTIVE.get();
    }
}
