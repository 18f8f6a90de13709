package com.xpdustry.fallible.common.async;

/**
 * Thrown by {@link AsyncResult#await()} when the {@code onFailure} function given to a combinator threw while
 * converting a captured failure. The cause is what the function threw, the captured failure is suppressed.
 */
@SuppressWarnings("serial")
public final class FailureConversionException extends RuntimeException {

    public FailureConversionException(final Throwable captured, final Throwable cause) {
        super("The failure conversion of " + captured + " threw " + cause, cause);
        this.addSuppressed(captured);
    }
}
