package com.xpdustry.fallible.common.result;

import com.xpdustry.fallible.common.render.PayloadRenderer;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when an extraction operation ({@code unwrap}, {@code unwrapErr}, {@code expect}, {@code expectErr}) is called
 * on the wrong variant. This signals a programming error, callers that expect either variant should branch on
 * {@link Result#isOk()} or use the {@code unwrapOr} family.
 */
@SuppressWarnings("serial")
public final class ResultUnwrapException extends RuntimeException {

    private final transient @Nullable Object payload;

    public ResultUnwrapException(final String context, final @Nullable Object payload) {
        super(context + ": " + PayloadRenderer.global().render(payload));
        this.payload = payload;
    }

    /** The payload of the variant that was actually present. */
    public @Nullable Object payload() {
        return this.payload;
    }
}
