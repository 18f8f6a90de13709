package com.xpdustry.fallible.common.render;

import com.google.common.base.Preconditions;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import com.xpdustry.fallible.common.config.FallibleConfig;
import com.xpdustry.fallible.common.config.PayloadFormat;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a payload into the text shown by failure messages and {@code toString()}.
 *
 * <p>In {@link PayloadFormat#JSON} mode, anything Gson cannot serialize falls back to {@link String#valueOf(Object)}.
 */
public final class PayloadRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PayloadRenderer.class);

    private static final Gson GSON = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeNulls()
            .registerTypeHierarchyAdapter(
                    Throwable.class,
                    (JsonSerializer<Throwable>) (throwable, type, context) -> new JsonPrimitive(throwable.toString()))
            .create();

    private final PayloadFormat format;

    public PayloadRenderer(final PayloadFormat format) {
        this.format = Preconditions.checkNotNull(format, "format");
    }

    public static PayloadRenderer global() {
        return Holder.INSTANCE;
    }

    public PayloadFormat format() {
        return this.format;
    }

    public String render(final @Nullable Object payload) {
        return switch (this.format) {
            case PLAIN -> String.valueOf(payload);
            case JSON -> this.renderJson(payload);
        };
    }

    private String renderJson(final @Nullable Object payload) {
        if (payload == null) {
            return "null";
        }
        try {
            return GSON.toJson(payload);
        } catch (final RuntimeException e) {
            LOGGER.debug("Cannot render {} as JSON, falling back to String.valueOf", payload.getClass(), e);
            return String.valueOf(payload);
        }
    }

    private static final class Holder {
        private static final PayloadRenderer INSTANCE =
                new PayloadRenderer(FallibleConfig.global().payloadFormat());
    }
}
