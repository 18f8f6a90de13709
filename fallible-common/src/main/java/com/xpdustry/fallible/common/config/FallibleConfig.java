package com.xpdustry.fallible.common.config;

import com.google.common.base.Enums;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process wide settings of the library.
 *
 * <p>The global instance is resolved once from the defaults, then {@value #RESOURCE} on the classpath, then the JVM
 * system properties, each source overriding the previous one.
 */
public record FallibleConfig(PayloadFormat payloadFormat, DispatchMode dispatchMode, String threadName) {

    public static final String RESOURCE = "/fallible.properties";
    public static final String PAYLOAD_FORMAT_KEY = "fallible.payload-format";
    public static final String DISPATCH_KEY = "fallible.async.dispatch";
    public static final String THREAD_NAME_KEY = "fallible.async.thread-name";

    public static final FallibleConfig DEFAULT =
            new FallibleConfig(PayloadFormat.JSON, DispatchMode.DIRECT, "fallible-async-%d");

    private static final Logger LOGGER = LoggerFactory.getLogger(FallibleConfig.class);
    private static final List<String> KEYS = List.of(PAYLOAD_FORMAT_KEY, DISPATCH_KEY, THREAD_NAME_KEY);

    public FallibleConfig {
        Preconditions.checkNotNull(payloadFormat, "payloadFormat");
        Preconditions.checkNotNull(dispatchMode, "dispatchMode");
        Preconditions.checkNotNull(threadName, "threadName");
        Preconditions.checkArgument(!threadName.isBlank(), "The async thread name cannot be blank");
    }

    public static FallibleConfig global() {
        return Holder.INSTANCE;
    }

    public static FallibleConfig load() {
        final var properties = new Properties();
        try (final var stream = FallibleConfig.class.getResourceAsStream(RESOURCE)) {
            if (stream != null) {
                try (final var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
                LOGGER.debug("Loaded configuration from {}", RESOURCE);
            }
        } catch (final IOException e) {
            LOGGER.warn("Failed to read {}, using defaults", RESOURCE, e);
        }
        for (final var key : KEYS) {
            final var value = System.getProperty(key);
            if (value != null) {
                properties.setProperty(key, value);
            }
        }
        return parse(properties);
    }

    public static FallibleConfig parse(final Properties properties) {
        final var threadName = properties.getProperty(THREAD_NAME_KEY);
        return new FallibleConfig(
                parseEnum(properties, PAYLOAD_FORMAT_KEY, PayloadFormat.class, DEFAULT.payloadFormat()),
                parseEnum(properties, DISPATCH_KEY, DispatchMode.class, DEFAULT.dispatchMode()),
                threadName == null || threadName.isBlank() ? DEFAULT.threadName() : threadName.trim());
    }

    private static <E extends Enum<E>> E parseEnum(
            final Properties properties, final String key, final Class<E> type, final E fallback) {
        final var raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        final var value = Enums.getIfPresent(type, raw.trim().toUpperCase(Locale.ROOT));
        if (!value.isPresent()) {
            throw new IllegalArgumentException("Invalid value '%s' for %s, expected one of %s"
                    .formatted(raw, key, Arrays.toString(type.getEnumConstants())));
        }
        return value.get();
    }

    private static final class Holder {
        private static final FallibleConfig INSTANCE = load();
    }
}
