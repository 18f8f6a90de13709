package com.xpdustry.fallible.common.config;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class FallibleConfigTest {

    @Test
    void test_parse_empty() {
        Assertions.assertEquals(FallibleConfig.DEFAULT, FallibleConfig.parse(new Properties()));
    }

    @Test
    void test_parse_values() {
        final var properties = new Properties();
        properties.setProperty(FallibleConfig.PAYLOAD_FORMAT_KEY, " plain ");
        properties.setProperty(FallibleConfig.DISPATCH_KEY, "Serial");
        properties.setProperty(FallibleConfig.THREAD_NAME_KEY, "worker-%d");
        Assertions.assertEquals(
                new FallibleConfig(PayloadFormat.PLAIN, DispatchMode.SERIAL, "worker-%d"),
                FallibleConfig.parse(properties));
    }

    @Test
    void test_parse_blank_values_use_defaults() {
        final var properties = new Properties();
        properties.setProperty(FallibleConfig.PAYLOAD_FORMAT_KEY, "");
        properties.setProperty(FallibleConfig.THREAD_NAME_KEY, "   ");
        Assertions.assertEquals(FallibleConfig.DEFAULT, FallibleConfig.parse(properties));
    }

    @Test
    void test_parse_invalid_value() {
        final var properties = new Properties();
        properties.setProperty(FallibleConfig.DISPATCH_KEY, "parallel");
        assertThatThrownBy(() -> FallibleConfig.parse(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid value 'parallel' for fallible.async.dispatch, expected one of [DIRECT, SERIAL]");
    }

    @Test
    void test_blank_thread_name_rejected() {
        Assertions.assertThrows(
                IllegalArgumentException.class, () -> new FallibleConfig(PayloadFormat.JSON, DispatchMode.DIRECT, " "));
    }

    @Test
    void test_load_reads_classpath_resource() {
        final var config = FallibleConfig.load();
        Assertions.assertEquals("fallible-test-async-%d", config.threadName());
        Assertions.assertEquals(PayloadFormat.JSON, config.payloadFormat());
        Assertions.assertEquals(DispatchMode.DIRECT, config.dispatchMode());
    }

    @Test
    void test_load_system_properties_override_resource() {
        System.setProperty(FallibleConfig.THREAD_NAME_KEY, "from-system-%d");
        try {
            Assertions.assertEquals("from-system-%d", FallibleConfig.load().threadName());
        } finally {
            System.clearProperty(FallibleConfig.THREAD_NAME_KEY);
        }
    }
}
