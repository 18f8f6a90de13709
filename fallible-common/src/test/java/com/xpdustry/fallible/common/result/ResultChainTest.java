package com.xpdustry.fallible.common.result;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ResultChainTest {

    private static final String INVALID_CHAR_SEQUENCE = "InvalidCharSequenceError";

    @Test
    void test_chain_ok() {
        final var result = validateStringType("banana")
                .andThen(ResultChainTest::capitalize)
                .andThen(s -> validateEquals(s, "Banana"));
        Assertions.assertEquals(Result.ok("Banana"), result);
    }

    @Test
    void test_chain_err() {
        final var result = validateStringType("pineapple")
                .andThen(ResultChainTest::capitalize)
                .andThen(s -> validateEquals(s, "Banana"));
        Assertions.assertEquals(
                Result.err(new ErrorMessage(
                        INVALID_CHAR_SEQUENCE, "Was expecting the char sequence: 'Banana' but got: 'Pineapple'")),
                result);
    }

    @Test
    void test_chain_invalid_type() {
        final var calls = new AtomicInteger();
        final var result = validateStringType(42).andThen(s -> {
            calls.incrementAndGet();
            return capitalize(s);
        });
        Assertions.assertTrue(result.isErrAnd(e -> e.error().equals("InvalidTypeError")));
        Assertions.assertEquals(0, calls.get());
    }

    @Test
    void test_and_then_short_circuits_every_step() {
        final var calls = new AtomicInteger();
        Result<Integer, String> result = Result.ok(0);
        for (int i = 0; i < 5; i++) {
            final int step = i;
            result = result.andThen(x -> {
                calls.incrementAndGet();
                return step == 1 ? Result.err("failed at " + step) : Result.ok(x + 1);
            });
        }
        Assertions.assertEquals(Result.err("failed at 1"), result);
        Assertions.assertEquals(2, calls.get());
    }

    @Test
    void test_or_else_recovers_from_err() {
        final var result = validateStringType("pineapple")
                .andThen(s -> validateEquals(s, "banana"))
                .orElse(e -> Result.<String, String>ok("fallback"));
        Assertions.assertEquals(Result.ok("fallback"), result);
    }

    private static Result<String, ErrorMessage> validateStringType(final Object input) {
        if (input instanceof String string) {
            return Result.ok(string);
        }
        return Result.err(new ErrorMessage("InvalidTypeError", "Was expecting a string but got: " + input));
    }

    private static Result<String, ErrorMessage> capitalize(final String input) {
        if (input.isEmpty()) {
            return Result.err(new ErrorMessage(INVALID_CHAR_SEQUENCE, "Cannot capitalize an empty string"));
        }
        return Result.ok(Character.toUpperCase(input.charAt(0)) + input.substring(1));
    }

    private static Result<String, ErrorMessage> validateEquals(final String actual, final String expected) {
        if (actual.equals(expected)) {
            return Result.ok(actual);
        }
        return Result.err(new ErrorMessage(
                INVALID_CHAR_SEQUENCE,
                String.format("Was expecting the char sequence: '%s' but got: '%s'", expected, actual)));
    }

    record ErrorMessage(String error, String detail) {}
}
