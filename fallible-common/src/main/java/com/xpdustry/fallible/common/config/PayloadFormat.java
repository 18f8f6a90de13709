package com.xpdustry.fallible.common.config;

/** How payloads are turned into text inside failure messages and {@code toString()}. */
public enum PayloadFormat {
    JSON,
    PLAIN
}
