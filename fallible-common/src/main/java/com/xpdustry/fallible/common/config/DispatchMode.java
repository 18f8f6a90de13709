package com.xpdustry.fallible.common.config;

/** Where asynchronous continuations run once the previous stage settles. */
public enum DispatchMode {
    /** On the thread that settled the previous stage. */
    DIRECT,
    /** On a single shared daemon thread, one continuation at a time, in registration order. */
    SERIAL
}
