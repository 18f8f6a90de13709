package com.xpdustry.fallible.common.async;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.xpdustry.fallible.common.config.FallibleConfig;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Executors continuations of {@link AsyncResult} run on. */
public final class AsyncDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(AsyncDispatcher.class);
    private static final ThreadLocal<Boolean> DISPATCHER_THREAD = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private AsyncDispatcher() {}

    /** The executor selected by {@link FallibleConfig#global()}. */
    public static Executor global() {
        return Holder.INSTANCE;
    }

    public static Executor create(final FallibleConfig config) {
        return switch (config.dispatchMode()) {
            case DIRECT -> MoreExecutors.directExecutor();
            case SERIAL -> serial(config.threadName());
        };
    }

    /**
     * A single daemon thread running continuations one at a time, in the order they were scheduled.
     *
     * @param nameFormat a {@link String#format(String, Object...)} pattern receiving the thread index
     */
    public static ExecutorService serial(final String nameFormat) {
        Preconditions.checkNotNull(nameFormat, "nameFormat");
        return Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat(nameFormat)
                .setDaemon(true)
                .setThreadFactory(runnable -> new Thread(() -> {
                    DISPATCHER_THREAD.set(Boolean.TRUE);
                    runnable.run();
                }))
                .setUncaughtExceptionHandler(
                        (thread, throwable) -> LOGGER.error("Uncaught exception in {}", thread.getName(), throwable))
                .build());
    }

    /** Whether the current thread belongs to a {@link #serial(String)} dispatcher. */
    public static boolean isDispatcherThread() {
        return DISPATCHER_THREAD.get();
    }

    private static final class Holder {
        private static final Executor INSTANCE = create(FallibleConfig.global());
    }
}
