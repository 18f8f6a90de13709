package com.xpdustry.fallible.common.functional;

@FunctionalInterface
public interface ThrowingSupplier<O, T extends Throwable> {

    O get() throws T;
}
