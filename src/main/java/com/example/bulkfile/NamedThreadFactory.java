package com.example.bulkfile;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

final class NamedThreadFactory implements ThreadFactory {
    private final String namePrefix;
    private final boolean daemon;
    private final AtomicInteger counter = new AtomicInteger();

    NamedThreadFactory(String namePrefix, boolean daemon) {
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setDaemon(daemon);
        thread.setName(namePrefix + "-" + counter.incrementAndGet());
        return thread;
    }
}
