package com.example.cvmatch.config;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Fixed worker pool that carries the submitting thread's MDC into each task. */
public class MdcPropagatingExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcPropagatingExecutor(int threads, String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, namePrefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.delegate = Executors.newFixedThreadPool(Math.max(1, threads), factory);
    }

    @Override
    public void execute(Runnable command) {
        // captured on the submitting thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    public void shutdown() {
        delegate.shutdown();
    }
}
