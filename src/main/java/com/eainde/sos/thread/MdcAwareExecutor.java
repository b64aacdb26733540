package com.eainde.sos.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of daemon threads that carries the submitting thread's MDC
 * (the country being served) into every task.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads, String namePrefix) {
        this.delegate = Executors.newFixedThreadPool(threads, daemonThreads(namePrefix));
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling (parent) thread
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
        delegate.shutdownNow();
    }

    private static ThreadFactory daemonThreads(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
