package com.p14n.livefeed.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor}.
 *
 * <p>
 * Submitted tasks run on a cached pool so long-lived loops (the notification
 * listener, the dispatch drain) each hold their own thread without starving
 * short tasks. Keep-alive and retention timers run on a small scheduled pool.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates a new executor with a scheduled thread pool and a cached task pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createCachedExecutorService();
        }

        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("livefeed-task-%d").setDaemon(true).build());
        }

        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(size,
                                new ThreadFactoryBuilder().setNameFormat("livefeed-scheduled-%d").setDaemon(true)
                                                .build());
                // cancelled keep-alives must not pile up in the queue
                executor.setRemoveOnCancelPolicy(true);
                return executor;
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                var x = new ArrayList<Runnable>();
                x.addAll(es.shutdownNow());
                x.addAll(se.shutdownNow());
                return x;
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() throws Exception {
                shutdownNow();
        }
}
