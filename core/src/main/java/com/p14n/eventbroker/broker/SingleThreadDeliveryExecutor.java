package com.p14n.eventbroker.broker;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static java.lang.String.format;

/**
 * Default {@link DeliveryExecutor} backed by a single named worker thread.
 *
 * <p>
 * A fresh instance is created each time a broker opens. Closing drains the
 * queue without a timeout: a slow subscriber delays the close, it is never
 * abandoned. An interrupt received while waiting is restored once the worker
 * has stopped. Closing from the worker thread itself stops intake without
 * waiting.
 * </p>
 */
public class SingleThreadDeliveryExecutor implements DeliveryExecutor {

        private final ExecutorService es;
        private volatile Thread worker;

        /**
         * Creates an executor whose thread is named after the given format.
         *
         * @param nameFormat thread name format taking one numeric argument
         */
        public SingleThreadDeliveryExecutor(String nameFormat) {
                this.es = createSingleThreadExecutorService(nameFormat);
        }

        protected ThreadFactory createNamedFactory(String nameFormat, ThreadFactory backingFactory) {
                AtomicLong count = (nameFormat != null) ? new AtomicLong(0) : null;
                return runnable -> {
                        Thread thread = backingFactory.newThread(runnable);
                        if (nameFormat != null) {
                                thread.setName(format(nameFormat, count.getAndIncrement()));
                        }
                        worker = thread;
                        return thread;
                };
        }

        /**
         * Creates the single worker thread pool.
         *
         * @param nameFormat thread name format
         * @return a single thread executor service
         */
        protected ExecutorService createSingleThreadExecutorService(String nameFormat) {
                return Executors.newSingleThreadExecutor(
                                createNamedFactory(nameFormat, Executors.defaultThreadFactory()));
        }

        @Override
        public void execute(Runnable task) {
                es.execute(task);
        }

        @Override
        public boolean isWorkerThread() {
                return Thread.currentThread() == worker;
        }

        @Override
        public void close() {
                es.shutdown();
                if (isWorkerThread()) {
                        // closed from a delivery; the remaining queue still drains after it returns
                        return;
                }
                boolean interrupted = false;
                while (true) {
                        try {
                                if (es.awaitTermination(1, TimeUnit.SECONDS)) {
                                        break;
                                }
                        } catch (InterruptedException e) {
                                interrupted = true;
                        }
                }
                if (interrupted) {
                        Thread.currentThread().interrupt();
                }
        }
}
