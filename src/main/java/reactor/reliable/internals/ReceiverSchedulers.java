/*
 * Copyright (c) 2024 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package reactor.reliable.internals;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Factory methods for the threads owned by receivers, batchers and protocol clients.
 */
public final class ReceiverSchedulers {

    static final Logger log = Loggers.getLogger(ReceiverSchedulers.class);

    static final String PREFIX = "reliable-";

    static final AtomicLong COUNTER_REFERENCE = new AtomicLong();

    private ReceiverSchedulers() {
    }

    static void defaultUncaughtException(Thread t, Throwable e) {
        log.error("Thread " + t.getName() + " failed with an uncaught exception", e);
    }

    /**
     * Creates a single-threaded scheduler whose thread is recognized by
     * {@link #isCurrentThreadFromEventLoop()}.
     * @param name name of the event loop, used as thread name prefix
     * @return new event loop scheduler
     */
    public static Scheduler newEventLoop(String name) {
        return Schedulers.newSingle(new EventLoopThreadFactory(name));
    }

    public static boolean isCurrentThreadFromEventLoop() {
        return Thread.currentThread() instanceof EventLoopThreadFactory.EventLoopThread;
    }

    /**
     * Creates a non-daemon worker thread that logs uncaught exceptions. The thread is not started.
     */
    public static Thread newWorker(String name, Runnable runnable) {
        Thread t = new Thread(runnable, PREFIX + name + "-" + COUNTER_REFERENCE.incrementAndGet());
        t.setUncaughtExceptionHandler(ReceiverSchedulers::defaultUncaughtException);
        return t;
    }

    static final class EventLoopThreadFactory implements ThreadFactory {

        private final String name;

        EventLoopThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread t = new EventLoopThread(runnable, PREFIX + name + "-" + COUNTER_REFERENCE.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler(ReceiverSchedulers::defaultUncaughtException);
            return t;
        }

        static final class EventLoopThread extends Thread {

            EventLoopThread(Runnable target, String name) {
                super(target, name);
            }
        }
    }
}
