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

package reactor.reliable.batcher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.reliable.BatchId;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.internals.ReceiverSchedulers;
import reactor.reliable.receiver.ReceiverOptions;

/**
 * Batcher that cuts a batch every {@link ReceiverOptions#batchInterval()} or as soon as
 * {@link ReceiverOptions#maxBatchSize()} payloads are buffered. Cut batches are queued and
 * handed to {@link BatchListener#onBatchReady(BatchId, List)} in queue order by a single
 * worker thread. A timer cut racing with a size cut may be queued after it.
 */
public class DefaultBatcher<M> implements Batcher<M> {

    private static final Logger log = LoggerFactory.getLogger(DefaultBatcher.class);

    private static final AtomicInteger STREAM_IDS = new AtomicInteger();

    private static final long POLL_TIMEOUT_MILLIS = 10;

    enum State { CREATED, ACTIVE, STOPPED_ADDING, STOPPED_CUTTING, STOPPED }

    private final BatchListener<M> listener;

    private final Duration batchInterval;

    private final int maxBatchSize;

    private final Scheduler timerScheduler;

    private final BlockingQueue<Batch<M>> batchesForStore;

    private final Thread worker;

    private final int streamId = STREAM_IDS.getAndIncrement();

    private final AtomicLong sequence = new AtomicLong();

    private volatile State state = State.CREATED;

    private Scheduler timerWorker;

    private Disposable timer;

    private volatile boolean discardQueued;

    private List<M> currentBuffer = new ArrayList<>();

    public DefaultBatcher(BatchListener<M> listener, Duration batchInterval, int maxBatchSize,
                          int maxQueuedBatches, Scheduler timerScheduler) {
        this.listener = listener;
        this.batchInterval = batchInterval;
        this.maxBatchSize = maxBatchSize;
        this.timerScheduler = timerScheduler;
        this.batchesForStore = new ArrayBlockingQueue<>(maxQueuedBatches);
        this.worker = ReceiverSchedulers.newWorker("batcher-" + streamId, this::keepStoringBatches);
    }

    /**
     * Returns a factory creating batchers configured from {@code options}.
     */
    public static BatcherFactory factory(ReceiverOptions options) {
        return new BatcherFactory() {
            @Override
            public <M> Batcher<M> create(BatchListener<M> listener) {
                return new DefaultBatcher<>(listener, options.batchInterval(), options.maxBatchSize(),
                    options.maxQueuedBatches(), options.timerSchedulerSupplier().get());
            }
        };
    }

    @Override
    public synchronized void start() {
        if (state != State.CREATED)
            throw new IllegalStateException("Cannot start batcher in state " + state);
        state = State.ACTIVE;
        long intervalMillis = batchInterval.toMillis();
        // disposing the single-worker view leaves the supplied scheduler running
        timerWorker = Schedulers.single(timerScheduler);
        timer = timerWorker.schedulePeriodically(this::cutOnTimer, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        worker.start();
        log.debug("Started batcher {} with interval {}", streamId, batchInterval);
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (state != State.ACTIVE)
                return;
            state = State.STOPPED_ADDING;
        }
        log.debug("Stopping batcher {}", streamId);
        timer.dispose();
        timerWorker.dispose();

        if (Thread.currentThread() == worker) {
            stopFromWorker();
            return;
        }
        // remaining payloads form the last batch
        cutAndEnqueue();
        state = State.STOPPED_CUTTING;

        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for batcher {} to drain", streamId);
        }
        state = State.STOPPED;
        log.debug("Stopped batcher {}", streamId);
    }

    /**
     * The worker cannot drain the queue while it is handing over a batch: remaining
     * payloads are still cut, so that their deliveries are known, but no queued batch
     * is handed over any more.
     */
    private void stopFromWorker() {
        List<Batch<M>> discarded = new ArrayList<>();
        synchronized (this) {
            Batch<M> last = cut();
            if (last != null)
                discarded.add(last);
        }
        discardQueued = true;
        batchesForStore.drainTo(discarded);
        state = State.STOPPED;
        if (!discarded.isEmpty())
            log.warn("Batcher {} stopped while handing over, {} cut batch(es) not handed over", streamId, discarded.size());
        log.debug("Stopped batcher {}", streamId);
    }

    @Override
    public boolean isStopped() {
        return state == State.STOPPED;
    }

    @Override
    public void append(M payload, ReceiptHandle handle) {
        Batch<M> full = null;
        synchronized (this) {
            if (state != State.ACTIVE)
                throw new IllegalStateException("Cannot add data as batcher " + streamId + " is " + state);
            currentBuffer.add(payload);
            listener.onDataAdded(payload, handle);
            if (maxBatchSize > 0 && currentBuffer.size() >= maxBatchSize)
                full = cut();
        }
        if (full != null)
            enqueue(full);
    }

    private void cutOnTimer() {
        try {
            cutAndEnqueue();
        } catch (Exception e) {
            listener.onError("Error in batch timer of batcher " + streamId, e);
        }
    }

    private void cutAndEnqueue() {
        Batch<M> batch;
        synchronized (this) {
            batch = cut();
        }
        if (batch != null)
            enqueue(batch);
    }

    // must hold the lock
    private Batch<M> cut() {
        if (currentBuffer.isEmpty())
            return null;
        BatchId batchId = new BatchId(streamId, sequence.incrementAndGet());
        listener.onBatchCut(batchId);
        Batch<M> batch = new Batch<>(batchId, currentBuffer);
        currentBuffer = new ArrayList<>();
        return batch;
    }

    private void enqueue(Batch<M> batch) {
        try {
            batchesForStore.put(batch);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            listener.onError("Interrupted while queueing " + batch.batchId, e);
        }
    }

    private void keepStoringBatches() {
        try {
            while (state == State.ACTIVE || state == State.STOPPED_ADDING) {
                Batch<M> batch = batchesForStore.poll(POLL_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
                if (batch != null)
                    store(batch);
            }
            Batch<M> batch;
            while ((batch = batchesForStore.poll()) != null) {
                if (discardQueued)
                    log.debug("Batcher {} discards {}", streamId, batch.batchId);
                else
                    store(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Batcher {} worker interrupted", streamId);
        }
    }

    private void store(Batch<M> batch) {
        try {
            listener.onBatchReady(batch.batchId, batch.payloads);
        } catch (Throwable t) {
            listener.onError("Error while handing over " + batch.batchId, t);
        }
    }

    static final class Batch<M> {
        final BatchId batchId;
        final List<M> payloads;

        Batch(BatchId batchId, List<M> payloads) {
            this.batchId = batchId;
            this.payloads = payloads;
        }
    }
}
