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

package reactor.reliable.receiver;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

class ImmutableReceiverOptions implements ReceiverOptions {

    private static final int DEFAULT_MAX_STORE_ATTEMPTS = 3;
    private static final Duration DEFAULT_BATCH_INTERVAL = Duration.ofMillis(200);
    private static final int DEFAULT_MAX_QUEUED_BATCHES = 10;

    @Nullable
    private final String receiverId;
    private final int maxStoreAttempts;
    private final Duration storeRetryInterval;
    private final Duration batchInterval;
    private final int maxBatchSize;
    private final int maxQueuedBatches;
    private final boolean releaseOnStop;
    private final MeterRegistry meterRegistry;
    private final Supplier<Scheduler> timerSchedulerSupplier;

    ImmutableReceiverOptions() {
        receiverId = null;
        maxStoreAttempts = DEFAULT_MAX_STORE_ATTEMPTS;
        storeRetryInterval = Duration.ZERO;
        batchInterval = DEFAULT_BATCH_INTERVAL;
        maxBatchSize = 0;
        maxQueuedBatches = DEFAULT_MAX_QUEUED_BATCHES;
        releaseOnStop = true;
        meterRegistry = Metrics.globalRegistry;
        timerSchedulerSupplier = Schedulers::parallel;
    }

    ImmutableReceiverOptions(
        @Nullable String receiverId,
        int maxStoreAttempts,
        Duration storeRetryInterval,
        Duration batchInterval,
        int maxBatchSize,
        int maxQueuedBatches,
        boolean releaseOnStop,
        MeterRegistry meterRegistry,
        Supplier<Scheduler> timerSchedulerSupplier
    ) {
        this.receiverId = receiverId;
        this.maxStoreAttempts = maxStoreAttempts;
        this.storeRetryInterval = storeRetryInterval;
        this.batchInterval = batchInterval;
        this.maxBatchSize = maxBatchSize;
        this.maxQueuedBatches = maxQueuedBatches;
        this.releaseOnStop = releaseOnStop;
        this.meterRegistry = meterRegistry;
        this.timerSchedulerSupplier = timerSchedulerSupplier;
    }

    @Override
    @Nullable
    public String receiverId() {
        return receiverId;
    }

    @Override
    public ReceiverOptions receiverId(String receiverId) {
        return new ImmutableReceiverOptions(
            Objects.requireNonNull(receiverId),
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public int maxStoreAttempts() {
        return maxStoreAttempts;
    }

    @Override
    public ReceiverOptions maxStoreAttempts(int maxStoreAttempts) {
        if (maxStoreAttempts < 1)
            throw new IllegalArgumentException("the number of store attempts must be >= 1");
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public Duration storeRetryInterval() {
        return storeRetryInterval;
    }

    @Override
    public ReceiverOptions storeRetryInterval(Duration storeRetryInterval) {
        if (Objects.requireNonNull(storeRetryInterval).isNegative())
            throw new IllegalArgumentException("store retry interval must not be negative");
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public Duration batchInterval() {
        return batchInterval;
    }

    @Override
    public ReceiverOptions batchInterval(Duration batchInterval) {
        Objects.requireNonNull(batchInterval);
        if (batchInterval.isNegative() || batchInterval.isZero())
            throw new IllegalArgumentException("batch interval must be positive");
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public int maxBatchSize() {
        return maxBatchSize;
    }

    @Override
    public ReceiverOptions maxBatchSize(int maxBatchSize) {
        if (maxBatchSize < 0)
            throw new IllegalArgumentException("the maximum batch size must be >= 0");
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public int maxQueuedBatches() {
        return maxQueuedBatches;
    }

    @Override
    public ReceiverOptions maxQueuedBatches(int maxQueuedBatches) {
        if (maxQueuedBatches < 1)
            throw new IllegalArgumentException("the number of queued batches must be >= 1");
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public boolean releaseOnStop() {
        return releaseOnStop;
    }

    @Override
    public ReceiverOptions releaseOnStop(boolean releaseOnStop) {
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    @Override
    public ReceiverOptions meterRegistry(MeterRegistry meterRegistry) {
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            Objects.requireNonNull(meterRegistry),
            timerSchedulerSupplier
        );
    }

    @Override
    public Supplier<Scheduler> timerSchedulerSupplier() {
        return timerSchedulerSupplier;
    }

    @Override
    public ReceiverOptions timerSchedulerSupplier(Supplier<Scheduler> timerSchedulerSupplier) {
        return new ImmutableReceiverOptions(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            Objects.requireNonNull(timerSchedulerSupplier)
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImmutableReceiverOptions that = (ImmutableReceiverOptions) o;
        return Objects.equals(receiverId, that.receiverId)
                && maxStoreAttempts == that.maxStoreAttempts
                && Objects.equals(storeRetryInterval, that.storeRetryInterval)
                && Objects.equals(batchInterval, that.batchInterval)
                && maxBatchSize == that.maxBatchSize
                && maxQueuedBatches == that.maxQueuedBatches
                && releaseOnStop == that.releaseOnStop
                && Objects.equals(meterRegistry, that.meterRegistry)
                && Objects.equals(timerSchedulerSupplier, that.timerSchedulerSupplier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            receiverId,
            maxStoreAttempts,
            storeRetryInterval,
            batchInterval,
            maxBatchSize,
            maxQueuedBatches,
            releaseOnStop,
            meterRegistry,
            timerSchedulerSupplier
        );
    }

    @Override
    public String toString() {
        return "ImmutableReceiverOptions{" +
            "receiverId=" + receiverId +
            ", maxStoreAttempts=" + maxStoreAttempts +
            ", storeRetryInterval=" + storeRetryInterval +
            ", batchInterval=" + batchInterval +
            ", maxBatchSize=" + maxBatchSize +
            ", maxQueuedBatches=" + maxQueuedBatches +
            ", releaseOnStop=" + releaseOnStop +
            '}';
    }
}
