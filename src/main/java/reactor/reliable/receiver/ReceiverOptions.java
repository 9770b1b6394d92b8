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
import java.util.function.Supplier;

import io.micrometer.core.instrument.MeterRegistry;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.NonNull;
import reactor.util.annotation.Nullable;

public interface ReceiverOptions {

    /**
     * Creates an options instance with default properties.
     * @return new instance of receiver options
     */
    @NonNull
    static ReceiverOptions create() {
        return new ImmutableReceiverOptions();
    }

    /**
     * Sets the identifier used in thread names, log messages and metric tags.
     * @return options instance with new receiver id
     */
    @NonNull
    ReceiverOptions receiverId(@NonNull String receiverId);

    /**
     * Returns the configured receiver id, or null if the receiver generates one.
     * @return receiver id
     */
    @Nullable
    String receiverId();

    /**
     * Sets the number of times storing a batch is attempted before the receiver is
     * stopped through {@link ReceiverSupervisor#fatalStop(String, Throwable)}.
     * @return options instance with new maximum store attempts
     */
    @NonNull
    ReceiverOptions maxStoreAttempts(int maxStoreAttempts);

    int maxStoreAttempts();

    /**
     * Sets the delay between two store attempts of the same batch. With the default
     * of zero, a failed store is retried immediately.
     * @return options instance with new store retry interval
     */
    @NonNull
    ReceiverOptions storeRetryInterval(@NonNull Duration storeRetryInterval);

    @NonNull
    Duration storeRetryInterval();

    /**
     * Configures the interval at which the default batcher cuts a batch from the
     * payloads received since the previous cut.
     * @return options instance with new batch interval
     */
    @NonNull
    ReceiverOptions batchInterval(@NonNull Duration batchInterval);

    @NonNull
    Duration batchInterval();

    /**
     * Configures the number of payloads after which the default batcher cuts a batch
     * before the batch interval elapses. If <code>maxBatchSize</code> is 0, batches
     * are only cut based on the batch interval.
     * @return options instance with new maximum batch size
     */
    @NonNull
    ReceiverOptions maxBatchSize(int maxBatchSize);

    int maxBatchSize();

    /**
     * Configures the number of cut batches that may wait for storage. Cutting blocks
     * when this many batches are queued.
     * @return options instance with new queue size
     */
    @NonNull
    ReceiverOptions maxQueuedBatches(int maxQueuedBatches);

    int maxQueuedBatches();

    /**
     * Configures whether deliveries of batches that could not be stored are released
     * back to the broker when the receiver stops.
     * @return options instance with new release flag
     */
    @NonNull
    ReceiverOptions releaseOnStop(boolean releaseOnStop);

    boolean releaseOnStop();

    /**
     * Sets the registry on which receiver meters are registered.
     * @return options instance with new meter registry
     */
    @NonNull
    ReceiverOptions meterRegistry(@NonNull MeterRegistry meterRegistry);

    @NonNull
    MeterRegistry meterRegistry();

    /**
     * Configures the supplier of the scheduler that drives the batch interval timer
     * of the default batcher, {@link reactor.core.scheduler.Schedulers#parallel()} by default.
     * The batcher only disposes the worker it creates on the supplied scheduler.
     * @return options instance with new timer scheduler supplier
     */
    @NonNull
    ReceiverOptions timerSchedulerSupplier(@NonNull Supplier<Scheduler> timerSchedulerSupplier);

    @NonNull
    Supplier<Scheduler> timerSchedulerSupplier();
}
