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

package reactor.reliable.receiver.internals;

import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

class ReceiverMetrics {

    static final String PREFIX = "reliable.receiver.";

    static final String RECEIVER_ID_TAG = "receiver.id";

    static final String RECEIVER_INSTANCE_TAG = "receiver.instance";

    private static final AtomicLong INSTANCE_IDS = new AtomicLong();

    private final MeterRegistry meterRegistry;

    private final Tags tags;

    final Counter batchesStored;

    final Counter batchesFailed;

    final Counter storeAttempts;

    final Counter recordsDropped;

    final Counter handlesSettled;

    final Counter handlesRemotelySettled;

    private Gauge pendingBatches;

    ReceiverMetrics(MeterRegistry meterRegistry, String receiverId) {
        this.meterRegistry = meterRegistry;
        this.tags = Tags.of(RECEIVER_ID_TAG, receiverId);
        batchesStored = counter("batches.stored", "Batches stored and scheduled for acknowledgment");
        batchesFailed = counter("batches.failed", "Batches abandoned after exhausting store attempts");
        storeAttempts = counter("store.attempts", "Invocations of the sink");
        recordsDropped = counter("records.dropped", "Messages the converter did not produce a value for");
        handlesSettled = counter("handles.settled", "Deliveries acknowledged after their batch was stored");
        handlesRemotelySettled = counter("handles.remotely.settled", "Deliveries already settled by the broker");
    }

    /**
     * Registers the pending batch gauge of one receiver. Receivers sharing a receiver id
     * get a gauge each, told apart by the {@value #RECEIVER_INSTANCE_TAG} tag.
     */
    synchronized void bindPendingBatches(BatchRegistry registry) {
        pendingBatches = Gauge.builder(PREFIX + "batches.pending", registry, BatchRegistry::size)
            .description("Batches cut but not yet acknowledged or released")
            .tags(tags)
            .tag(RECEIVER_INSTANCE_TAG, String.valueOf(INSTANCE_IDS.incrementAndGet()))
            .register(meterRegistry);
    }

    synchronized void unbindPendingBatches() {
        if (pendingBatches != null) {
            meterRegistry.remove(pendingBatches);
            pendingBatches = null;
        }
    }

    private Counter counter(String name, String description) {
        return Counter.builder(PREFIX + name)
            .description(description)
            .tags(tags)
            .register(meterRegistry);
    }
}
