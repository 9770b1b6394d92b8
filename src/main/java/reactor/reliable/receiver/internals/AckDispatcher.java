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

import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.reliable.BatchId;
import reactor.reliable.Disposition;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.receiver.ReceiverSupervisor;

/**
 * Settles the deliveries of stored batches. Receipt handles may only be used on the
 * protocol context, so settlement is posted there as a task and never awaited.
 */
class AckDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AckDispatcher.class);

    private final Scheduler context;

    private final BatchRegistry registry;

    private final ReceiverSupervisor supervisor;

    private final ReceiverMetrics metrics;

    AckDispatcher(Scheduler context, BatchRegistry registry, ReceiverSupervisor supervisor, ReceiverMetrics metrics) {
        this.context = context;
        this.registry = registry;
        this.supervisor = supervisor;
        this.metrics = metrics;
    }

    /**
     * Schedules the acknowledgment of every delivery of a stored batch.
     */
    void dispatch(BatchId batchId) {
        schedule(new SettleEvent(batchId));
    }

    /**
     * Schedules the release of the deliveries of all batches still registered.
     */
    void releaseAll() {
        schedule(new ReleaseEvent());
    }

    private void schedule(Runnable event) {
        try {
            context.schedule(event);
        } catch (RejectedExecutionException e) {
            log.warn("Protocol context rejected {}, deliveries will be redelivered", event);
            supervisor.reportError("Could not schedule settlement on the protocol context", e);
        }
    }

    private boolean settle(BatchId batchId, ReceiptHandle handle, Disposition disposition) {
        try {
            if (handle.isRemotelySettled()) {
                metrics.handlesRemotelySettled.increment();
                return false;
            }
            handle.disposition(disposition, true);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to settle delivery of " + batchId + " with " + disposition, e);
            supervisor.reportError("Failed to settle delivery of " + batchId, e);
            return false;
        }
    }

    class SettleEvent implements Runnable {

        private final BatchId batchId;

        SettleEvent(BatchId batchId) {
            this.batchId = batchId;
        }

        @Override
        public void run() {
            ReceiptHandle[] handles = registry.lookup(batchId);
            if (handles == null) {
                log.warn("No deliveries registered for stored {}", batchId);
                return;
            }
            int settled = 0;
            try {
                for (ReceiptHandle handle : handles) {
                    if (settle(batchId, handle, Disposition.ACCEPTED))
                        settled++;
                }
            } finally {
                registry.evict(batchId);
            }
            metrics.handlesSettled.increment(settled);
            log.debug("Accepted {} of {} deliveries of {}", settled, handles.length, batchId);
        }

        @Override
        public String toString() {
            return "SettleEvent(" + batchId + ")";
        }
    }

    class ReleaseEvent implements Runnable {

        @Override
        public void run() {
            for (BatchId batchId : registry.batchIds()) {
                ReceiptHandle[] handles = registry.lookup(batchId);
                if (handles == null)
                    continue;
                int released = 0;
                try {
                    for (ReceiptHandle handle : handles) {
                        if (settle(batchId, handle, Disposition.RELEASED))
                            released++;
                    }
                } finally {
                    registry.evict(batchId);
                }
                log.info("Released {} of {} deliveries of unstored {}", released, handles.length, batchId);
            }
        }

        @Override
        public String toString() {
            return "ReleaseEvent";
        }
    }
}
