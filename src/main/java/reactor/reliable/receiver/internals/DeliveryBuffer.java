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

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.reliable.BatchId;
import reactor.reliable.ReceiptHandle;

/**
 * Receipt handles of the payloads appended since the last batch cut. Batchers
 * already serialize appends with cuts; the lock makes that guarantee explicit.
 */
class DeliveryBuffer {

    private static final Logger log = LoggerFactory.getLogger(DeliveryBuffer.class);

    private List<ReceiptHandle> pending = new ArrayList<>();

    public synchronized void append(ReceiptHandle handle) {
        pending.add(handle);
    }

    /**
     * Registers the handles appended since the previous cut under {@code batchId}
     * and starts a new, empty buffer in the same critical section.
     * @return number of handles registered
     */
    public synchronized int cutAndRegister(BatchId batchId, BatchRegistry registry) {
        ReceiptHandle[] snapshot = pending.toArray(new ReceiptHandle[0]);
        registry.register(batchId, snapshot);
        pending = new ArrayList<>();
        log.debug("Registered {} deliveries for {}", snapshot.length, batchId);
        return snapshot.length;
    }

    public synchronized int size() {
        return pending.size();
    }
}
