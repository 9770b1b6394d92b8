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

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import reactor.reliable.BatchId;
import reactor.reliable.ReceiptHandle;

/**
 * Receipt handles of every batch that was cut but not yet acknowledged or abandoned.
 * Written from the batcher side, read and evicted from the protocol context.
 */
class BatchRegistry {

    private final ConcurrentMap<BatchId, ReceiptHandle[]> entries = new ConcurrentHashMap<>();

    void register(BatchId batchId, ReceiptHandle[] handles) {
        if (entries.putIfAbsent(batchId, handles) != null)
            throw new IllegalStateException("Deliveries already registered for " + batchId);
    }

    ReceiptHandle[] lookup(BatchId batchId) {
        return entries.get(batchId);
    }

    /**
     * Removes the entry of a batch. Evicting an unknown or already evicted batch does nothing.
     * @return true if an entry was removed
     */
    boolean evict(BatchId batchId) {
        return entries.remove(batchId) != null;
    }

    Set<BatchId> batchIds() {
        return new HashSet<>(entries.keySet());
    }

    int size() {
        return entries.size();
    }
}
