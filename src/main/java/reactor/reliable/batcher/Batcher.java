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

import reactor.reliable.ReceiptHandle;

/**
 * Accumulates payloads into batches and hands every batch to its {@link BatchListener}.
 * A batcher guarantees that {@link BatchListener#onDataAdded(Object, ReceiptHandle)} and
 * {@link BatchListener#onBatchCut(reactor.reliable.BatchId)} are never invoked concurrently.
 *
 * @param <M> payload type
 */
public interface Batcher<M> {

    void start();

    /**
     * Stops accepting payloads, cuts and hands over the remaining payloads, then
     * waits for pending batches to be processed. Does nothing if already stopped.
     * <p>
     * When invoked from {@link BatchListener#onBatchReady(reactor.reliable.BatchId, java.util.List)},
     * remaining payloads are still cut but neither the last batch nor queued batches
     * are handed over.
     */
    void stop();

    boolean isStopped();

    /**
     * Appends a payload to the current batch.
     * @param payload message payload
     * @param handle receipt handle passed back to {@link BatchListener#onDataAdded(Object, ReceiptHandle)}
     * @throws IllegalStateException if the batcher is not active
     */
    void append(M payload, ReceiptHandle handle);
}
