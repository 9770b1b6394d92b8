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

import java.util.List;

import reactor.reliable.BatchId;
import reactor.reliable.ReceiptHandle;

/**
 * Callbacks invoked by a {@link Batcher}.
 *
 * @param <M> payload type
 */
public interface BatchListener<M> {

    /**
     * Called for every appended payload, serially with {@link #onBatchCut(BatchId)}.
     */
    void onDataAdded(M payload, ReceiptHandle handle);

    /**
     * Called when the payloads appended since the previous cut form a new batch.
     */
    void onBatchCut(BatchId batchId);

    /**
     * Called on the batcher's worker thread with the payloads of a batch that
     * was previously cut. Blocking is allowed.
     */
    void onBatchReady(BatchId batchId, List<M> payloads);

    /**
     * Called on internal batcher failures.
     */
    void onError(String description, Throwable cause);
}
