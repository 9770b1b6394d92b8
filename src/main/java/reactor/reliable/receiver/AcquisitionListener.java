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

import reactor.reliable.ReceiptHandle;

/**
 * Callbacks invoked by a {@link ProtocolClient} on its own context.
 *
 * @param <M> protocol message type
 */
public interface AcquisitionListener<M> {

    /**
     * Called for every message received on the link. Must not block.
     * @param handle receipt handle of the delivery, may be null for pre-settled deliveries
     * @param message raw message
     */
    void onAcquire(ReceiptHandle handle, M message);

    /**
     * Called on link or connection failures not tied to a specific message.
     */
    void onError(String description, Throwable cause);
}
