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

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.reliable.ReceiptHandle;

/**
 * Broker connection that acquires messages one at a time and owns the execution
 * context on which their {@link ReceiptHandle}s must be settled.
 *
 * @param <M> protocol message type
 */
public interface ProtocolClient<M> {

    /**
     * Returns the single-threaded context owned by this client. Settlement of receipt
     * handles is only safe from tasks scheduled on this scheduler.
     * @return protocol context
     */
    Scheduler context();

    /**
     * Starts acquiring messages. Every message is delivered to
     * {@link AcquisitionListener#onAcquire(ReceiptHandle, Object)}.
     * @param listener callbacks for acquired messages and link errors
     */
    void start(AcquisitionListener<M> listener);

    /**
     * Stops acquisition and closes the connection. Tasks already scheduled on
     * {@link #context()} run before the connection is closed.
     * @return Mono that completes when the connection is closed
     */
    Mono<Void> stop();
}
