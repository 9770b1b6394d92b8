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
import reactor.reliable.MessageConverter;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.Sink;
import reactor.reliable.batcher.BatcherFactory;
import reactor.reliable.batcher.DefaultBatcher;
import reactor.reliable.receiver.internals.DefaultReliableReceiver;

/**
 * A receiver that accumulates messages acquired by a {@link ProtocolClient} into batches,
 * stores every batch into a {@link Sink} and acknowledges the deliveries of a batch only
 * after it was stored. A batch that cannot be stored is never acknowledged; the receiver
 * is stopped through {@link ReceiverSupervisor#fatalStop(String, Throwable)} and the
 * broker redelivers the unsettled messages.
 */
public interface ReliableReceiver {

    /**
     * Creates a receiver that batches messages with a {@link DefaultBatcher} configured
     * from {@code options}.
     *
     * @param options configuration options of this receiver
     * @param protocolClient broker connection acquiring the messages
     * @param converter converts each message before it is stored
     * @param sink durable target of converted batches
     * @param supervisor error reporting channel of the hosting application
     * @return new receiver instance
     */
    static <M, T> ReliableReceiver create(ReceiverOptions options, ProtocolClient<M> protocolClient,
                                          MessageConverter<M, T> converter, Sink<T> sink,
                                          ReceiverSupervisor supervisor) {
        return create(options, protocolClient, DefaultBatcher.factory(options), converter, sink, supervisor);
    }

    /**
     * Creates a receiver that batches messages with batchers created by {@code batcherFactory}.
     *
     * @return new receiver instance
     */
    static <M, T> ReliableReceiver create(ReceiverOptions options, ProtocolClient<M> protocolClient,
                                          BatcherFactory batcherFactory, MessageConverter<M, T> converter,
                                          Sink<T> sink, ReceiverSupervisor supervisor) {
        return new DefaultReliableReceiver<>(options, protocolClient, batcherFactory, converter, sink, supervisor);
    }

    /**
     * Starts the batcher, then the protocol client. A receiver can be started once.
     * @throws IllegalStateException if the receiver was already started or stopped
     */
    void start();

    /**
     * Stops the batcher, waiting for pending batches to be stored, then stops the
     * protocol client. Stopping a stopped receiver does nothing.
     * @return Mono that completes when the protocol client is stopped
     */
    Mono<Void> stop();

    boolean isStarted();

    /**
     * Returns the number of batches whose {@link ReceiptHandle}s are neither acknowledged nor released.
     * @return pending batch count
     */
    int pendingBatches();
}
