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

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.reliable.BatchId;
import reactor.reliable.MessageConverter;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.Sink;
import reactor.reliable.batcher.BatchListener;
import reactor.reliable.batcher.Batcher;
import reactor.reliable.batcher.BatcherFactory;
import reactor.reliable.receiver.AcquisitionListener;
import reactor.reliable.receiver.ProtocolClient;
import reactor.reliable.receiver.ReceiverOptions;
import reactor.reliable.receiver.ReceiverSupervisor;
import reactor.reliable.receiver.ReliableReceiver;

/**
 * Ties the protocol client, the batcher and the sink together: deliveries are grouped by
 * the batch they were cut into, and settled once that batch is stored.
 */
public class DefaultReliableReceiver<M, T> implements ReliableReceiver, BatchListener<M>, AcquisitionListener<M> {

    private static final Logger log = LoggerFactory.getLogger(DefaultReliableReceiver.class);

    enum State { CREATED, STARTED, STOPPED }

    private final AtomicReference<State> state = new AtomicReference<>(State.CREATED);

    private final ReceiverOptions options;

    private final ProtocolClient<M> protocolClient;

    private final BatcherFactory batcherFactory;

    private final ReceiverSupervisor supervisor;

    private final String receiverId;

    private final ReceiverMetrics metrics;

    private final StoreExecutor<M, T> storeExecutor;

    private volatile DeliveryBuffer deliveryBuffer;

    private volatile BatchRegistry registry;

    private volatile AckDispatcher ackDispatcher;

    private volatile Batcher<M> batcher;

    public DefaultReliableReceiver(ReceiverOptions options, ProtocolClient<M> protocolClient,
                                   BatcherFactory batcherFactory, MessageConverter<M, T> converter,
                                   Sink<T> sink, ReceiverSupervisor supervisor) {
        this.options = options;
        this.protocolClient = protocolClient;
        this.batcherFactory = batcherFactory;
        this.supervisor = supervisor;
        this.receiverId =
            Optional.ofNullable(options.receiverId())
                .filter(id -> !id.isEmpty())
                .orElse("reliable-receiver-" + System.identityHashCode(this));
        this.metrics = new ReceiverMetrics(options.meterRegistry(), receiverId);
        this.storeExecutor = new StoreExecutor<>(converter, sink, options.maxStoreAttempts(),
            options.storeRetryInterval(), metrics);
    }

    @Override
    public void start() {
        if (!state.compareAndSet(State.CREATED, State.STARTED))
            throw new IllegalStateException("Receiver " + receiverId + " cannot be started in state " + state.get());
        log.info("Starting receiver {}", receiverId);
        deliveryBuffer = new DeliveryBuffer();
        registry = new BatchRegistry();
        metrics.bindPendingBatches(registry);
        ackDispatcher = new AckDispatcher(protocolClient.context(), registry, supervisor, metrics);

        batcher = batcherFactory.create(this);
        batcher.start();

        protocolClient.start(this);
    }

    @Override
    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (state.compareAndSet(State.CREATED, State.STOPPED))
                return Mono.empty();
            if (!state.compareAndSet(State.STARTED, State.STOPPED))
                return Mono.empty();
            log.info("Stopping receiver {}", receiverId);

            if (batcher != null && !batcher.isStopped()) {
                batcher.stop();
            }
            if (options.releaseOnStop() && registry.size() > 0) {
                ackDispatcher.releaseAll();
            }
            return protocolClient.stop()
                .doFinally(__ -> metrics.unbindPendingBatches());
        });
    }

    @Override
    public boolean isStarted() {
        return state.get() == State.STARTED;
    }

    @Override
    public int pendingBatches() {
        BatchRegistry registry = this.registry;
        return registry == null ? 0 : registry.size();
    }

    @Override
    public void onAcquire(ReceiptHandle handle, M message) {
        if (state.get() != State.STARTED) {
            log.debug("Receiver {} is not started, message left unsettled", receiverId);
            return;
        }
        // handle travels as metadata and is recorded by onDataAdded
        batcher.append(message, handle);
    }

    @Override
    public void onDataAdded(M payload, ReceiptHandle handle) {
        if (log.isTraceEnabled())
            log.trace("Added {}", payload);
        if (handle != null) {
            deliveryBuffer.append(handle);
        }
    }

    @Override
    public void onBatchCut(BatchId batchId) {
        deliveryBuffer.cutAndRegister(batchId, registry);
    }

    @Override
    public void onBatchReady(BatchId batchId, List<M> payloads) {
        StoreResult result = storeExecutor.store(batchId, payloads);
        if (result.isSuccess()) {
            metrics.batchesStored.increment();
            ackDispatcher.dispatch(batchId);
        } else {
            metrics.batchesFailed.increment();
            Throwable error = result.error();
            log.error(error.getMessage(), error);
            supervisor.fatalStop("Error while storing " + batchId + " after " + result.attempts() + " attempt(s)", error);
        }
    }

    @Override
    public void onError(String description, Throwable cause) {
        log.error(description, cause);
        supervisor.reportError(description, cause);
    }

    @Override
    public String toString() {
        return "DefaultReliableReceiver{" + receiverId + ", " + state.get() + "}";
    }
}
