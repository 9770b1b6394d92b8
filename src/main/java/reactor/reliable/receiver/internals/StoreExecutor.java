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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.reliable.BatchId;
import reactor.reliable.MessageConverter;
import reactor.reliable.Sink;

/**
 * Converts the payloads of a batch and stores them into the sink, attempting
 * at most {@code maxAttempts} times. Runs on the batcher worker thread.
 */
class StoreExecutor<M, T> {

    private static final Logger log = LoggerFactory.getLogger(StoreExecutor.class);

    private final MessageConverter<M, T> converter;

    private final Sink<T> sink;

    private final int maxAttempts;

    private final Duration retryInterval;

    private final ReceiverMetrics metrics;

    StoreExecutor(MessageConverter<M, T> converter, Sink<T> sink, int maxAttempts, Duration retryInterval,
                  ReceiverMetrics metrics) {
        this.converter = converter;
        this.sink = sink;
        this.maxAttempts = maxAttempts;
        this.retryInterval = retryInterval;
        this.metrics = metrics;
    }

    StoreResult store(BatchId batchId, List<M> payloads) {
        Throwable lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            metrics.storeAttempts.increment();
            try {
                List<T> converted = convert(payloads);
                sink.store(converted);
                int dropped = payloads.size() - converted.size();
                if (dropped > 0) {
                    metrics.recordsDropped.increment(dropped);
                    log.debug("{} of {} messages of {} could not be converted", dropped, payloads.size(), batchId);
                }
                log.debug("Stored {} values of {} in {} attempt(s)", converted.size(), batchId, attempt);
                return StoreResult.success(attempt);
            } catch (Throwable t) {
                // errors of the sink count as failed attempts like any exception
                lastError = t;
                log.warn("Storing {} failed with " + t + ", attempts remaining {}", batchId, maxAttempts - attempt);
            }
            if (attempt < maxAttempts && !awaitRetry()) {
                return StoreResult.failure(attempt, lastError);
            }
        }
        return StoreResult.failure(maxAttempts, lastError);
    }

    private List<T> convert(List<M> payloads) {
        List<T> converted = new ArrayList<>(payloads.size());
        for (M payload : payloads) {
            Optional<T> value = converter.convert(payload);
            value.ifPresent(converted::add);
        }
        return converted;
    }

    private boolean awaitRetry() {
        if (retryInterval.isZero())
            return true;
        try {
            Thread.sleep(retryInterval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to retry store");
            return false;
        }
    }
}
