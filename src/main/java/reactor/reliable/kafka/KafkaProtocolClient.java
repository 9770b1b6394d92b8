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

package reactor.reliable.kafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.Deserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.reliable.internals.ReceiverSchedulers;
import reactor.reliable.receiver.AcquisitionListener;
import reactor.reliable.receiver.ProtocolClient;

/**
 * Protocol client acquiring records from Kafka topics. Since {@link Consumer} does not
 * support multi-threaded access, every action on it, including the settlement of
 * {@link KafkaReceiptHandle}s, runs on a single event loop exposed by {@link #context()}.
 */
public class KafkaProtocolClient<K, V> implements ProtocolClient<ConsumerRecord<K, V>> {

    private static final Logger log = LoggerFactory.getLogger(KafkaProtocolClient.class);

    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofMillis(100);

    static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(30);

    final AcknowledgedOffsets acknowledgedOffsets = new AcknowledgedOffsets();

    private final AtomicBoolean isActive = new AtomicBoolean();

    private final AtomicBoolean isClosed = new AtomicBoolean();

    private final Consumer<K, V> consumer;

    private final Collection<String> topics;

    private final Duration pollTimeout;

    private final Duration closeTimeout;

    private final Scheduler eventScheduler;

    private final PollEvent pollEvent = new PollEvent();

    private volatile AcquisitionListener<ConsumerRecord<K, V>> listener;

    public KafkaProtocolClient(Consumer<K, V> consumer, String groupId, Collection<String> topics,
                               Duration pollTimeout, Duration closeTimeout) {
        this.consumer = Objects.requireNonNull(consumer);
        this.topics = new ArrayList<>(topics);
        this.pollTimeout = pollTimeout;
        this.closeTimeout = closeTimeout;
        this.eventScheduler = ReceiverSchedulers.newEventLoop("kafka-" + groupId);
    }

    /**
     * Creates a client subscribing to {@code topics} with a consumer configured from
     * {@code consumerProperties}, which must include {@link ConsumerConfig#GROUP_ID_CONFIG}.
     */
    public static <K, V> KafkaProtocolClient<K, V> create(Map<String, Object> consumerProperties,
                                                          Deserializer<K> keyDeserializer,
                                                          Deserializer<V> valueDeserializer,
                                                          Collection<String> topics) {
        Object groupId = consumerProperties.get(ConsumerConfig.GROUP_ID_CONFIG);
        if (groupId == null)
            throw new IllegalArgumentException(ConsumerConfig.GROUP_ID_CONFIG + " must be configured");
        Consumer<K, V> consumer =
            ConsumerFactory.INSTANCE.createConsumer(consumerProperties, keyDeserializer, valueDeserializer);
        return new KafkaProtocolClient<>(consumer, groupId.toString(), topics, DEFAULT_POLL_TIMEOUT,
            DEFAULT_CLOSE_TIMEOUT);
    }

    @Override
    public Scheduler context() {
        return eventScheduler;
    }

    @Override
    public void start(AcquisitionListener<ConsumerRecord<K, V>> listener) {
        if (isClosed.get() || !isActive.compareAndSet(false, true))
            throw new IllegalStateException("Kafka client can only be started once");
        this.listener = listener;
        eventScheduler.schedule(new SubscribeEvent());
    }

    @Override
    public Mono<Void> stop() {
        return Mono
            .defer(() -> {
                if (!isClosed.compareAndSet(false, true)) {
                    return Mono.empty();
                }
                log.debug("Stopping Kafka client for {}", topics);
                isActive.set(false);
                consumer.wakeup();
                return Mono.<Void>fromRunnable(new CloseEvent(closeTimeout))
                    .subscribeOn(eventScheduler)
                    .doFinally(__ -> eventScheduler.dispose());
            })
            .onErrorResume(e -> {
                log.warn("Close exception: " + e);
                return Mono.empty();
            });
    }

    private void commitIfRequired() {
        Map<TopicPartition, OffsetAndMetadata> offsets = acknowledgedOffsets.getAndClearOffsets();
        if (offsets.isEmpty())
            return;
        log.debug("Committing {}", offsets);
        consumer.commitAsync(offsets, (committed, exception) -> {
            if (exception != null) {
                log.warn("Commit failed, offsets are committed again with the next commit", exception);
                acknowledgedOffsets.restoreOffsets(offsets);
            }
        });
    }

    private void commitSync(Duration timeout) {
        Map<TopicPartition, OffsetAndMetadata> offsets = acknowledgedOffsets.getAndClearOffsets();
        if (offsets.isEmpty())
            return;
        try {
            consumer.commitSync(offsets, timeout);
        } catch (WakeupException e) {
            acknowledgedOffsets.restoreOffsets(offsets);
            throw e;
        }
    }

    private void reportError(String description, Exception e) {
        if (isActive.get()) {
            log.error(description, e);
            listener.onError(description, e);
        }
    }

    class SubscribeEvent implements Runnable {

        @Override
        public void run() {
            log.info("Subscribing to {}", topics);
            try {
                consumer.subscribe(topics, new ConsumerRebalanceListener() {
                    @Override
                    public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
                        log.debug("onPartitionsAssigned {}", partitions);
                    }

                    @Override
                    public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
                        log.debug("onPartitionsRevoked {}", partitions);
                        // It is safe to use the consumer here since we are in a poll()
                        try {
                            commitSync(closeTimeout);
                        } catch (Exception e) {
                            log.warn("Commit on revocation failed", e);
                        }
                        acknowledgedOffsets.partitionsRevoked(partitions);
                    }
                });
                pollEvent.schedule();
            } catch (Exception e) {
                reportError("Subscription to " + topics + " failed", e);
            }
        }
    }

    class PollEvent implements Runnable {

        private final AtomicBoolean scheduled = new AtomicBoolean();

        @Override
        public void run() {
            try {
                this.scheduled.set(false);
                if (!isActive.get())
                    return;
                // settlement tasks queued since the previous poll have run by now
                commitIfRequired();

                ConsumerRecords<K, V> records;
                try {
                    records = consumer.poll(pollTimeout);
                } catch (WakeupException e) {
                    records = ConsumerRecords.empty();
                }

                if (isActive.get()) {
                    schedule();
                }

                if (!records.isEmpty()) {
                    log.debug("Acquired {} records", records.count());
                    acknowledgedOffsets.addUncommitted(records);
                    for (ConsumerRecord<K, V> record : records) {
                        TopicPartition partition = new TopicPartition(record.topic(), record.partition());
                        listener.onAcquire(new KafkaReceiptHandle(partition, record.offset(), acknowledgedOffsets), record);
                    }
                }
            } catch (Exception e) {
                reportError("Unexpected exception in poll loop", e);
            }
        }

        void schedule() {
            if (!this.scheduled.getAndSet(true)) {
                eventScheduler.schedule(this);
            }
        }
    }

    private class CloseEvent implements Runnable {
        private final long closeEndTimeMillis;

        CloseEvent(Duration timeout) {
            this.closeEndTimeMillis = System.currentTimeMillis() + timeout.toMillis();
        }

        @Override
        public void run() {
            /*
             * A wakeup requested by stop() interrupts the first blocking call if no poll
             * consumed it, so the commit is attempted again.
             */
            int attempts = 3;
            for (int i = 0; i < attempts; i++) {
                try {
                    commitSync(remaining());
                    consumer.close(remaining());
                    log.debug("Closed Kafka client for {}", topics);
                    return;
                } catch (WakeupException e) {
                    if (i == attempts - 1)
                        throw e;
                }
            }
        }

        private Duration remaining() {
            long timeoutMillis = closeEndTimeMillis - System.currentTimeMillis();
            return Duration.ofMillis(Math.max(timeoutMillis, 0));
        }
    }
}
