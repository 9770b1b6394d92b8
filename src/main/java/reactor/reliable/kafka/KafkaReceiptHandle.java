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

import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.reliable.Disposition;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.internals.ReceiverSchedulers;

/**
 * Receipt handle of one consumer record. Accepting the handle marks its offset as
 * acknowledged; the offset is committed by the poll loop once every earlier fetched
 * offset of the partition is acknowledged too.
 */
public final class KafkaReceiptHandle implements ReceiptHandle {

    private static final Logger log = LoggerFactory.getLogger(KafkaReceiptHandle.class);

    private final TopicPartition topicPartition;

    private final long offset;

    private final AcknowledgedOffsets acknowledgedOffsets;

    KafkaReceiptHandle(TopicPartition topicPartition, long offset, AcknowledgedOffsets acknowledgedOffsets) {
        this.topicPartition = topicPartition;
        this.offset = offset;
        this.acknowledgedOffsets = acknowledgedOffsets;
    }

    public TopicPartition topicPartition() {
        return topicPartition;
    }

    public long offset() {
        return offset;
    }

    /**
     * Returns true once the offset is no longer tracked by this consumer: it was
     * committed, or its partition was revoked and will be redelivered to another member.
     */
    @Override
    public boolean isRemotelySettled() {
        checkEventLoop();
        return !acknowledgedOffsets.isTracked(topicPartition, offset);
    }

    @Override
    public void disposition(Disposition disposition, boolean settle) {
        checkEventLoop();
        switch (disposition) {
            case ACCEPTED:
                acknowledgedOffsets.acknowledge(topicPartition, offset);
                break;
            case RELEASED:
                // uncommitted offsets are fetched again after the next rebalance or restart
                log.debug("Released {}, offset stays uncommitted", this);
                break;
        }
    }

    private void checkEventLoop() {
        if (!ReceiverSchedulers.isCurrentThreadFromEventLoop())
            throw new IllegalStateException("Receipt handle " + this + " used outside of the consumer event loop");
    }

    @Override
    public String toString() {
        return topicPartition + "@" + offset;
    }
}
