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

import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks fetched offsets until they are committed. Batches may be acknowledged in any
 * order, so only the acknowledged offsets forming a contiguous prefix of the fetched
 * offsets of a partition are committed.
 */
class AcknowledgedOffsets {

    private static final Logger log = LoggerFactory.getLogger(AcknowledgedOffsets.class);

    final Map<TopicPartition, SortedSet<Long>> uncommitted = new HashMap<>();
    final Map<TopicPartition, SortedSet<Long>> deferred = new HashMap<>();
    private final Map<TopicPartition, Long> unconfirmed = new HashMap<>();

    public synchronized void addUncommitted(ConsumerRecords<?, ?> records) {
        records.partitions().forEach(tp -> {
            SortedSet<Long> offsets = this.uncommitted.computeIfAbsent(tp, part -> new TreeSet<>());
            records.records(tp).forEach(rec -> offsets.add(rec.offset()));
        });
    }

    public synchronized boolean acknowledge(TopicPartition topicPartition, long offset) {
        log.trace("Acknowledge offset {}@{}", topicPartition, offset);
        SortedSet<Long> uncommittedThisTP = this.uncommitted.get(topicPartition);
        if (uncommittedThisTP != null && uncommittedThisTP.contains(offset)) {
            this.deferred.computeIfAbsent(topicPartition, tp -> new TreeSet<>()).add(offset);
            return true;
        }
        log.debug("No uncommitted offset for {}@{}, partition revoked?", topicPartition, offset);
        return false;
    }

    public synchronized boolean isTracked(TopicPartition topicPartition, long offset) {
        SortedSet<Long> uncommittedThisTP = this.uncommitted.get(topicPartition);
        return uncommittedThisTP != null && uncommittedThisTP.contains(offset);
    }

    public synchronized void partitionsRevoked(Collection<TopicPartition> revoked) {
        revoked.forEach(part -> {
            this.uncommitted.remove(part);
            this.deferred.remove(part);
            this.unconfirmed.remove(part);
        });
    }

    public synchronized int deferredCount() {
        int count = 0;
        for (SortedSet<Long> offsets : this.deferred.values()) {
            count += offsets.size();
        }
        return count;
    }

    /**
     * Removes the committable prefix of every partition and returns the offsets to commit,
     * including offsets of previously failed commits.
     */
    public synchronized Map<TopicPartition, OffsetAndMetadata> getAndClearOffsets() {
        Map<TopicPartition, OffsetAndMetadata> offsetMap = new HashMap<>();
        this.unconfirmed.forEach((tp, offset) -> offsetMap.put(tp, new OffsetAndMetadata(offset)));
        this.unconfirmed.clear();
        this.deferred.forEach((tp, offsets) -> {
            if (offsets.size() > 0) {
                long lastThisPart = -1;
                Iterator<Long> uncommittedIterator = this.uncommitted.get(tp).iterator();
                Iterator<Long> deferredIterator = offsets.iterator();

                while (deferredIterator.hasNext()) {
                    Long earliestDeferredOffset = deferredIterator.next();
                    Long earliestUncommittedOffset = uncommittedIterator.next();
                    if (!earliestDeferredOffset.equals(earliestUncommittedOffset)) {
                        break;
                    }

                    lastThisPart = earliestDeferredOffset;
                    uncommittedIterator.remove();
                    deferredIterator.remove();
                }

                if (lastThisPart >= 0) {
                    offsetMap.put(tp, new OffsetAndMetadata(lastThisPart + 1));
                }
            }
        });
        return offsetMap;
    }

    /**
     * Keeps the offsets of a failed commit so that they are part of the next commit,
     * unless their partition was revoked in the meantime.
     */
    public synchronized void restoreOffsets(Map<TopicPartition, OffsetAndMetadata> offsets) {
        offsets.forEach((tp, offset) -> {
            if (this.uncommitted.containsKey(tp))
                this.unconfirmed.merge(tp, offset.offset(), Math::max);
        });
    }

    @Override
    public synchronized String toString() {
        return "uncommitted=" + uncommitted + ", deferred=" + deferred;
    }
}
