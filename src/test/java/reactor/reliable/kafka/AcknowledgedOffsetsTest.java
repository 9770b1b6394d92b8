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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.assertj.core.data.MapEntry;
import org.junit.Before;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

public class AcknowledgedOffsetsTest {

    private final TopicPartition tp0 = new TopicPartition("foo", 0);

    private final TopicPartition tp1 = new TopicPartition("foo", 1);

    private AcknowledgedOffsets offsets;

    @Before
    public void setUp() {
        offsets = new AcknowledgedOffsets();
        Map<TopicPartition, List<ConsumerRecord<Integer, String>>> records = new HashMap<>();
        records.put(tp0, Arrays.asList(
            new ConsumerRecord<>("foo", 0, 0L, 1, "a"),
            new ConsumerRecord<>("foo", 0, 1L, 1, "b"),
            new ConsumerRecord<>("foo", 0, 2L, 1, "c"),
            new ConsumerRecord<>("foo", 0, 3L, 1, "d")));
        records.put(tp1, Arrays.asList(
            new ConsumerRecord<>("foo", 1, 10L, 1, "e"),
            new ConsumerRecord<>("foo", 1, 11L, 1, "f")));
        offsets.addUncommitted(new ConsumerRecords<>(records));
    }

    @Test
    public void onlyContiguousPrefixIsCommitted() {
        offsets.acknowledge(tp0, 0);
        offsets.acknowledge(tp0, 2);

        assertThat(offsets.getAndClearOffsets())
            .containsOnly(committed(tp0, 1L));
        assertThat(offsets.deferredCount()).isEqualTo(1);
        assertThat(offsets.isTracked(tp0, 0)).isFalse();
        assertThat(offsets.isTracked(tp0, 2)).isTrue();

        offsets.acknowledge(tp0, 1);
        assertThat(offsets.getAndClearOffsets())
            .containsOnly(committed(tp0, 3L));
        assertThat(offsets.deferredCount()).isZero();
    }

    @Test
    public void outOfOrderAcknowledgementsAcrossPartitions() {
        offsets.acknowledge(tp1, 11);
        offsets.acknowledge(tp0, 3);
        offsets.acknowledge(tp0, 1);
        assertThat(offsets.getAndClearOffsets()).isEmpty();

        offsets.acknowledge(tp1, 10);
        offsets.acknowledge(tp0, 2);
        offsets.acknowledge(tp0, 0);
        Map<TopicPartition, OffsetAndMetadata> commits = offsets.getAndClearOffsets();
        assertThat(commits).containsOnly(committed(tp0, 4L), committed(tp1, 12L));
        assertThat(offsets.getAndClearOffsets()).isEmpty();
    }

    @Test
    public void unknownOffsetIsNotAcknowledged() {
        assertThat(offsets.acknowledge(tp0, 42)).isFalse();
        assertThat(offsets.acknowledge(new TopicPartition("bar", 0), 0)).isFalse();
        assertThat(offsets.deferredCount()).isZero();
    }

    @Test
    public void revokedPartitionIsForgotten() {
        offsets.acknowledge(tp0, 0);
        offsets.acknowledge(tp1, 10);

        offsets.partitionsRevoked(Collections.singletonList(tp0));

        assertThat(offsets.isTracked(tp0, 1)).isFalse();
        assertThat(offsets.acknowledge(tp0, 1)).isFalse();
        assertThat(offsets.getAndClearOffsets()).containsOnly(committed(tp1, 11L));
    }

    @Test
    public void failedCommitIsPartOfNextCommit() {
        offsets.acknowledge(tp0, 0);
        offsets.acknowledge(tp1, 10);
        Map<TopicPartition, OffsetAndMetadata> failed = offsets.getAndClearOffsets();

        offsets.restoreOffsets(failed);
        offsets.acknowledge(tp0, 1);

        assertThat(offsets.getAndClearOffsets()).containsOnly(committed(tp0, 2L), committed(tp1, 11L));
        assertThat(offsets.getAndClearOffsets()).isEmpty();
    }

    @Test
    public void failedCommitOfRevokedPartitionIsDiscarded() {
        offsets.acknowledge(tp0, 0);
        Map<TopicPartition, OffsetAndMetadata> failed = offsets.getAndClearOffsets();

        offsets.partitionsRevoked(Collections.singletonList(tp0));
        offsets.restoreOffsets(failed);

        assertThat(offsets.getAndClearOffsets()).isEmpty();
    }

    private static MapEntry<TopicPartition, OffsetAndMetadata> committed(TopicPartition tp, long offset) {
        return entry(tp, new OffsetAndMetadata(offset));
    }
}
