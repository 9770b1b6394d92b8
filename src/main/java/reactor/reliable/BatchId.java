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

package reactor.reliable;

/**
 * Identifier assigned by a batcher when it cuts a batch. Used as the join key
 * between the payloads that were stored and the receipt handles to acknowledge.
 */
public final class BatchId {

    private final int streamId;

    private final long sequence;

    public BatchId(int streamId, long sequence) {
        this.streamId = streamId;
        this.sequence = sequence;
    }

    public int streamId() {
        return streamId;
    }

    public long sequence() {
        return sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        BatchId that = (BatchId) o;
        return streamId == that.streamId && sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return 31 * streamId + Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return "batch-" + streamId + "-" + sequence;
    }
}
