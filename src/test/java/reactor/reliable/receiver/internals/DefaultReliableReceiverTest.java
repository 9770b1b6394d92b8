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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.reliable.BatchId;
import reactor.reliable.Disposition;
import reactor.reliable.MessageConverter;
import reactor.reliable.ReceiptHandle;
import reactor.reliable.Sink;
import reactor.reliable.batcher.BatchListener;
import reactor.reliable.batcher.Batcher;
import reactor.reliable.batcher.BatcherFactory;
import reactor.reliable.receiver.ProtocolClient;
import reactor.reliable.receiver.ReceiverOptions;
import reactor.reliable.receiver.ReceiverSupervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

public class DefaultReliableReceiverTest {

    private ProtocolClient<String> protocolClient;

    private ReceiverSupervisor supervisor;

    private Sink<String> sink;

    private ManualBatcher<String> batcher;

    private BatcherFactory batcherFactory;

    private ReceiverOptions options;

    @Before
    @SuppressWarnings("unchecked")
    public void setUp() {
        protocolClient = mock(ProtocolClient.class);
        given(protocolClient.context()).willReturn(Schedulers.immediate());
        given(protocolClient.stop()).willReturn(Mono.empty());
        supervisor = mock(ReceiverSupervisor.class);
        sink = mock(Sink.class);
        batcherFactory = new BatcherFactory() {
            @Override
            public <M> Batcher<M> create(BatchListener<M> listener) {
                ManualBatcher<M> created = new ManualBatcher<>(listener);
                batcher = (ManualBatcher<String>) created;
                return created;
            }
        };
        options = ReceiverOptions.create()
            .receiverId("test")
            .meterRegistry(new SimpleMeterRegistry());
    }

    private DefaultReliableReceiver<String, String> receiver(MessageConverter<String, String> converter) {
        return new DefaultReliableReceiver<>(options, protocolClient, batcherFactory, converter, sink, supervisor);
    }

    @Test
    public void storedBatchIsAcknowledged() throws Exception {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle h1 = mock(ReceiptHandle.class);
        ReceiptHandle h2 = mock(ReceiptHandle.class);

        receiver.onAcquire(h1, "a");
        receiver.onAcquire(h2, "b");
        BatchId b1 = batcher.cut();
        assertThat(receiver.pendingBatches()).isEqualTo(1);
        batcher.ready(b1);

        verify(sink).store(Arrays.asList("a", "b"));
        verify(h1).disposition(Disposition.ACCEPTED, true);
        verify(h2).disposition(Disposition.ACCEPTED, true);
        assertThat(receiver.pendingBatches()).isZero();
        verify(supervisor, never()).fatalStop(any(), any());
    }

    @Test
    public void unconvertedMessagesAreStillAcknowledged() throws Exception {
        DefaultReliableReceiver<String, String> receiver =
            receiver(m -> "bad".equals(m) ? Optional.empty() : Optional.of(m));
        receiver.start();
        ReceiptHandle bad = mock(ReceiptHandle.class);
        ReceiptHandle good = mock(ReceiptHandle.class);

        receiver.onAcquire(bad, "bad");
        receiver.onAcquire(good, "good");
        batcher.ready(batcher.cut());

        verify(sink).store(Collections.singletonList("good"));
        verify(bad).disposition(Disposition.ACCEPTED, true);
        verify(good).disposition(Disposition.ACCEPTED, true);
    }

    @Test
    public void exhaustedStoreEscalatesWithoutAcknowledging() throws Exception {
        IOException last = new IOException("sink down 3");
        willThrow(new IOException("sink down 1"))
            .willThrow(new IOException("sink down 2"))
            .willThrow(last)
            .given(sink).store(any());
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle h1 = mock(ReceiptHandle.class);
        ReceiptHandle h2 = mock(ReceiptHandle.class);

        receiver.onAcquire(h1, "a");
        receiver.onAcquire(h2, "b");
        BatchId b1 = batcher.cut();
        batcher.ready(b1);

        verify(sink, times(3)).store(any());
        verify(supervisor).fatalStop(contains(b1.toString()), eq(last));
        verify(h1, never()).disposition(any(), anyBoolean());
        verify(h2, never()).disposition(any(), anyBoolean());
        assertThat(receiver.pendingBatches()).isEqualTo(1);
    }

    @Test
    public void sinkErrorIsRetriedAndEscalatedLikeAnException() throws Exception {
        AssertionError broken = new AssertionError("sink broken");
        willThrow(broken).given(sink).store(any());
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle handle = mock(ReceiptHandle.class);

        receiver.onAcquire(handle, "a");
        BatchId b1 = batcher.cut();
        batcher.ready(b1);

        verify(sink, times(3)).store(any());
        verify(supervisor).fatalStop(contains(b1.toString()), eq(broken));
        verify(handle, never()).disposition(any(), anyBoolean());
        assertThat(receiver.pendingBatches()).isEqualTo(1);
    }

    @Test
    public void receiversSharingAnIdReportPendingBatchesSeparately() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        options = options.meterRegistry(meters);
        DefaultReliableReceiver<String, String> first = receiver(Optional::of);
        first.start();
        ManualBatcher<String> firstBatcher = batcher;
        DefaultReliableReceiver<String, String> second = receiver(Optional::of);
        second.start();

        first.onAcquire(mock(ReceiptHandle.class), "a");
        firstBatcher.cut();

        assertThat(meters.find("reliable.receiver.batches.pending").tag("receiver.id", "test").gauges())
            .extracting(Gauge::value)
            .containsExactlyInAnyOrder(1.0, 0.0);

        first.stop().block();
        second.stop().block();

        assertThat(meters.find("reliable.receiver.batches.pending").gauges()).isEmpty();
    }

    @Test
    public void batchesAreAcknowledgedIndependently() throws Exception {
        willThrow(new IOException("down")).given(sink).store(Collections.singletonList("first"));
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle h1 = mock(ReceiptHandle.class);
        ReceiptHandle h2 = mock(ReceiptHandle.class);

        receiver.onAcquire(h1, "first");
        BatchId b1 = batcher.cut();
        receiver.onAcquire(h2, "second");
        BatchId b2 = batcher.cut();
        batcher.ready(b2);
        batcher.ready(b1);

        verify(h2).disposition(Disposition.ACCEPTED, true);
        verify(h1, never()).disposition(any(), anyBoolean());
        assertThat(receiver.pendingBatches()).isEqualTo(1);
    }

    @Test
    public void messagesWithoutHandleAreStoredButNotTracked() throws Exception {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();

        receiver.onAcquire(null, "presettled");
        BatchId b1 = batcher.cut();
        batcher.ready(b1);

        verify(sink).store(Collections.singletonList("presettled"));
        assertThat(receiver.pendingBatches()).isZero();
    }

    @Test
    public void startsBatcherBeforeProtocolClientAndStopsInReverse() {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);

        receiver.start();
        assertThat(batcher.started).isTrue();
        verify(protocolClient).start(receiver);
        assertThat(receiver.isStarted()).isTrue();

        receiver.stop().block();
        assertThat(batcher.isStopped()).isTrue();
        verify(protocolClient).stop();
        assertThat(receiver.isStarted()).isFalse();

        receiver.stop().block();
        verify(protocolClient, times(1)).stop();
    }

    @Test
    public void stopStopsBatcherFirst() {
        @SuppressWarnings("unchecked")
        Batcher<String> mockBatcher = mock(Batcher.class);
        BatcherFactory factory = new BatcherFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <M> Batcher<M> create(BatchListener<M> listener) {
                return (Batcher<M>) mockBatcher;
            }
        };
        DefaultReliableReceiver<String, String> receiver =
            new DefaultReliableReceiver<>(options, protocolClient, factory, Optional::of, sink, supervisor);
        receiver.start();

        receiver.stop().block();

        InOrder inOrder = inOrder(mockBatcher, protocolClient);
        inOrder.verify(mockBatcher).start();
        inOrder.verify(protocolClient).start(receiver);
        inOrder.verify(mockBatcher).stop();
        inOrder.verify(protocolClient).stop();
    }

    @Test
    public void cannotRestart() {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();

        assertThatThrownBy(receiver::start).isInstanceOf(IllegalStateException.class);
        receiver.stop().block();
        assertThatThrownBy(receiver::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void stopBeforeStartIsTerminal() {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);

        receiver.stop().block();

        verify(protocolClient, never()).stop();
        assertThatThrownBy(receiver::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void abandonedBatchesAreReleasedOnStop() throws Exception {
        willThrow(new IOException("down")).given(sink).store(any());
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle handle = mock(ReceiptHandle.class);
        receiver.onAcquire(handle, "a");
        batcher.ready(batcher.cut());

        receiver.stop().block();

        verify(handle).disposition(Disposition.RELEASED, true);
        verify(handle, never()).disposition(eq(Disposition.ACCEPTED), anyBoolean());
        assertThat(receiver.pendingBatches()).isZero();
    }

    @Test
    public void abandonedBatchesAreKeptWhenReleaseIsDisabled() throws Exception {
        options = options.releaseOnStop(false);
        willThrow(new IOException("down")).given(sink).store(any());
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        ReceiptHandle handle = mock(ReceiptHandle.class);
        receiver.onAcquire(handle, "a");
        batcher.ready(batcher.cut());

        receiver.stop().block();

        verify(handle, never()).disposition(any(), anyBoolean());
        assertThat(receiver.pendingBatches()).isEqualTo(1);
    }

    @Test
    public void messagesAcquiredAfterStopAreIgnored() {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        receiver.stop().block();

        receiver.onAcquire(mock(ReceiptHandle.class), "late");

        assertThat(batcher.buffer).isEmpty();
    }

    @Test
    public void errorsAreReportedWithoutStopping() {
        DefaultReliableReceiver<String, String> receiver = receiver(Optional::of);
        receiver.start();
        RuntimeException cause = new RuntimeException("link detached");

        receiver.onError("Link error", cause);

        verify(supervisor).reportError("Link error", cause);
        verify(supervisor, never()).fatalStop(any(), any());
        assertThat(receiver.isStarted()).isTrue();
    }

    /**
     * Batcher driven by the test: cuts and hand-overs happen on the calling thread.
     */
    static final class ManualBatcher<M> implements Batcher<M> {

        final BatchListener<M> listener;

        final List<M> buffer = new ArrayList<>();

        final Map<BatchId, List<M>> cutBatches = new HashMap<>();

        final AtomicLong sequence = new AtomicLong();

        boolean started;

        boolean stopped;

        ManualBatcher(BatchListener<M> listener) {
            this.listener = listener;
        }

        @Override
        public void start() {
            started = true;
        }

        @Override
        public void stop() {
            stopped = true;
        }

        @Override
        public boolean isStopped() {
            return stopped;
        }

        @Override
        public synchronized void append(M payload, ReceiptHandle handle) {
            buffer.add(payload);
            listener.onDataAdded(payload, handle);
        }

        synchronized BatchId cut() {
            BatchId batchId = new BatchId(0, sequence.incrementAndGet());
            listener.onBatchCut(batchId);
            cutBatches.put(batchId, new ArrayList<>(buffer));
            buffer.clear();
            return batchId;
        }

        void ready(BatchId batchId) {
            listener.onBatchReady(batchId, cutBatches.remove(batchId));
        }
    }
}
