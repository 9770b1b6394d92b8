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
 * Opaque token issued by a protocol client for one unsettled inbound message.
 * <p>
 * Receipt handles are bound to the execution context of the protocol client that
 * created them. Both methods must only be invoked from that context, typically by
 * scheduling a task on {@link reactor.reliable.receiver.ProtocolClient#context()}.
 */
public interface ReceiptHandle {

    /**
     * Returns true if the remote peer has already settled the message, in which case
     * no local disposition should be issued.
     * @return true if already settled by the peer
     */
    boolean isRemotelySettled();

    /**
     * Issues a disposition for the message.
     * @param disposition outcome to send to the broker
     * @param settle true to settle the delivery locally together with the outcome
     */
    void disposition(Disposition disposition, boolean settle);
}
