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

/**
 * Error reporting channel of the application hosting a {@link ReliableReceiver}.
 */
public interface ReceiverSupervisor {

    /**
     * Reports a failure that does not require the receiver to stop.
     */
    void reportError(String message, Throwable cause);

    /**
     * Requests a hard stop of the receiver. Invoked when a batch could not be stored
     * within the configured number of attempts. Implementations should restart or
     * reconnect so that unsettled deliveries are redelivered by the broker.
     */
    void fatalStop(String message, Throwable cause);
}
