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

import java.util.Optional;

/**
 * Converts a raw protocol message into an application value.
 *
 * @param <M> protocol message type
 * @param <T> application value type
 */
@FunctionalInterface
public interface MessageConverter<M, T> {

    /**
     * Converts the message. Messages that cannot be converted yield an empty
     * optional and are left out of the stored batch without being treated as errors.
     * @param message raw message
     * @return converted value or empty
     */
    Optional<T> convert(M message);
}
