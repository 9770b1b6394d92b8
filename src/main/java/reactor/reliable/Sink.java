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

import java.util.List;

/**
 * Durable target of converted batches. A batch is acknowledged to the broker only
 * after {@link #store(List)} returns normally.
 *
 * @param <T> application value type
 */
@FunctionalInterface
public interface Sink<T> {

    /**
     * Stores the values of one batch.
     * @param items converted values, in arrival order
     * @throws Exception if the values could not be stored durably
     */
    void store(List<T> items) throws Exception;
}
