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

/**
 * Outcome of storing one batch: success, or failure with the error of the last attempt.
 */
final class StoreResult {

    private final int attempts;

    private final Throwable error;

    private StoreResult(int attempts, Throwable error) {
        this.attempts = attempts;
        this.error = error;
    }

    static StoreResult success(int attempts) {
        return new StoreResult(attempts, null);
    }

    static StoreResult failure(int attempts, Throwable lastError) {
        return new StoreResult(attempts, lastError);
    }

    boolean isSuccess() {
        return error == null;
    }

    int attempts() {
        return attempts;
    }

    Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "stored after " + attempts + " attempt(s)" : "failed after " + attempts + " attempt(s): " + error;
    }
}
