/*
 * Copyright 2021 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.devpodctl.common.runtime;

import java.util.Optional;

/**
 * Emitted by a top-level entry point before it terminates the process because of an error it cannot recover from.
 */
public class SystemAbortEvent {

    private final String failureId;
    private final String reason;
    private final Throwable cause;
    private final long timestamp;

    private SystemAbortEvent(String failureId, String reason, Throwable cause, long timestamp) {
        this.failureId = failureId;
        this.reason = reason;
        this.cause = cause;
        this.timestamp = timestamp;
    }

    public String getFailureId() {
        return failureId;
    }

    public String getReason() {
        return reason;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "SystemAbortEvent{" +
                "failureId='" + failureId + '\'' +
                ", reason='" + reason + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String failureId;
        private String reason;
        private Throwable cause;
        private long timestamp;

        private Builder() {
        }

        public Builder withFailureId(String failureId) {
            this.failureId = failureId;
            return this;
        }

        public Builder withReason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder withCause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public Builder withTimestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public SystemAbortEvent build() {
            return new SystemAbortEvent(failureId, reason, cause, timestamp);
        }
    }
}
