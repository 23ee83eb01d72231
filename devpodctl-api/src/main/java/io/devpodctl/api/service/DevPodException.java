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

package io.devpodctl.api.service;

import java.time.Duration;

import static java.lang.String.format;

public class DevPodException extends RuntimeException {

    public enum ErrorCode {
        /**
         * A session is already alive for the requested dev pod name.
         */
        AlreadyExists,

        /**
         * Connection to the cluster was lost. Sessions terminated with this error are restarted automatically.
         */
        LostConnection,

        /**
         * Invalid port mapping configuration.
         */
        InvalidPortMapping,

        ConfigurationMissing,

        PodSelectionFailed,

        PortForwardingFailed,

        PortForwardingTimeout,

        /**
         * A dev pod session terminated with an error that has no more specific classification.
         */
        SessionFailed,

        /**
         * The process cannot continue. Only the top-level entry point may act on it.
         */
        Fatal
    }

    private final ErrorCode errorCode;

    private DevPodException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    private DevPodException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public static boolean hasErrorCode(Throwable error, ErrorCode errorCode) {
        return (error instanceof DevPodException) && ((DevPodException) error).getErrorCode() == errorCode;
    }

    /**
     * Returns true if the error is a lost connection, possibly wrapped by another exception.
     */
    public static boolean isLostConnection(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (hasErrorCode(current, ErrorCode.LostConnection)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    public static DevPodException alreadyExists(String name) {
        return new DevPodException(
                ErrorCode.AlreadyExists,
                format("Dev pod %s already exists, please make sure to stop the dev pod before rerunning it", name)
        );
    }

    public static DevPodException lostConnection(String name, Throwable cause) {
        return new DevPodException(ErrorCode.LostConnection, format("Lost connection to dev pod %s", name), cause);
    }

    public static DevPodException undefinedLocalPort(int mappingIndex) {
        return new DevPodException(ErrorCode.InvalidPortMapping, format("Port is not defined in port mapping %s", mappingIndex));
    }

    public static DevPodException configurationMissing(String what) {
        return new DevPodException(ErrorCode.ConfigurationMissing, format("%s is not set", what));
    }

    public static DevPodException podSelectionFailed(Throwable cause) {
        return new DevPodException(ErrorCode.PodSelectionFailed, "Error selecting pod: " + cause.getMessage(), cause);
    }

    public static DevPodException portForwardingFailed(String message, Throwable cause) {
        return new DevPodException(ErrorCode.PortForwardingFailed, message + ": " + cause.getMessage(), cause);
    }

    public static DevPodException portForwardingTimeout(Duration timeout) {
        return new DevPodException(
                ErrorCode.PortForwardingTimeout,
                format("Timeout waiting for port forwarding to start (%sms)", timeout.toMillis())
        );
    }

    public static DevPodException sessionFailed(String name, Throwable cause) {
        return new DevPodException(ErrorCode.SessionFailed, format("Dev pod %s failed: %s", name, cause.getMessage()), cause);
    }

    public static DevPodException fatal(String message, Throwable cause) {
        return new DevPodException(ErrorCode.Fatal, message, cause);
    }
}
