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

package io.devpodctl.common.util.log;

/**
 * Source of named session logs.
 */
public interface SessionLogs {

    /**
     * Console log, with each line prefixed by the colorized name.
     */
    SessionLog newConsoleLog(String name);

    /**
     * Persistent log dedicated to the given name. The same instance is returned for the same name.
     */
    SessionLog getFileLog(String name);

    /**
     * Union of the console and the persistent log for the given name.
     */
    default SessionLog newSessionLog(String name) {
        return new UnionSessionLog(newConsoleLog(name), getFileLog(name));
    }
}
