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

package io.devpodctl.common.util.concurrent;

import java.util.concurrent.locks.Lock;

/**
 * Issues a stable lock per string key. Callers use it to serialize operations on a named resource,
 * without holding a global lock.
 */
public interface LockFactory {

    /**
     * Returns the lock associated with the given key. Repeated calls with the same key return the same
     * lock instance for the lifetime of the factory.
     */
    Lock getLock(String key);
}
