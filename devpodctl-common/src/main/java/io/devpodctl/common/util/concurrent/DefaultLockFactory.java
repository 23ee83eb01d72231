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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.inject.Singleton;

import com.google.common.base.Preconditions;

/**
 * {@link LockFactory} backed by a concurrent map. Lock entries are created lazily and are never removed, so
 * the key space must stay bounded (dev pod names coming from the configuration are).
 */
@Singleton
public class DefaultLockFactory implements LockFactory {

    private final ConcurrentMap<String, Lock> locks = new ConcurrentHashMap<>();

    @Override
    public Lock getLock(String key) {
        Preconditions.checkNotNull(key, "Lock key is null");
        return locks.computeIfAbsent(key, k -> new ReentrantLock());
    }

    int size() {
        return locks.size();
    }
}
