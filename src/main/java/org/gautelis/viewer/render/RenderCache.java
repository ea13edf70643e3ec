/*
 * Copyright (C) 2021 Frode Randers
 * All rights reserved
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.gautelis.viewer.render;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.gautelis.viewer.NotFoundException;

import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * Bounded cache of rendered results keyed by value. Entries are never expired
 * on time; once the cache is full, the least recently used entries are evicted.
 * Safe for concurrent use. Concurrent loads of the same key compute it once.
 */
public class RenderCache<K, V> {

    public interface Loader<V> {
        V load() throws NotFoundException;
    }

    private final Cache<K, V> cache;
    private final long maximumSize;

    public RenderCache(long maximumSize) {
        if (maximumSize < 0) {
            throw new IllegalArgumentException("Cache size must not be negative: " + maximumSize);
        }
        this.maximumSize = maximumSize;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .build();
    }

    public V get(K key, Loader<? extends V> loader) throws NotFoundException {
        try {
            return cache.get(key, loader::load);

        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NotFoundException) {
                throw (NotFoundException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new RuntimeException("Failed to render: " + cause.getMessage(), cause);

        } catch (ExecutionError ee) {
            throw (Error) ee.getCause();
        }
    }

    public Optional<V> getIfPresent(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public boolean contains(K key) {
        return null != cache.getIfPresent(key);
    }

    /**
     * Stores value unless key is already present; the first writer wins.
     *
     * @return the value now associated with key
     */
    public V putIfAbsent(K key, V value) {
        V existing = cache.asMap().putIfAbsent(key, value);
        return null == existing ? value : existing;
    }

    public long size() {
        cache.cleanUp();
        return cache.size();
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
