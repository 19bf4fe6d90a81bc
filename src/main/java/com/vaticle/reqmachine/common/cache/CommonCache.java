/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.reqmachine.common.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

public class CommonCache<KEY, VALUE> {

    private static final int CACHE_SIZE = 10_000;
    private final Cache<KEY, VALUE> cache;

    public CommonCache() {
        cache = Caffeine.newBuilder().maximumSize(CACHE_SIZE).build();
    }

    public void put(KEY key, VALUE value) {
        cache.put(key, value);
    }

    public VALUE getIfPresent(KEY key) { return cache.getIfPresent(key); }

    public void clear() {
        cache.invalidateAll();
    }
}
