/*
 * Copyright 2024 Neil Madden.
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

package io.keyresolver;

import static java.util.Objects.requireNonNull;

import java.util.Iterator;
import java.util.List;

/**
 * An ordered JWK Set. Key IDs are not required to be unique; uniqueness is only enforced when a key is
 * {@linkplain KeySetResolver selected} by its ID.
 *
 * @param keys the keys, in document order.
 */
public record JsonWebKeySet(List<JsonWebKey> keys) implements Iterable<JsonWebKey> {
    public JsonWebKeySet {
        keys = List.copyOf(requireNonNull(keys, "keys"));
    }

    public static JsonWebKeySet empty() {
        return new JsonWebKeySet(List.of());
    }

    /**
     * Returns all keys whose {@code kid} equals the given key ID, in document order.
     */
    public List<JsonWebKey> findByKeyId(String keyId) {
        return keys.stream().filter(key -> key.keyId().equals(keyId)).toList();
    }

    public int size() {
        return keys.size();
    }

    @Override
    public Iterator<JsonWebKey> iterator() {
        return keys.iterator();
    }
}
