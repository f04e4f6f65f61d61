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

/**
 * Selects a single key from a key set by its key ID.
 */
public final class KeySetResolver {

    /**
     * Selects the one key in the set whose key ID equals {@link ResolveOptions#keyId()} and normalizes it. The
     * options' key ID equals the selected key's, so it never changes the result; any algorithm and usage
     * overrides still apply.
     *
     * @param keySet the key set.
     * @param options the resolve options, which must carry a key ID.
     * @param source the name of the source, used in error messages.
     * @return the selected key.
     * @throws ConfigurationException if the options carry no key ID.
     * @throws KeyNotFoundException if no key has the key ID.
     * @throws AmbiguousKeyException if more than one key has the key ID.
     * @throws KeyValidationException if normalization fails.
     */
    public static JsonWebKey select(JsonWebKeySet keySet, ResolveOptions options, String source)
            throws KeyResolutionException {
        var keyId = options.keyId();
        if (keyId.isEmpty()) {
            throw new ConfigurationException(source, "missing kid option: a key ID is required to select a key from "
                    + source);
        }
        var matches = keySet.findByKeyId(keyId);
        if (matches.isEmpty()) {
            throw new KeyNotFoundException(source, keyId);
        }
        if (matches.size() > 1) {
            throw new AmbiguousKeyException(source, keyId, matches.size());
        }
        return KeyNormalizer.normalize(matches.get(0), options, source, false);
    }

    private KeySetResolver() {}
}
