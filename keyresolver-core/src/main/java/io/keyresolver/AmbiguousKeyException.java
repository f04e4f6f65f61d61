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
 * Raised when more than one key in a key set carries the requested key ID. Duplicates are never resolved by
 * position.
 */
public class AmbiguousKeyException extends KeyResolutionException {
    private final String keyId;
    private final int matches;

    public AmbiguousKeyException(String source, String keyId, int matches) {
        super(source, "multiple keys with kid " + keyId + " have been found on " + source);
        this.keyId = keyId;
        this.matches = matches;
    }

    public String keyId() {
        return keyId;
    }

    public int matches() {
        return matches;
    }
}
