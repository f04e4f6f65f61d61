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
 * Raised when no key in a key set carries the requested key ID.
 */
public class KeyNotFoundException extends KeyResolutionException {
    private final String keyId;

    public KeyNotFoundException(String source, String keyId) {
        super(source, "cannot find key with kid " + keyId + " on " + source);
        this.keyId = keyId;
    }

    public String keyId() {
        return keyId;
    }
}
