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

import java.util.Objects;

/**
 * Base class of all errors raised while resolving a key. Every error names the source that was being resolved (a
 * file path, a URL or the name given to an in-memory buffer) so that failures are actionable without revealing any
 * key material. Errors are terminal for the call that raised them: nothing is retried internally.
 */
public class KeyResolutionException extends Exception {
    private final String source;

    public KeyResolutionException(String source, String message) {
        super(message);
        this.source = Objects.requireNonNull(source, "source");
    }

    public KeyResolutionException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = Objects.requireNonNull(source, "source");
    }

    /**
     * The file path, URL or buffer name that was being resolved when the error occurred.
     *
     * @return the source identifier.
     */
    public String source() {
        return source;
    }
}
