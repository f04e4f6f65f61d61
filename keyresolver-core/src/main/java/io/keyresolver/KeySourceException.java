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
 * Raised when the bytes of a source could not be read: a missing file, an unreadable password file, a failed or
 * cancelled password prompt, or a network failure.
 */
public class KeySourceException extends KeyResolutionException {

    public KeySourceException(String source, String message) {
        super(source, message);
    }

    public KeySourceException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
