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
 * The representations a key source can be in.
 */
public enum KeyFormat {
    /** A single JWK. */
    SINGLE_KEY,
    /** A JWK Set. */
    KEY_SET,
    /** A password-encrypted JWE in compact or JSON serialization. */
    ENCRYPTED,
    /** A PEM container. */
    TEXTUAL,
    /** Raw bytes to be used as a symmetric secret. */
    RAW_SECRET
}
