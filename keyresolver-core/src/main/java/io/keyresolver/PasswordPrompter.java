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

import java.io.IOException;

/**
 * Interactively obtains a password, typically from a human operator.
 */
@FunctionalInterface
public interface PasswordPrompter {
    /**
     * Asks for a password.
     *
     * @param prompt a human-readable prompt naming the resource that needs the password.
     * @return the password bytes. The caller wipes the returned array after use.
     * @throws IOException if no password could be obtained, including when the user cancels the prompt.
     */
    byte[] promptPassword(String prompt) throws IOException;
}
