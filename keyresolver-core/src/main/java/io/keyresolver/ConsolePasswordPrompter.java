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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.Console;
import java.io.IOException;
import java.nio.CharBuffer;
import java.util.Arrays;

/**
 * Reads a password from the system console without echoing it.
 */
public final class ConsolePasswordPrompter implements PasswordPrompter {
    private final Console console;

    public ConsolePasswordPrompter() {
        this(System.console());
    }

    ConsolePasswordPrompter(Console console) {
        this.console = console;
    }

    @Override
    public byte[] promptPassword(String prompt) throws IOException {
        if (console == null) {
            throw new IOException("no console available to prompt for a password");
        }
        var chars = console.readPassword("%s: ", prompt);
        if (chars == null) {
            throw new IOException("password prompt cancelled");
        }
        var encoded = UTF_8.encode(CharBuffer.wrap(chars));
        try {
            var password = new byte[encoded.remaining()];
            encoded.get(password);
            return password;
        } finally {
            Arrays.fill(chars, '\0');
            if (encoded.hasArray()) {
                Arrays.fill(encoded.array(), (byte) 0);
            }
        }
    }
}
