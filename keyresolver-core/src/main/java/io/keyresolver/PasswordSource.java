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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Where the password for an encrypted key comes from. Passwords are only obtained when encrypted content is actually
 * encountered, so a file is not read and a prompt is not shown for plaintext keys.
 */
public sealed interface PasswordSource {

    /**
     * Obtains the password.
     *
     * @param source the name of the encrypted source, used in error messages.
     * @return a fresh copy of the password that the caller must wipe after use.
     * @throws KeySourceException if the password could not be read or the prompt failed.
     * @throws AuthenticationFailedException if the password is empty.
     */
    byte[] obtain(String source) throws KeyResolutionException;

    static PasswordSource literal(byte[] password) {
        return new Literal(password);
    }

    static PasswordSource file(Path path) {
        return new File(path);
    }

    static PasswordSource prompt(String prompt, PasswordPrompter prompter) {
        return new Prompt(prompt, prompter);
    }

    record Literal(byte[] password) implements PasswordSource {
        public Literal {
            password = password.clone();
        }

        @Override
        public byte[] obtain(String source) throws KeyResolutionException {
            return requireNonEmpty(password.clone(), source);
        }

        @Override
        public byte[] password() {
            return password.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Literal that && Arrays.equals(password, that.password);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(password);
        }

        @Override
        public String toString() {
            return "Literal[<redacted>]";
        }
    }

    /**
     * A password stored in a file. Trailing carriage returns and line feeds are stripped; any other whitespace is
     * part of the password.
     */
    record File(Path path) implements PasswordSource {
        public File {
            requireNonNull(path, "path");
        }

        @Override
        public byte[] obtain(String source) throws KeyResolutionException {
            byte[] contents;
            try {
                contents = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new KeySourceException(source, "error reading password file " + path + " for " + source, e);
            }
            int length = contents.length;
            while (length > 0 && (contents[length - 1] == '\n' || contents[length - 1] == '\r')) {
                length--;
            }
            var password = Arrays.copyOf(contents, length);
            Utils.wipe(contents);
            return requireNonEmpty(password, source);
        }
    }

    record Prompt(String prompt, PasswordPrompter prompter) implements PasswordSource {
        public Prompt {
            requireNonNull(prompt, "prompt");
            requireNonNull(prompter, "prompter");
        }

        @Override
        public byte[] obtain(String source) throws KeyResolutionException {
            byte[] password;
            try {
                password = prompter.promptPassword(prompt);
            } catch (IOException e) {
                throw new KeySourceException(source, "error reading password for " + source + ": " + e.getMessage(), e);
            }
            if (password == null) {
                throw new KeySourceException(source, "error reading password for " + source + ": no password given");
            }
            return requireNonEmpty(password, source);
        }
    }

    private static byte[] requireNonEmpty(byte[] password, String source) throws AuthenticationFailedException {
        if (password.length == 0) {
            throw new AuthenticationFailedException(source, "error decrypting " + source + ": empty password");
        }
        return password;
    }
}
