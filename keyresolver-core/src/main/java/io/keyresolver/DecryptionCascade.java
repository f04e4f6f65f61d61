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

/**
 * Classifies key data and, if it is encrypted, decrypts it and classifies the plaintext again. At most
 * {@value #MAX_DECRYPTIONS} decryption is performed, so plaintext that is itself encrypted is rejected rather than
 * decrypted again.
 */
public final class DecryptionCascade {
    private static final RedactedLogger logger = RedactedLogger.getLogger(DecryptionCascade.class);

    static final int MAX_DECRYPTIONS = 1;

    private final PasswordPrompter defaultPrompter;

    /**
     * Creates a cascade.
     *
     * @param defaultPrompter the prompter used when the options configure no password source.
     */
    public DecryptionCascade(PasswordPrompter defaultPrompter) {
        this.defaultPrompter = requireNonNull(defaultPrompter, "defaultPrompter");
    }

    /**
     * Key data together with its classification.
     *
     * @param format the format of the data, never {@link KeyFormat#ENCRYPTED}.
     * @param data the data, decrypted if the original was encrypted.
     * @param decrypted whether a decryption pass took place.
     */
    public record Unwrapped(KeyFormat format, byte[] data, boolean decrypted) {}

    /**
     * Classifies the data, decrypting it if necessary.
     *
     * @param data the key data.
     * @param options the resolve options.
     * @param source the name of the source, used in error messages.
     * @param keySet whether a key set is expected.
     * @return the classified, decrypted data.
     * @throws UnrecognizedKeyFormatException if the data or the decrypted plaintext cannot be classified, or the
     * plaintext is encrypted again.
     * @throws AuthenticationFailedException if decryption fails.
     * @throws KeySourceException if the password cannot be obtained.
     */
    public Unwrapped unwrap(byte[] data, ResolveOptions options, String source, boolean keySet)
            throws KeyResolutionException {
        var current = data;
        int decryptions = 0;
        while (true) {
            var format = FormatClassifier.classify(current, options, source, keySet);
            if (format != KeyFormat.ENCRYPTED) {
                return new Unwrapped(format, current, decryptions > 0);
            }
            if (decryptions >= MAX_DECRYPTIONS) {
                throw new UnrecognizedKeyFormatException(source, "error reading " + source
                        + ": nested encryption is not supported");
            }
            current = decrypt(current, options, source);
            decryptions++;
            logger.debug("Decryption pass {} on {} produced {} bytes", decryptions, source, current.length);
        }
    }

    /**
     * Decrypts a JWE with the password from the configured source.
     */
    public byte[] decrypt(byte[] jwe, ResolveOptions options, String source) throws KeyResolutionException {
        var password = passwordSource(options, source).obtain(source);
        try {
            return JweDecryptor.decrypt(jwe, password, source);
        } finally {
            Utils.wipe(password);
        }
    }

    /**
     * The password source for the given options: the configured one, or else a prompt with the default prompter.
     */
    public PasswordSource passwordSource(ResolveOptions options, String source) {
        return options.passwordSource()
                .orElseGet(() -> PasswordSource.prompt(defaultPrompt(source), defaultPrompter));
    }

    static String defaultPrompt(String source) {
        return "Please enter the password to decrypt " + source;
    }
}
