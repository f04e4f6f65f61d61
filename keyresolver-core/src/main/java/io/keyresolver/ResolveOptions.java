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

import java.nio.file.Path;
import java.util.Optional;

/**
 * Caller-supplied options that steer how a key is resolved: where a decryption password comes from, and explicit
 * values for the algorithm, usage and key ID that override whatever the key itself declares or would otherwise be
 * inferred. Instances are immutable and created with {@link #builder()}.
 */
public final class ResolveOptions {
    private static final ResolveOptions DEFAULTS = new ResolveOptions(new Builder());

    private final PasswordSource passwordSource;
    private final String algorithm;
    private final String use;
    private final String keyId;
    private final boolean subtle;
    private final boolean noDefaults;
    private final boolean verifyKeyId;

    private ResolveOptions(Builder builder) {
        this.passwordSource = builder.passwordSource;
        this.algorithm = builder.algorithm;
        this.use = builder.use;
        this.keyId = builder.keyId;
        this.subtle = builder.subtle;
        this.noDefaults = builder.noDefaults;
        this.verifyKeyId = builder.verifyKeyId;
    }

    /**
     * The empty option set: every value is inferred and the resolver's default prompter supplies any password.
     */
    public static ResolveOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The explicitly configured password source, if any.
     */
    public Optional<PasswordSource> passwordSource() {
        return Optional.ofNullable(passwordSource);
    }

    /**
     * The algorithm override, or the empty string.
     */
    public String algorithm() {
        return algorithm;
    }

    /**
     * The usage override ({@code sig} or {@code enc}), or the empty string.
     */
    public String use() {
        return use;
    }

    /**
     * The key ID override, or the empty string. Required when resolving a key set.
     */
    public String keyId() {
        return keyId;
    }

    public boolean subtle() {
        return subtle;
    }

    public boolean noDefaults() {
        return noDefaults;
    }

    public boolean verifyKeyId() {
        return verifyKeyId;
    }

    @Override
    public String toString() {
        return "ResolveOptions{" +
                "passwordSource=" + (passwordSource == null ? "default" : passwordSource.getClass().getSimpleName()) +
                ", algorithm='" + algorithm + '\'' +
                ", use='" + use + '\'' +
                ", keyId='" + keyId + '\'' +
                ", subtle=" + subtle +
                ", noDefaults=" + noDefaults +
                ", verifyKeyId=" + verifyKeyId +
                '}';
    }

    public static final class Builder {
        private PasswordSource passwordSource;
        private int passwordSourceCount;
        private String algorithm = "";
        private String use = "";
        private String keyId = "";
        private boolean subtle;
        private boolean noDefaults;
        private boolean verifyKeyId;

        private Builder() {}

        /**
         * Decrypt with the given password. The array is copied.
         */
        public Builder password(byte[] password) {
            return passwordSource(PasswordSource.literal(requireNonNull(password, "password")));
        }

        /**
         * Decrypt with the password stored in the given file. The file is only read if encrypted content is found.
         */
        public Builder passwordFile(Path passwordFile) {
            return passwordSource(PasswordSource.file(passwordFile));
        }

        /**
         * Obtain the password from the given prompter, showing it the given prompt.
         */
        public Builder passwordPrompter(String prompt, PasswordPrompter prompter) {
            return passwordSource(PasswordSource.prompt(prompt, prompter));
        }

        private Builder passwordSource(PasswordSource source) {
            this.passwordSource = source;
            this.passwordSourceCount++;
            return this;
        }

        public Builder alg(String algorithm) {
            this.algorithm = requireNonNull(algorithm, "algorithm");
            return this;
        }

        public Builder use(String use) {
            this.use = requireNonNull(use, "use");
            return this;
        }

        public Builder kid(String keyId) {
            this.keyId = requireNonNull(keyId, "keyId");
            return this;
        }

        /**
         * Accept an algorithm override verbatim even if it is not recognized for the key's family.
         */
        public Builder subtle(boolean subtle) {
            this.subtle = subtle;
            return this;
        }

        /**
         * Suppress inference of the algorithm and of thumbprint key IDs.
         */
        public Builder noDefaults(boolean noDefaults) {
            this.noDefaults = noDefaults;
            return this;
        }

        /**
         * Reject private keys whose declared key ID differs from their RFC 7638 thumbprint.
         */
        public Builder verifyKeyId(boolean verifyKeyId) {
            this.verifyKeyId = verifyKeyId;
            return this;
        }

        /**
         * Builds the options.
         *
         * @throws ConfigurationException if more than one password source was configured or the usage is not
         * {@code sig}, {@code enc} or empty.
         */
        public ResolveOptions build() throws ConfigurationException {
            if (passwordSourceCount > 1) {
                throw new ConfigurationException("options",
                        "only one of password, passwordFile or passwordPrompter can be set");
            }
            if (!use.isEmpty() && !use.equals(Algorithms.USE_SIGNATURE) && !use.equals(Algorithms.USE_ENCRYPTION)) {
                throw new ConfigurationException("options", "unsupported use " + use + ": must be sig or enc");
            }
            return new ResolveOptions(this);
        }
    }
}
