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

import java.net.http.HttpClient;

/**
 * Resolves key sources into validated {@link JsonWebKey} records.
 * <p>
 * A source may hold a single JWK, a JWK Set, a password-encrypted JWE wrapping either of those, a PEM container,
 * or raw bytes to be used as a symmetric key when a symmetric algorithm is given in the options. The format is
 * detected by {@link FormatClassifier}; encrypted data is decrypted once by {@link DecryptionCascade} and the
 * plaintext classified again; the resulting key is completed by {@link KeyNormalizer}.
 * <p>
 * Every call reads its source afresh and returns a new record; nothing is cached. A resolver has no mutable state
 * and can be shared between threads, although its password prompter may block while it waits for input.
 * <pre>{@code
 * var resolver = KeyResolver.create();
 * var key = resolver.resolveKey("keys/signing.pem", ResolveOptions.builder()
 *         .passwordFile(Path.of("keys/password.txt"))
 *         .build());
 * }</pre>
 */
public final class KeyResolver {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyResolver.class);
    private static final String DATA_SOURCE = "data";

    private final ByteFetcher byteFetcher;
    private final DecryptionCascade cascade;

    private KeyResolver(Builder builder) {
        this.byteFetcher = builder.byteFetcher != null ? builder.byteFetcher
                : new HttpsByteFetcher(builder.httpClient != null ? builder.httpClient : HttpClient.newHttpClient());
        this.cascade = new DecryptionCascade(builder.passwordPrompter);
    }

    /**
     * Creates a resolver that fetches remote sources with a default {@link HttpClient} and prompts for passwords on
     * the console.
     */
    public static KeyResolver create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a single key from a file path or {@code https://} URL.
     *
     * @see #resolveKey(KeySource, ResolveOptions)
     */
    public JsonWebKey resolveKey(String location, ResolveOptions options) throws KeyResolutionException {
        return resolveKey(KeySource.parse(location), options);
    }

    /**
     * Resolves a single key.
     *
     * @param source the key source.
     * @param options the resolve options.
     * @return the key.
     * @throws KeyResolutionException if the key cannot be resolved. The subclass identifies the reason.
     */
    public JsonWebKey resolveKey(KeySource source, ResolveOptions options) throws KeyResolutionException {
        requireNonNull(options, "options");
        var data = source.read(byteFetcher);
        return parseKey(data, options, source.name());
    }

    /**
     * Resolves the key with the key ID given in the options from a key set at a file path or {@code https://} URL.
     *
     * @see #resolveKeySet(KeySource, ResolveOptions)
     */
    public JsonWebKey resolveKeySet(String location, ResolveOptions options) throws KeyResolutionException {
        return resolveKeySet(KeySource.parse(location), options);
    }

    /**
     * Resolves one key from a key set. The options must carry the key ID of the key to select.
     *
     * @param source the key set source.
     * @param options the resolve options.
     * @return the selected key.
     * @throws ConfigurationException if the options carry no key ID.
     * @throws KeyNotFoundException if no key has the key ID, including when the set is empty.
     * @throws AmbiguousKeyException if more than one key has the key ID.
     * @throws KeyResolutionException for any other failure.
     */
    public JsonWebKey resolveKeySet(KeySource source, ResolveOptions options) throws KeyResolutionException {
        requireKeyId(options, source.name());
        var data = source.read(byteFetcher);
        return parseKeySet(data, options, source.name());
    }

    /**
     * Parses a single key from in-memory data.
     */
    public JsonWebKey parseKey(byte[] data, ResolveOptions options) throws KeyResolutionException {
        return parseKey(data, options, DATA_SOURCE);
    }

    /**
     * Selects one key from an in-memory key set.
     */
    public JsonWebKey parseKeySet(byte[] data, ResolveOptions options) throws KeyResolutionException {
        requireKeyId(options, DATA_SOURCE);
        return parseKeySet(data, options, DATA_SOURCE);
    }

    private JsonWebKey parseKey(byte[] data, ResolveOptions options, String source) throws KeyResolutionException {
        var unwrapped = cascade.unwrap(data, options, source, false);
        return switch (unwrapped.format()) {
            case SINGLE_KEY -> KeyNormalizer.normalize(JwkCodec.parseKey(unwrapped.data(), source), options, source,
                    false);
            case TEXTUAL -> {
                var decoded = PemDecoder.decode(unwrapped.data(), cascade.passwordSource(options, source), source);
                var key = JsonWebKey.builder(decoded.material()).certificates(decoded.certificates()).build();
                yield KeyNormalizer.normalize(key, options, source, true);
            }
            case RAW_SECRET -> KeyNormalizer.normalize(rawSecret(unwrapped.data(), source), options, source, false);
            case KEY_SET -> throw new UnrecognizedKeyFormatException(source, "error reading " + source
                    + ": found a key set where a single key was expected");
            case ENCRYPTED -> throw new IllegalStateException("Encrypted data left after decryption");
        };
    }

    private JsonWebKey parseKeySet(byte[] data, ResolveOptions options, String source)
            throws KeyResolutionException {
        var unwrapped = cascade.unwrap(data, options, source, true);
        if (unwrapped.format() != KeyFormat.KEY_SET) {
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": not a key set");
        }
        var keySet = JwkCodec.parseKeySet(unwrapped.data(), source);
        logger.debug("Read {} keys from {}", keySet.size(), source);
        return KeySetResolver.select(keySet, options, source);
    }

    private static JsonWebKey rawSecret(byte[] data, String source) throws KeyValidationException {
        if (data.length == 0) {
            throw new KeyValidationException(source, "error reading " + source + ": empty symmetric key");
        }
        return JsonWebKey.builder(KeyMaterial.secret(data)).build();
    }

    private static void requireKeyId(ResolveOptions options, String source) throws ConfigurationException {
        if (requireNonNull(options, "options").keyId().isEmpty()) {
            throw new ConfigurationException(source, "missing kid option: a key ID is required to select a key from "
                    + source);
        }
    }

    public static final class Builder {
        private HttpClient httpClient;
        private ByteFetcher byteFetcher;
        private PasswordPrompter passwordPrompter = new ConsolePasswordPrompter();

        private Builder() {}

        /**
         * The HTTP client used to fetch {@code https://} sources. Ignored if a byte fetcher is set.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = requireNonNull(httpClient, "httpClient");
            return this;
        }

        /**
         * Replaces how remote sources are fetched.
         */
        public Builder byteFetcher(ByteFetcher byteFetcher) {
            this.byteFetcher = requireNonNull(byteFetcher, "byteFetcher");
            return this;
        }

        /**
         * The prompter used for encrypted sources when the options configure no password source.
         */
        public Builder passwordPrompter(PasswordPrompter passwordPrompter) {
            this.passwordPrompter = requireNonNull(passwordPrompter, "passwordPrompter");
            return this;
        }

        public KeyResolver build() {
            return new KeyResolver(this);
        }
    }
}
