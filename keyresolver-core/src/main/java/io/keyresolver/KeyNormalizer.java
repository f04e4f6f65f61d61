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
 * Turns a parsed key into the key record returned to callers: infers a missing algorithm from the key family and
 * usage, applies the caller's explicit overrides, and assigns thumbprint key IDs to keys that came without one.
 */
public final class KeyNormalizer {
    private static final RedactedLogger logger = RedactedLogger.getLogger(KeyNormalizer.class);

    /**
     * Normalizes a key.
     *
     * @param parsed the key as parsed.
     * @param options the resolve options.
     * @param source the name of the source, used in error messages.
     * @param thumbprintKeyId whether a key without a key ID should get its RFC 7638 thumbprint as key ID. This is
     *                        used for PEM keys, which have no way to carry a key ID.
     * @return the normalized key.
     * @throws KeyValidationException if an algorithm override is not valid for the key family and the options are
     * not {@linkplain ResolveOptions#subtle() subtle}, or if key ID verification is enabled and fails.
     */
    public static JsonWebKey normalize(JsonWebKey parsed, ResolveOptions options, String source,
            boolean thumbprintKeyId) throws KeyValidationException {
        var material = parsed.material();
        var use = options.use().isEmpty() ? parsed.use() : options.use();

        var algorithm = parsed.algorithm();
        if (algorithm.isEmpty() && !options.noDefaults()) {
            algorithm = material.family().map(family -> Algorithms.defaultAlgorithm(family, use)).orElse("");
        }
        if (!options.algorithm().isEmpty()) {
            algorithm = options.algorithm();
            if (!options.subtle() && !isValidOverride(algorithm, material)) {
                throw new KeyValidationException(source, "invalid algorithm " + algorithm + " for "
                        + material.describe() + " on " + source);
            }
        }

        var keyId = parsed.keyId();
        if (!options.keyId().isEmpty()) {
            keyId = options.keyId();
        } else if (keyId.isEmpty() && thumbprintKeyId && !options.noDefaults() && material.publicPart().isPresent()) {
            keyId = Thumbprints.keyId(material);
        }

        var result = parsed.toBuilder().algorithm(algorithm).use(use).keyId(keyId).build();
        if (options.verifyKeyId() && options.keyId().isEmpty()) {
            KeyValidator.verifyKeyId(result, source);
        }
        logger.debug("Resolved {} from {}: alg={}, use={}, kid={}", material, source, algorithm, use, keyId);
        return result;
    }

    private static boolean isValidOverride(String algorithm, KeyMaterial material) {
        var family = material.family();
        if (family.isPresent()) {
            return Algorithms.isSupported(algorithm, family.get());
        }
        // An opaque signer without a usable public key can only be checked against the signature algorithms.
        return Algorithms.jcaSignatureAlgorithm(algorithm).isPresent();
    }

    private KeyNormalizer() {}
}
