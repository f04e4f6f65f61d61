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
 * Consistency checks on a parsed key that go beyond what {@link JwkCodec} enforces structurally.
 */
public final class KeyValidator {

    /**
     * Checks that the key's usage is {@code sig}, {@code enc} or empty, and that any declared algorithm is
     * recognized for the key's family.
     *
     * @param key the key to validate.
     * @param source the name of the source the key was read from.
     * @throws KeyValidationException if a check fails.
     */
    public static void validate(JsonWebKey key, String source) throws KeyValidationException {
        var use = key.use();
        if (!use.isEmpty() && !use.equals(Algorithms.USE_SIGNATURE) && !use.equals(Algorithms.USE_ENCRYPTION)) {
            throw new KeyValidationException(source, "invalid JWK on " + source + ": unsupported use " + use);
        }
        var algorithm = key.algorithm();
        var family = key.material().family();
        if (!algorithm.isEmpty() && family.isPresent() && !Algorithms.isSupported(algorithm, family.get())) {
            throw new KeyValidationException(source, "invalid JWK on " + source + ": algorithm " + algorithm
                    + " is not valid for " + key.material().describe());
        }
    }

    /**
     * Checks that a private key's declared key ID equals its RFC 7638 SHA-256 thumbprint. Public keys, symmetric
     * keys, opaque signers and keys without a key ID pass unchecked.
     *
     * @param key the key to check.
     * @param source the name of the source the key was read from.
     * @throws KeyValidationException if the key ID does not match the thumbprint.
     */
    public static void verifyKeyId(JsonWebKey key, String source) throws KeyValidationException {
        var material = key.material();
        if (key.keyId().isEmpty() || material.isPublic() || material instanceof KeyMaterial.Secret
                || material instanceof KeyMaterial.Opaque) {
            return;
        }
        if (!key.keyId().equals(Thumbprints.keyId(material))) {
            throw new KeyValidationException(source, "invalid JWK on " + source + ": kid " + key.keyId()
                    + " does not match the key thumbprint");
        }
    }

    private KeyValidator() {}
}
