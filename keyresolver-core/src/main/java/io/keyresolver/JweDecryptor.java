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

import java.util.Set;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWEAlgorithm;
import com.nimbusds.jose.crypto.PasswordBasedDecrypter;

/**
 * Decrypts password-encrypted JWEs. Only the PBES2 key management algorithms are accepted, and the PBKDF2 iteration
 * count is capped so that a hostile JWE cannot make decryption arbitrarily expensive.
 */
public final class JweDecryptor {
    private static final RedactedLogger logger = RedactedLogger.getLogger(JweDecryptor.class);

    static final int MAX_ITERATIONS = 1_000_000;
    private static final Set<JWEAlgorithm> PASSWORD_ALGORITHMS = Set.of(
            JWEAlgorithm.PBES2_HS256_A128KW, JWEAlgorithm.PBES2_HS384_A192KW, JWEAlgorithm.PBES2_HS512_A256KW);

    /**
     * Decrypts the given JWE.
     *
     * @param jwe the JWE in any supported serialization.
     * @param password the password.
     * @param source the name of the source, used in error messages.
     * @return the plaintext.
     * @throws UnrecognizedKeyFormatException if the JWE cannot be parsed or is not password-encrypted.
     * @throws AuthenticationFailedException if the password is wrong or the JWE has been tampered with.
     */
    public static byte[] decrypt(byte[] jwe, byte[] password, String source) throws KeyResolutionException {
        var parts = JweSerialization.parse(jwe, source);
        var header = parts.header();
        if (!PASSWORD_ALGORITHMS.contains(header.getAlgorithm())) {
            throw new UnrecognizedKeyFormatException(source, "error decrypting " + source
                    + ": unsupported key management algorithm " + header.getAlgorithm());
        }
        if (header.getPBES2Count() > MAX_ITERATIONS) {
            throw new UnrecognizedKeyFormatException(source, "error decrypting " + source
                    + ": PBES2 iteration count " + header.getPBES2Count() + " exceeds " + MAX_ITERATIONS);
        }
        logger.debug("Decrypting {} with {}/{}", source, header.getAlgorithm(), header.getEncryptionMethod());
        try {
            var decrypter = new PasswordBasedDecrypter(password);
            return decrypter.decrypt(header, parts.encryptedKey(), parts.iv(), parts.cipherText(), parts.authTag());
        } catch (JOSEException e) {
            throw new AuthenticationFailedException(source, "error decrypting " + source, e);
        }
    }

    private JweDecryptor() {}
}
