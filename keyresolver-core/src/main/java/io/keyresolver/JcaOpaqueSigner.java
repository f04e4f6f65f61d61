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

import java.security.GeneralSecurityException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Optional;

/**
 * An {@link OpaqueSigner} backed by a JCA private key, for example one loaded from a PKCS#11 key store.
 */
public final class JcaOpaqueSigner implements OpaqueSigner {
    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    /**
     * Creates a signer.
     *
     * @param privateKey the private key used to sign.
     * @param publicKey the matching public key, or null if it is not known.
     */
    public JcaOpaqueSigner(PrivateKey privateKey, PublicKey publicKey) {
        this.privateKey = requireNonNull(privateKey, "private key");
        this.publicKey = publicKey;
    }

    @Override
    public Optional<PublicKey> publicKey() {
        return Optional.ofNullable(publicKey);
    }

    @Override
    public byte[] sign(String algorithm, byte[] data) throws GeneralSecurityException {
        var jcaAlgorithm = Algorithms.jcaSignatureAlgorithm(algorithm)
                .orElseThrow(() -> new NoSuchAlgorithmException("Unsupported signature algorithm: " + algorithm));
        var signature = Signature.getInstance(jcaAlgorithm);
        signature.initSign(privateKey);
        signature.update(data);
        return signature.sign();
    }

    @Override
    public String toString() {
        return "JcaOpaqueSigner{" + privateKey.getAlgorithm() + "}";
    }
}
