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

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.Optional;

/**
 * A signer whose private key is not directly accessible, for example because it lives in a hardware token or a
 * key management service. Algorithm inference only looks at the public key.
 */
public interface OpaqueSigner {

    /**
     * The public key corresponding to the signing key, if it is known.
     */
    Optional<PublicKey> publicKey();

    /**
     * Signs the given data.
     *
     * @param algorithm the JWS algorithm identifier, such as {@code ES256}.
     * @param data the data to sign.
     * @return the signature in JWS format.
     * @throws GeneralSecurityException if the signature could not be computed.
     */
    byte[] sign(String algorithm, byte[] data) throws GeneralSecurityException;
}
