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

import java.util.Optional;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

/**
 * Curves of octet key pair ({@code OKP}) JSON Web Keys (RFC 8037).
 */
public enum OkpCurve {
    ED25519("Ed25519"),
    X25519("X25519");

    static final int KEY_SIZE = 32;

    private final String jwkName;

    OkpCurve(String jwkName) {
        this.jwkName = jwkName;
    }

    public String jwkName() {
        return jwkName;
    }

    public static Optional<OkpCurve> forJwkName(String crv) {
        for (var curve : values()) {
            if (curve.jwkName.equals(crv)) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    /**
     * Derives the 32-byte public key from a 32-byte private key (an Ed25519 seed or an X25519 scalar).
     */
    byte[] derivePublicKey(byte[] privateKey) {
        Require.length(privateKey, KEY_SIZE, jwkName + " private key must be " + KEY_SIZE + " bytes");
        return switch (this) {
            case ED25519 -> new Ed25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
            case X25519 -> new X25519PrivateKeyParameters(privateKey, 0).generatePublicKey().getEncoded();
        };
    }
}
