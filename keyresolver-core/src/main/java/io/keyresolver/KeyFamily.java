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
 * The closed set of key families that algorithm inference and validation distinguish between.
 */
public enum KeyFamily {
    OCT("oct"),
    EC_P256("EC"),
    EC_P384("EC"),
    EC_P521("EC"),
    RSA("RSA"),
    ED25519("OKP"),
    X25519("OKP");

    private final String keyType;

    KeyFamily(String keyType) {
        this.keyType = keyType;
    }

    /**
     * The JWK {@code kty} value of keys in this family.
     */
    public String keyType() {
        return keyType;
    }

    static KeyFamily of(EcCurve curve) {
        return switch (curve) {
            case P_256 -> EC_P256;
            case P_384 -> EC_P384;
            case P_521 -> EC_P521;
        };
    }

    static KeyFamily of(OkpCurve curve) {
        return switch (curve) {
            case ED25519 -> ED25519;
            case X25519 -> X25519;
        };
    }
}
