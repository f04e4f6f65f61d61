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

import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A resolved JSON Web Key: key material plus the optional JWK metadata. Absent string members are represented by
 * the empty string and absent certificate members by an empty list or array, never by null, so that two keys can
 * always be compared with {@link #equals(Object)}.
 * <p>
 * Instances are immutable. Every call to {@link KeyResolver} creates new instances and hands them to the caller.
 */
public final class JsonWebKey {
    private static final byte[] EMPTY = new byte[0];

    private final KeyMaterial material;
    private final String algorithm;
    private final String use;
    private final String keyId;
    private final List<X509Certificate> certificates;
    private final byte[] certificateThumbprintSha1;
    private final byte[] certificateThumbprintSha256;

    private JsonWebKey(Builder builder) {
        this.material = requireNonNull(builder.material, "key material");
        this.algorithm = builder.algorithm;
        this.use = builder.use;
        this.keyId = builder.keyId;
        this.certificates = List.copyOf(builder.certificates);
        this.certificateThumbprintSha1 = builder.certificateThumbprintSha1.clone();
        this.certificateThumbprintSha256 = builder.certificateThumbprintSha256.clone();
    }

    public static Builder builder(KeyMaterial material) {
        return new Builder(material);
    }

    public Builder toBuilder() {
        return new Builder(material)
                .algorithm(algorithm)
                .use(use)
                .keyId(keyId)
                .certificates(certificates)
                .certificateThumbprintSha1(certificateThumbprintSha1)
                .certificateThumbprintSha256(certificateThumbprintSha256);
    }

    public KeyMaterial material() {
        return material;
    }

    /**
     * The {@code alg} member, or the empty string.
     */
    public String algorithm() {
        return algorithm;
    }

    /**
     * The {@code use} member: {@code sig}, {@code enc} or the empty string.
     */
    public String use() {
        return use;
    }

    /**
     * The {@code kid} member, or the empty string.
     */
    public String keyId() {
        return keyId;
    }

    /**
     * The {@code x5c} certificate chain, leaf first. Empty if absent.
     */
    public List<X509Certificate> certificates() {
        return certificates;
    }

    /**
     * The {@code x5t} SHA-1 certificate thumbprint. Empty if absent.
     */
    public byte[] certificateThumbprintSha1() {
        return certificateThumbprintSha1.clone();
    }

    /**
     * The {@code x5t#S256} SHA-256 certificate thumbprint. Empty if absent.
     */
    public byte[] certificateThumbprintSha256() {
        return certificateThumbprintSha256.clone();
    }

    /**
     * Returns true if this key only contains public key material.
     */
    public boolean isPublic() {
        return material.isPublic();
    }

    /**
     * Returns a copy of this key with all private components removed.
     *
     * @throws IllegalStateException if the key has no public part, such as a symmetric key.
     */
    public JsonWebKey toPublic() {
        var publicPart = material.publicPart()
                .orElseThrow(() -> new IllegalStateException("Key has no public part: " + material.describe()));
        return toBuilder().material(publicPart).build();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof JsonWebKey)) { return false; }
        JsonWebKey that = (JsonWebKey) other;
        return this.material.equals(that.material)
                && this.algorithm.equals(that.algorithm)
                && this.use.equals(that.use)
                && this.keyId.equals(that.keyId)
                && this.certificates.equals(that.certificates)
                && Arrays.equals(this.certificateThumbprintSha1, that.certificateThumbprintSha1)
                && Arrays.equals(this.certificateThumbprintSha256, that.certificateThumbprintSha256);
    }

    @Override
    public int hashCode() {
        return Objects.hash(material, algorithm, use, keyId, certificates,
                Arrays.hashCode(certificateThumbprintSha1), Arrays.hashCode(certificateThumbprintSha256));
    }

    @Override
    public String toString() {
        return "JsonWebKey{" +
                "material=" + material.describe() +
                ", alg='" + algorithm + '\'' +
                ", use='" + use + '\'' +
                ", kid='" + keyId + '\'' +
                ", certificates=" + certificates.size() +
                '}';
    }

    public static final class Builder {
        private KeyMaterial material;
        private String algorithm = "";
        private String use = "";
        private String keyId = "";
        private List<X509Certificate> certificates = List.of();
        private byte[] certificateThumbprintSha1 = EMPTY;
        private byte[] certificateThumbprintSha256 = EMPTY;

        private Builder(KeyMaterial material) {
            this.material = requireNonNull(material, "key material");
        }

        public Builder material(KeyMaterial material) {
            this.material = requireNonNull(material, "key material");
            return this;
        }

        public Builder algorithm(String algorithm) {
            this.algorithm = Objects.requireNonNullElse(algorithm, "");
            return this;
        }

        public Builder use(String use) {
            this.use = Objects.requireNonNullElse(use, "");
            return this;
        }

        public Builder keyId(String keyId) {
            this.keyId = Objects.requireNonNullElse(keyId, "");
            return this;
        }

        public Builder certificates(List<X509Certificate> certificates) {
            this.certificates = List.copyOf(requireNonNull(certificates, "certificates"));
            return this;
        }

        public Builder certificateThumbprintSha1(byte[] thumbprint) {
            this.certificateThumbprintSha1 = thumbprint == null ? EMPTY : thumbprint.clone();
            return this;
        }

        public Builder certificateThumbprintSha256(byte[] thumbprint) {
            this.certificateThumbprintSha256 = thumbprint == null ? EMPTY : thumbprint.clone();
            return this;
        }

        public JsonWebKey build() {
            return new JsonWebKey(this);
        }
    }
}
