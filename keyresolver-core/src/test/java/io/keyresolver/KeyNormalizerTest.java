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

import static io.keyresolver.TestData.jwk;
import static io.keyresolver.TestData.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class KeyNormalizerTest {

    private static KeyPair generate(String algorithm, String curve) throws GeneralSecurityException {
        var generator = KeyPairGenerator.getInstance(algorithm);
        if (curve != null) {
            generator.initialize(new ECGenParameterSpec(curve));
        }
        return generator.generateKeyPair();
    }

    @DataProvider
    public Object[][] defaults() throws Exception {
        var oct = KeyMaterial.secret(new byte[32]);
        var p256 = generate("EC", "secp256r1");
        var p384 = generate("EC", "secp384r1");
        var p521 = generate("EC", "secp521r1");
        var rsa = jwk("rsa.json").material();
        var ed25519 = generate("Ed25519", null);
        var x25519 = generate("X25519", null);
        return new Object[][] {
                { oct, "", "HS256" },
                { oct, "sig", "HS256" },
                { oct, "enc", "A256GCMKW" },
                { JcaKeys.fromKeyPair(p256), "", "ES256" },
                { JcaKeys.fromKey(p256.getPublic()), "sig", "ES256" },
                { JcaKeys.fromKey(p256.getPublic()), "enc", "ECDH-ES" },
                { JcaKeys.fromKeyPair(p384), "", "ES384" },
                { JcaKeys.fromKey(p384.getPublic()), "enc", "ECDH-ES" },
                { JcaKeys.fromKeyPair(p521), "sig", "ES512" },
                { JcaKeys.fromKey(p521.getPublic()), "enc", "ECDH-ES" },
                { rsa, "", "RS256" },
                { rsa.publicPart().orElseThrow(), "sig", "RS256" },
                { rsa, "enc", "RSA-OAEP-256" },
                { JcaKeys.fromKeyPair(ed25519), "", "EdDSA" },
                { JcaKeys.fromKey(ed25519.getPublic()), "enc", "EdDSA" },
                { JcaKeys.fromKeyPair(x25519), "", "XEdDSA" },
                { JcaKeys.fromKey(x25519.getPublic()), "enc", "XEdDSA" },
                { new KeyMaterial.Opaque(TestData.opaqueSigner(p256.getPublic())), "", "ES256" },
                { new KeyMaterial.Opaque(TestData.opaqueSigner(ed25519.getPublic())), "sig", "EdDSA" },
                { new KeyMaterial.Opaque(TestData.opaqueSigner(null)), "", "" },
        };
    }

    @Test(dataProvider = "defaults")
    public void shouldInferDefaultAlgorithm(KeyMaterial material, String use, String expected) throws Exception {
        var key = JsonWebKey.builder(material).use(use).build();
        var normalized = KeyNormalizer.normalize(key, ResolveOptions.defaults(), "test", false);
        assertThat(normalized.algorithm()).isEqualTo(expected);
        assertThat(normalized.use()).isEqualTo(use);
    }

    @Test(dataProvider = "defaults")
    public void shouldInferFromUseOption(KeyMaterial material, String use, String expected) throws Exception {
        var key = JsonWebKey.builder(material).build();
        var normalized = KeyNormalizer.normalize(key, options(ResolveOptions.builder().use(use)), "test", false);
        assertThat(normalized.algorithm()).isEqualTo(expected);
        assertThat(normalized.use()).isEqualTo(use);
    }

    @Test
    public void shouldNotReinferDeclaredAlgorithm() throws Exception {
        var key = jwk("oct.json");
        var normalized = KeyNormalizer.normalize(key, options(ResolveOptions.builder().use("enc")), "test", false);
        assertThat(normalized.algorithm()).isEqualTo("HS256");
        assertThat(normalized.use()).isEqualTo("enc");
    }

    @Test
    public void shouldApplyOverrides() throws Exception {
        var options = options(ResolveOptions.builder().alg("ECDH-ES+A256KW").use("enc").kid("my-key"));
        var normalized = KeyNormalizer.normalize(jwk("p256.json"), options, "test", false);
        assertThat(normalized.algorithm()).isEqualTo("ECDH-ES+A256KW");
        assertThat(normalized.use()).isEqualTo("enc");
        assertThat(normalized.keyId()).isEqualTo("my-key");
        assertThat(normalized.material()).isEqualTo(jwk("p256.json").material());
    }

    @DataProvider
    public Object[][] invalidOverrides() {
        return new Object[][] {
                { "p256.json", "ES384", "EC(P-256, private)" },
                { "p256.pub.json", "RS256", "EC(P-256, public)" },
                { "oct.json", "ES256", "oct(512 bits)" },
                { "rsa.pub.json", "HS256", "RSA(2048 bits, public)" },
                { "ed25519.json", "XEdDSA", "OKP(Ed25519, private)" },
                { "okp.pub.json", "FOOBAR", "OKP(Ed25519, public)" },
        };
    }

    @Test(dataProvider = "invalidOverrides")
    public void shouldRejectInvalidAlgorithmOverride(String name, String algorithm, String description) {
        var options = options(ResolveOptions.builder().alg(algorithm));
        assertThatThrownBy(() -> KeyNormalizer.normalize(jwk(name), options, name, false))
                .isInstanceOf(KeyValidationException.class)
                .hasMessage("invalid algorithm " + algorithm + " for " + description + " on " + name);
    }

    @Test(dataProvider = "invalidOverrides")
    public void shouldTrustAnyAlgorithmOverrideWhenSubtle(String name, String algorithm, String description)
            throws Exception {
        var options = options(ResolveOptions.builder().alg(algorithm).subtle(true));
        assertThat(KeyNormalizer.normalize(jwk(name), options, name, false).algorithm()).isEqualTo(algorithm);
    }

    @Test
    public void shouldCheckOpaqueSignerOverrideAgainstSignatureAlgorithms() throws Exception {
        var key = JsonWebKey.builder(new KeyMaterial.Opaque(TestData.opaqueSigner(null))).build();
        var es256 = options(ResolveOptions.builder().alg("ES256"));
        assertThat(KeyNormalizer.normalize(key, es256, "test", false).algorithm()).isEqualTo("ES256");

        var kw = options(ResolveOptions.builder().alg("A256GCMKW"));
        assertThatThrownBy(() -> KeyNormalizer.normalize(key, kw, "test", false))
                .isInstanceOf(KeyValidationException.class)
                .hasMessage("invalid algorithm A256GCMKW for opaque(unknown) on test");
    }

    @Test
    public void shouldNotInferAnythingWithNoDefaults() throws Exception {
        var options = options(ResolveOptions.builder().noDefaults(true));
        var key = jwk("p256.pub.json").toBuilder().keyId("").build();
        var normalized = KeyNormalizer.normalize(key, options, "test", true);
        assertThat(normalized.algorithm()).isEmpty();
        assertThat(normalized.keyId()).isEmpty();
    }

    @Test
    public void shouldAssignThumbprintKeyIdOnlyWhenRequested() throws Exception {
        var key = jwk("p256.pub.json").toBuilder().keyId("").build();
        assertThat(KeyNormalizer.normalize(key, ResolveOptions.defaults(), "test", true).keyId())
                .isEqualTo(TestData.P256_KID);
        assertThat(KeyNormalizer.normalize(key, ResolveOptions.defaults(), "test", false).keyId()).isEmpty();
    }

    @Test
    public void shouldKeepDeclaredKeyIdOverThumbprint() throws Exception {
        var key = jwk("rsa.pub.json");
        assertThat(KeyNormalizer.normalize(key, ResolveOptions.defaults(), "test", true).keyId())
                .isEqualTo("rsa-kid");
    }

    @Test
    public void shouldVerifyKeyIdOnlyWhenEnabled() throws Exception {
        var key = jwk("p256.wrongkid.json");
        assertThat(KeyNormalizer.normalize(key, ResolveOptions.defaults(), "test", false).keyId())
                .isEqualTo("not-the-thumbprint");

        var verify = options(ResolveOptions.builder().verifyKeyId(true));
        assertThatThrownBy(() -> KeyNormalizer.normalize(key, verify, "test", false))
                .isInstanceOf(KeyValidationException.class)
                .hasMessage("invalid JWK on test: kid not-the-thumbprint does not match the key thumbprint");

        var overridden = options(ResolveOptions.builder().verifyKeyId(true).kid("chosen"));
        assertThat(KeyNormalizer.normalize(key, overridden, "test", false).keyId()).isEqualTo("chosen");
        assertThat(KeyNormalizer.normalize(jwk("p256.json"), verify, "test", false).keyId())
                .isEqualTo(TestData.P256_KID);
    }
}
