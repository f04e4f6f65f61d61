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

import static io.keyresolver.TestData.MY_PASSWORD;
import static io.keyresolver.TestData.bytes;
import static io.keyresolver.TestData.jwk;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.KeyPairGenerator;
import java.util.Base64;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class PemDecoderTest {
    private static final PasswordSource NO_PROMPT = PasswordSource.prompt("unused", TestData.failingPrompter());

    @DataProvider
    public Object[][] unencrypted() {
        return new Object[][] {
                { "ed25519.pem", jwk("ed25519.json").material() },
                { "ed25519.pub.pem", jwk("ed25519.json").material().publicPart().orElseThrow() },
                { "p256.pem", jwk("p256.json").material() },
                { "p256.pub.pem", jwk("p256.pub.json").material() },
                { "rsa.pem", jwk("rsa.json").material() },
                { "rsa.pub.pem", jwk("rsa.pub.json").material() },
        };
    }

    @Test(dataProvider = "unencrypted")
    public void shouldDecodeWithoutObtainingPassword(String name, KeyMaterial expected) throws Exception {
        var decoded = PemDecoder.decode(bytes(name), NO_PROMPT, name);
        assertThat(decoded.material()).isEqualTo(expected);
        assertThat(decoded.certificates()).isEmpty();
    }

    @DataProvider
    public Object[][] thumbprints() {
        return new Object[][] {
                { "x25519.pem", TestData.X25519_KID },
                { "p384.pem", TestData.P384_KID },
                { "p521.pem", TestData.P521_KID },
        };
    }

    @Test(dataProvider = "thumbprints")
    public void shouldDecodePkcs8Keys(String name, String keyId) throws Exception {
        var material = PemDecoder.decode(bytes(name), NO_PROMPT, name).material();
        assertThat(material.isPublic()).isFalse();
        assertThat(Thumbprints.keyId(material)).isEqualTo(keyId);
    }

    @DataProvider
    public Object[][] encrypted() {
        return new Object[][] {
                { "ed25519.enc.pem", "ed25519.json" },
                { "p256.enc.pem", "p256.json" },
                { "rsa.enc.pem", "rsa.json" },
        };
    }

    @Test(dataProvider = "encrypted")
    public void shouldDecryptEncryptedKeys(String name, String jwkName) throws Exception {
        var decoded = PemDecoder.decode(bytes(name), PasswordSource.literal(MY_PASSWORD), name);
        assertThat(decoded.material()).isEqualTo(jwk(jwkName).material());
    }

    @Test(dataProvider = "encrypted")
    public void shouldFailWithWrongPassword(String name, String jwkName) {
        var wrong = PasswordSource.literal("not my password".getBytes(UTF_8));
        assertThatThrownBy(() -> PemDecoder.decode(bytes(name), wrong, name))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("error decrypting " + name);
    }

    @Test
    public void shouldDecodeCertificate() throws Exception {
        var decoded = PemDecoder.decode(bytes("p256.crt"), NO_PROMPT, "p256.crt");
        assertThat(decoded.material()).isEqualTo(jwk("p256.pub.json").material());
        assertThat(decoded.certificates()).hasSize(1);
        assertThat(decoded.certificates().get(0).getSubjectX500Principal().getName()).isNotEmpty();
    }

    @Test
    public void shouldUseFirstKeyBlock() throws Exception {
        var pem = new String(bytes("p256.pub.pem"), UTF_8) + new String(bytes("rsa.pub.pem"), UTF_8);
        var decoded = PemDecoder.decode(pem.getBytes(UTF_8), NO_PROMPT, "test");
        assertThat(decoded.material()).isEqualTo(jwk("p256.pub.json").material());
    }

    @Test
    public void shouldRejectUnsupportedKeyAlgorithms() throws Exception {
        var generator = KeyPairGenerator.getInstance("DSA");
        generator.initialize(1024);
        var encoded = generator.generateKeyPair().getPublic().getEncoded();
        var pem = "-----BEGIN PUBLIC KEY-----\n"
                + Base64.getMimeEncoder(64, "\n".getBytes(UTF_8)).encodeToString(encoded)
                + "\n-----END PUBLIC KEY-----\n";
        assertThatThrownBy(() -> PemDecoder.decode(pem.getBytes(UTF_8), NO_PROMPT, "dsa.pem"))
                .isInstanceOf(KeyValidationException.class)
                .hasMessageStartingWith("error reading dsa.pem: unsupported key algorithm");
    }

    @DataProvider
    public Object[][] invalid() {
        return new Object[][] {
                { "" },
                { "not a pem file" },
                { "-----BEGIN FOO-----\nAAAA\n-----END FOO-----\n" },
                { "-----BEGIN PUBLIC KEY-----\n!!!!notbase64@@@\n-----END PUBLIC KEY-----\n" },
                { "-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----\n" },
        };
    }

    @Test(dataProvider = "invalid")
    public void shouldRejectInvalidPem(String pem) {
        assertThatThrownBy(() -> PemDecoder.decode(pem.getBytes(UTF_8), NO_PROMPT, "test.pem"))
                .isInstanceOf(UnrecognizedKeyFormatException.class)
                .hasMessageStartingWith("error reading test.pem: ");
    }
}
