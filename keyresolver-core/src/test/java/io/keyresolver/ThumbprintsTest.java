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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

import java.math.BigInteger;
import java.security.KeyPairGenerator;
import java.security.spec.ECGenParameterSpec;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ThumbprintsTest {

    @Test
    public void shouldMatchRfc7638Example() {
        var n = new BigInteger(1, Base64url.decode("0vx7agoebGcQSuuPiLJXZptN9nndrQmbXEps2aiAFbWhM78LhWx4cbbfAAtVT86zw"
                + "u1RK7aPFFxuhDR1L6tSoc_BJECPebWKRXjBZCiFV4n3oknjhMstn64tZ_2W-5JsGY4Hc5n9yBXArwl93lqt7_RN5w6Cf0h4QyQ5v-65Y"
                + "GjQR0_FDW2QvzqY368QQMicAtaSqzs8KJZgnYb9c7d0zgdAZHzu6qMQvRL5hajrn1n91CbOpbISD08qNLyrdkt-bFTWhAI4vMQFh6WeZ"
                + "u0fM4lFd2NcRwr3XPksINHaQ-G_xBniIqbw0Ls1jF44-csFCur-kEgU8awapJzKnqDKgw"));
        var key = KeyMaterial.rsaPublic(n, BigInteger.valueOf(65537));
        assertThat(Thumbprints.keyId(key)).isEqualTo("NzbLsXh8uDCcd-6MNwXF4W_7noWXFZAfHkxZsRGC9Xs");
    }

    @Test
    public void shouldMatchRfc8037Example() {
        var key = KeyMaterial.okpPrivate(OkpCurve.ED25519,
                Base64url.decode("nWGxne_9WmC6hEr0kuwsxERJxWl7MmkZcDusAxyuf2A"));
        assertThat(Base64url.encode(((KeyMaterial.Okp) key).x())).isEqualTo("11qYAYKxCrfVS_7TyWQHOg7hcvPapiMlrwIaaPcHURo");
        assertThat(Thumbprints.keyId(key)).isEqualTo("kPrK_qmxVWaYVA9wwBF6Iuo3vVzz7TxHCTwXBygrS4k");
    }

    @Test
    public void shouldMatchExternallyIssuedKeyId() {
        assertThat(Thumbprints.keyId(jwk("okp.pub.json").material())).isEqualTo(TestData.OKP_KID);
        assertThat(Thumbprints.keyId(jwk("p256.pub.json").material())).isEqualTo(TestData.P256_KID);
    }

    @DataProvider
    public Object[][] privateKeys() {
        return new Object[][] {
                { "p256.json" }, { "rsa.json" }, { "ed25519.json" }
        };
    }

    @Test(dataProvider = "privateKeys")
    public void shouldGiveSameThumbprintForPrivateAndPublicKey(String name) {
        var material = jwk(name).material();
        var publicPart = material.publicPart().orElseThrow();
        for (var digest : new String[] { "SHA-256", "SHA-1", "SHA-512" }) {
            assertThat(Thumbprints.compute(material, digest)).isEqualTo(Thumbprints.compute(publicPart, digest));
        }
    }

    @Test
    public void shouldGiveSameThumbprintForGeneratedKeyPairs() throws Exception {
        for (var curve : new String[] { "secp256r1", "secp384r1", "secp521r1" }) {
            var generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec(curve));
            var keyPair = generator.generateKeyPair();
            assertThat(Thumbprints.keyId(JcaKeys.fromKey(keyPair.getPrivate())))
                    .isEqualTo(Thumbprints.keyId(JcaKeys.fromKey(keyPair.getPublic())));
        }
        var x25519 = KeyPairGenerator.getInstance("X25519").generateKeyPair();
        assertThat(Thumbprints.keyId(JcaKeys.fromKeyPair(x25519)))
                .isEqualTo(Thumbprints.keyId(JcaKeys.fromKey(x25519.getPublic())));
    }

    @Test
    public void shouldOnlyIncludeRequiredMembers() {
        var json = Thumbprints.canonicalJson(jwk("p256.json").material());
        assertThat(json).startsWith("{\"crv\":\"P-256\",\"kty\":\"EC\",\"x\":\"").doesNotContain("\"d\"", " ");
        assertThat(Thumbprints.canonicalJson(KeyMaterial.secret(new byte[] { 1, 2, 3 })))
                .isEqualTo("{\"k\":\"AQID\",\"kty\":\"oct\"}");
    }

    @Test
    public void shouldUseOpaqueSignerPublicKey() throws Exception {
        var keyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
        var opaque = new KeyMaterial.Opaque(TestData.opaqueSigner(keyPair.getPublic()));
        assertThat(Thumbprints.keyId(opaque)).isEqualTo(Thumbprints.keyId(JcaKeys.fromKeyPair(keyPair)));
    }

    @Test
    public void shouldRejectOpaqueSignerWithoutPublicKey() {
        var opaque = new KeyMaterial.Opaque(TestData.opaqueSigner(null));
        assertThatIllegalArgumentException().isThrownBy(() -> Thumbprints.keyId(opaque));
    }
}
