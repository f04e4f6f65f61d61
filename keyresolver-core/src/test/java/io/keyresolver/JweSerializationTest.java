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

import static io.keyresolver.TestData.bytes;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonWriter;
import com.nimbusds.jose.EncryptionMethod;
import com.nimbusds.jose.JWEAlgorithm;

public class JweSerializationTest {

    @Test
    public void shouldParseCompactSerialization() throws Exception {
        var parts = JweSerialization.parse(bytes("ed25519.json.enc"), "test");
        assertThat(parts.header().getAlgorithm()).isEqualTo(JWEAlgorithm.PBES2_HS256_A128KW);
        assertThat(parts.header().getEncryptionMethod()).isEqualTo(EncryptionMethod.A256GCM);
        assertThat(parts.header().getContentType()).isEqualTo("jwk+json");
        assertThat(parts.encryptedKey()).isNotNull();
    }

    @Test
    public void shouldMergeUnprotectedRecipientHeader() throws Exception {
        var parts = JweSerialization.parse(bytes("jwks.flattened.json.enc"), "test");
        assertThat(parts.header().getAlgorithm()).isEqualTo(JWEAlgorithm.PBES2_HS256_A128KW);
        assertThat(parts.header().getPBES2Count()).isEqualTo(10000);
        assertThat(parts.header().getPBES2Salt()).isNotNull();
        var json = JsonParser.object().from(new String(bytes("jwks.flattened.json.enc"), UTF_8));
        assertThat(parts.header().toBase64URL().toString()).isEqualTo(json.getString("protected"));
    }

    @Test
    public void shouldParseGeneralSerializationWithOneRecipient() throws Exception {
        var flattened = JsonParser.object().from(new String(bytes("jwks.flattened.json.enc"), UTF_8));
        var general = JsonObject.builder()
                .value("protected", flattened.getString("protected"))
                .array("recipients")
                    .object()
                        .value("header", flattened.getObject("header"))
                        .value("encrypted_key", flattened.getString("encrypted_key"))
                    .end()
                .end()
                .value("iv", flattened.getString("iv"))
                .value("ciphertext", flattened.getString("ciphertext"))
                .value("tag", flattened.getString("tag"))
                .done();
        var parts = JweSerialization.parse(JsonWriter.string(general).getBytes(UTF_8), "test");
        assertThat(parts.header().getAlgorithm()).isEqualTo(JWEAlgorithm.PBES2_HS256_A128KW);
        assertThat(parts.encryptedKey().toString()).isEqualTo(flattened.getString("encrypted_key"));
    }

    @Test
    public void shouldConvertCompactToFlattened() throws Exception {
        var compact = new String(bytes("ed25519.json.enc"), UTF_8).strip();
        var flattened = JweSerialization.toFlattenedJson(compact);
        var fromCompact = JweSerialization.parse(compact.getBytes(UTF_8), "test");
        var fromFlattened = JweSerialization.parse(flattened.getBytes(UTF_8), "test");
        assertThat(fromFlattened.header().toBase64URL()).isEqualTo(fromCompact.header().toBase64URL());
        assertThat(fromFlattened.cipherText()).isEqualTo(fromCompact.cipherText());
        assertThat(fromFlattened.authTag()).isEqualTo(fromCompact.authTag());
    }

    @Test
    public void shouldRejectInvalidCompactInput() {
        assertThatIllegalArgumentException().isThrownBy(() -> JweSerialization.toFlattenedJson("a.b.c"));
    }

    @DataProvider
    public Object[][] unsupported() {
        var protectedHeader = Base64url.encode("{\"enc\":\"A256GCM\"}".getBytes(UTF_8));
        var recipientHeader = "{\"alg\":\"PBES2-HS256+A128KW\",\"p2c\":1000,\"p2s\":\"AAAAAAAAAAA\"}";
        return new Object[][] {
                { "{\"iv\":\"AA\",\"ciphertext\":\"AA\",\"tag\":\"AA\",\"header\":" + recipientHeader + "}" },
                { "{\"protected\":\"" + protectedHeader + "\",\"aad\":\"AA\",\"iv\":\"AA\",\"ciphertext\":\"AA\","
                        + "\"tag\":\"AA\",\"header\":" + recipientHeader + "}" },
                { "{\"protected\":\"" + protectedHeader + "\",\"recipients\":[{\"header\":" + recipientHeader
                        + "},{\"header\":" + recipientHeader + "}],\"iv\":\"AA\",\"ciphertext\":\"AA\",\"tag\":\"AA\"}" },
                { "{\"protected\":\"" + protectedHeader + "\",\"unprotected\":{\"enc\":\"A128GCM\"},\"iv\":\"AA\","
                        + "\"ciphertext\":\"AA\",\"tag\":\"AA\",\"header\":" + recipientHeader + "}" },
                { "{\"protected\":\"" + protectedHeader + "\",\"ciphertext\":\"AA\",\"tag\":\"AA\",\"header\":"
                        + recipientHeader + "}" },
                { "not.a.valid.jwe" },
        };
    }

    @Test(dataProvider = "unsupported")
    public void shouldRejectUnsupportedJwes(String jwe) {
        assertThatThrownBy(() -> JweSerialization.parse(jwe.getBytes(UTF_8), "test.jwe"))
                .isInstanceOf(UnrecognizedKeyFormatException.class)
                .hasMessageStartingWith("error reading test.jwe: invalid JWE");
    }
}
