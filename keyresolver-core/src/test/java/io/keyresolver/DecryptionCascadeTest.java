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
import static io.keyresolver.TestData.PASSWORD;
import static io.keyresolver.TestData.bytes;
import static io.keyresolver.TestData.failingPrompter;
import static io.keyresolver.TestData.options;
import static org.assertj.core.api.Assertions.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class DecryptionCascadeTest {
    private List<String> prompts;
    private DecryptionCascade cascade;

    @BeforeMethod
    public void setup() {
        prompts = new ArrayList<>();
        cascade = new DecryptionCascade(prompt -> {
            prompts.add(prompt);
            return PASSWORD.clone();
        });
    }

    @Test
    public void shouldPassThroughPlaintextWithoutPrompting() throws Exception {
        var unwrapped = new DecryptionCascade(failingPrompter())
                .unwrap(bytes("p256.json"), ResolveOptions.defaults(), "p256.json", false);
        assertThat(unwrapped.format()).isEqualTo(KeyFormat.SINGLE_KEY);
        assertThat(unwrapped.decrypted()).isFalse();
        assertThat(unwrapped.data()).isEqualTo(bytes("p256.json"));
    }

    @Test
    public void shouldPromptWithDefaultPrompterWhenNoPasswordConfigured() throws Exception {
        var unwrapped = cascade.unwrap(bytes("p256.json.enc"), ResolveOptions.defaults(), "p256.json.enc", false);
        assertThat(unwrapped.format()).isEqualTo(KeyFormat.SINGLE_KEY);
        assertThat(unwrapped.decrypted()).isTrue();
        assertThat(JwkCodec.parseKey(unwrapped.data(), "test")).isEqualTo(TestData.jwk("p256.json"));
        assertThat(prompts).containsExactly("Please enter the password to decrypt p256.json.enc");
    }

    @Test
    public void shouldPreferConfiguredPassword() throws Exception {
        var options = options(ResolveOptions.builder().password(PASSWORD));
        var unwrapped = cascade.unwrap(bytes("jwks.json.enc"), options, "jwks.json.enc", true);
        assertThat(unwrapped.format()).isEqualTo(KeyFormat.KEY_SET);
        assertThat(prompts).isEmpty();
    }

    @Test
    public void shouldReadPasswordFile() throws Exception {
        var options = options(ResolveOptions.builder().passwordFile(TestData.path("passphrase.txt")));
        var unwrapped = cascade.unwrap(bytes("jwks.flattened.json.enc"), options, "test", true);
        assertThat(unwrapped.format()).isEqualTo(KeyFormat.KEY_SET);
        assertThat(prompts).isEmpty();
    }

    @Test
    public void shouldUseConfiguredPrompter() throws Exception {
        var custom = new ArrayList<String>();
        var options = options(ResolveOptions.builder().passwordPrompter("Key password: ", prompt -> {
            custom.add(prompt);
            return MY_PASSWORD.clone();
        }));
        cascade.unwrap(bytes("ed25519.json.enc"), options, "test", false);
        assertThat(custom).containsExactly("Key password: ");
        assertThat(prompts).isEmpty();
    }

    @Test
    public void shouldClassifyDecryptedPem() throws Exception {
        var options = options(ResolveOptions.builder().password(MY_PASSWORD));
        var unwrapped = cascade.unwrap(bytes("ed25519.pem.enc"), options, "test", false);
        assertThat(unwrapped.format()).isEqualTo(KeyFormat.TEXTUAL);
        assertThat(unwrapped.decrypted()).isTrue();
    }

    @Test
    public void shouldRejectNestedEncryption() {
        assertThatThrownBy(() -> cascade.unwrap(bytes("nested.enc"), ResolveOptions.defaults(), "nested.enc", false))
                .isInstanceOf(UnrecognizedKeyFormatException.class)
                .hasMessage("error reading nested.enc: nested encryption is not supported");
        assertThat(prompts).hasSize(1);
    }

    @Test
    public void shouldFailOnWrongPassword() {
        var options = options(ResolveOptions.builder().password(MY_PASSWORD));
        assertThatThrownBy(() -> cascade.unwrap(bytes("p256.json.enc"), options, "p256.json.enc", false))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("error decrypting p256.json.enc");
    }

    @Test
    public void shouldFailOnMissingPasswordFile() {
        var options = options(ResolveOptions.builder().passwordFile(TestData.path("p256.json").resolveSibling("nope")));
        assertThatThrownBy(() -> cascade.unwrap(bytes("p256.json.enc"), options, "p256.json.enc", false))
                .isInstanceOf(KeySourceException.class)
                .hasMessageStartingWith("error reading password file");
    }

    @Test
    public void shouldFailWhenPromptIsCancelled() {
        var cancelled = new DecryptionCascade(prompt -> null);
        assertThatThrownBy(() -> cancelled.unwrap(bytes("p256.json.enc"), ResolveOptions.defaults(), "x", false))
                .isInstanceOf(KeySourceException.class);
    }

    @Test
    public void shouldRejectEmptyPassword() {
        var empty = new DecryptionCascade(prompt -> new byte[0]);
        assertThatThrownBy(() -> empty.unwrap(bytes("p256.json.enc"), ResolveOptions.defaults(), "x", false))
                .isInstanceOf(AuthenticationFailedException.class)
                .hasMessage("error decrypting x: empty password");
    }

    @Test
    public void shouldNotLogDecryptedSecret() throws Exception {
        var secret = "SEC-this-is-a-raw-secret-KEY".getBytes(UTF_8);
        var jwe = new KeyEncryptor(1000).encrypt(secret, null, PASSWORD).getBytes(UTF_8);
        var options = options(ResolveOptions.builder().password(PASSWORD).alg("HS256"));

        var captured = new ByteArrayOutputStream();
        var stdout = System.out;
        System.setOut(new PrintStream(captured, true, UTF_8));
        DecryptionCascade.Unwrapped unwrapped;
        try {
            unwrapped = cascade.unwrap(jwe, options, "secret.enc", false);
        } finally {
            System.setOut(stdout);
        }

        assertThat(unwrapped.format()).isEqualTo(KeyFormat.RAW_SECRET);
        assertThat(unwrapped.data()).isEqualTo(secret);
        var log = captured.toString(UTF_8);
        assertThat(log).contains("Decryption pass 1 on secret.enc produced 28 bytes");
        assertThat(log).doesNotContain("SEC-this-is-a-raw-secret-KEY", "534543", "4b4559");
    }
}
