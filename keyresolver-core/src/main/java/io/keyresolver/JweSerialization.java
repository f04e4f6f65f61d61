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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.text.ParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;
import com.nimbusds.jose.JOSEObject;
import com.nimbusds.jose.JWEHeader;
import com.nimbusds.jose.JWEObject;
import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jose.util.JSONObjectUtils;

/**
 * Reads JWEs in compact, flattened JSON or single-recipient general JSON serialization (RFC 7516 section 7), and
 * converts compact JWEs to the flattened JSON form.
 * <p>
 * JSON serialized JWEs may split their header between the integrity-protected header and unprotected shared or
 * per-recipient headers. The headers are merged for decryption while the additional authenticated data is still
 * computed over the protected header exactly as received. JWEs with an {@code aad} member, with more than one
 * recipient, or without a protected header are not supported.
 */
public final class JweSerialization {

    /**
     * The parts of a JWE needed for decryption.
     *
     * @param header the merged JWE header, retaining the original encoding of its protected part.
     * @param encryptedKey the encrypted content encryption key, or null if empty.
     * @param iv the initialization vector.
     * @param cipherText the ciphertext.
     * @param authTag the authentication tag.
     */
    public record Parts(JWEHeader header, Base64URL encryptedKey, Base64URL iv, Base64URL cipherText,
            Base64URL authTag) {}

    /**
     * Parses a JWE in any supported serialization.
     *
     * @param data the serialized JWE.
     * @param source the name of the source, used in error messages.
     * @return the JWE parts.
     * @throws UnrecognizedKeyFormatException if the data is not a supported JWE.
     */
    public static Parts parse(byte[] data, String source) throws UnrecognizedKeyFormatException {
        var text = new String(data, UTF_8).strip();
        try {
            if (text.startsWith("{")) {
                return parseJson(JsonParser.object().from(text));
            }
            var jwe = JWEObject.parse(text);
            return new Parts(jwe.getHeader(), jwe.getEncryptedKey(), jwe.getIV(), jwe.getCipherText(),
                    jwe.getAuthTag());
        } catch (ParseException | JsonParserException | IllegalArgumentException e) {
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": invalid JWE: "
                    + e.getMessage(), e);
        }
    }

    /**
     * Converts a compact serialized JWE into the equivalent flattened JSON serialization.
     *
     * @param compact the compact serialization.
     * @return the flattened JSON serialization.
     * @throws IllegalArgumentException if the input is not a compact JWE.
     */
    public static String toFlattenedJson(String compact) {
        Base64URL[] parts;
        try {
            parts = JOSEObject.split(compact);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid compact JWE: " + e.getMessage(), e);
        }
        if (parts.length != 5) {
            throw new IllegalArgumentException("Invalid compact JWE: expected 5 parts but got " + parts.length);
        }
        var json = new LinkedHashMap<String, Object>();
        json.put("protected", parts[0].toString());
        if (!parts[1].toString().isEmpty()) {
            json.put("encrypted_key", parts[1].toString());
        }
        json.put("iv", parts[2].toString());
        json.put("ciphertext", parts[3].toString());
        json.put("tag", parts[4].toString());
        return JsonWriter.string(json);
    }

    private static Parts parseJson(JsonObject json) throws ParseException {
        if (json.has("aad")) {
            throw new ParseException("additional authenticated data is not supported", 0);
        }
        if (!json.isString("protected")) {
            throw new ParseException("missing protected header", 0);
        }
        var protectedHeader = new Base64URL(json.getString("protected"));
        Map<String, Object> header = new LinkedHashMap<>(JSONObjectUtils.parse(protectedHeader.decodeToString()));
        merge(header, json, "unprotected");

        var recipient = json;
        if (json.has("recipients")) {
            var recipients = json.getArray("recipients");
            if (recipients == null || recipients.size() != 1 || recipients.getObject(0) == null) {
                throw new ParseException("exactly one recipient is supported", 0);
            }
            recipient = recipients.getObject(0);
        }
        merge(header, recipient, "header");

        return new Parts(JWEHeader.parse(header, protectedHeader),
                optional(recipient, "encrypted_key"),
                required(json, "iv"),
                required(json, "ciphertext"),
                required(json, "tag"));
    }

    private static void merge(Map<String, Object> header, JsonObject json, String member) throws ParseException {
        if (!json.has(member)) {
            return;
        }
        var object = json.getObject(member);
        if (object == null) {
            throw new ParseException(member + " must be an object", 0);
        }
        for (var entry : JSONObjectUtils.parse(JsonWriter.string(object)).entrySet()) {
            if (header.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                throw new ParseException("duplicate header parameter " + entry.getKey(), 0);
            }
        }
    }

    private static Base64URL required(JsonObject json, String member) throws ParseException {
        if (!json.isString(member)) {
            throw new ParseException("missing " + member, 0);
        }
        return new Base64URL(json.getString(member));
    }

    private static Base64URL optional(JsonObject json, String member) throws ParseException {
        return json.has(member) ? required(json, member) : null;
    }

    private JweSerialization() {}
}
