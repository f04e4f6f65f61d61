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

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;

/**
 * Decides which {@link KeyFormat} a blob of bytes is in. Rules are tried in order and the first match wins:
 * <ol>
 *     <li>a compact or JSON serialized JWE is {@link KeyFormat#ENCRYPTED};</li>
 *     <li>a JSON object with a {@code keys} array is a {@link KeyFormat#KEY_SET};</li>
 *     <li>a JSON object with a {@code kty} string is a {@link KeyFormat#SINGLE_KEY};</li>
 *     <li>data starting with a PEM {@code -----BEGIN } line is {@link KeyFormat#TEXTUAL};</li>
 *     <li>anything else is a {@link KeyFormat#RAW_SECRET}, but only if the options carry a symmetric algorithm.</li>
 * </ol>
 * When reading a key set, any other JSON object is also classified as a key set, which is then empty.
 */
public final class FormatClassifier {
    private static final RedactedLogger logger = RedactedLogger.getLogger(FormatClassifier.class);
    private static final String PEM_BEGIN = "-----BEGIN ";

    /**
     * Classifies the given data.
     *
     * @param data the raw bytes.
     * @param options the resolve options, consulted for a symmetric algorithm override.
     * @param source the name of the source, used in error messages.
     * @param keySet whether the caller expects a key set.
     * @return the format of the data.
     * @throws UnrecognizedKeyFormatException if no rule matches.
     */
    public static KeyFormat classify(byte[] data, ResolveOptions options, String source, boolean keySet)
            throws UnrecognizedKeyFormatException {
        var format = detect(data, options, keySet);
        if (format == null) {
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": cannot determine key type");
        }
        logger.debug("Classified {} as {}", source, format);
        return format;
    }

    private static KeyFormat detect(byte[] data, ResolveOptions options, boolean keySet) {
        var text = new String(data, UTF_8).strip();
        if (isCompactJwe(text)) {
            return KeyFormat.ENCRYPTED;
        }
        var json = parseObject(text);
        if (json != null) {
            if (isJsonJwe(json)) {
                return KeyFormat.ENCRYPTED;
            }
            if (keySet || json.getArray("keys") != null) {
                return KeyFormat.KEY_SET;
            }
            if (json.isString("kty")) {
                return KeyFormat.SINGLE_KEY;
            }
        }
        if (text.startsWith(PEM_BEGIN)) {
            return KeyFormat.TEXTUAL;
        }
        if (Algorithms.isSymmetric(options.algorithm())) {
            return KeyFormat.RAW_SECRET;
        }
        return null;
    }

    static boolean isCompactJwe(String text) {
        var parts = text.split("\\.", -1);
        if (parts.length != 5 || parts[0].isEmpty() || !Base64url.isValid(parts[0])) {
            return false;
        }
        for (int i = 1; i < parts.length; ++i) {
            // The encrypted key is empty for direct encryption.
            if (!parts[i].isEmpty() && !Base64url.isValid(parts[i])) {
                return false;
            }
        }
        JsonObject header;
        try {
            header = parseObject(new String(Base64url.decode(parts[0]), UTF_8));
        } catch (IllegalArgumentException e) {
            return false;
        }
        return header != null && header.isString("alg") && header.isString("enc");
    }

    static boolean isJsonJwe(JsonObject json) {
        return json.isString("ciphertext") && (json.has("protected") || json.has("iv") || json.has("recipients"));
    }

    private static JsonObject parseObject(String text) {
        if (!text.startsWith("{")) {
            return null;
        }
        try {
            return JsonParser.object().from(text);
        } catch (JsonParserException e) {
            logger.trace("Not a JSON object: {}", e.getMessage());
            return null;
        }
    }

    private FormatClassifier() {}
}
