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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Fetches key sources with a {@link HttpClient}. Connection and TLS settings, including timeouts and trusted
 * certificates, are those of the client; no retries are made.
 */
public final class HttpsByteFetcher implements ByteFetcher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(HttpsByteFetcher.class);

    private final HttpClient httpClient;

    public HttpsByteFetcher(HttpClient httpClient) {
        this.httpClient = requireNonNull(httpClient, "httpClient");
    }

    @Override
    public byte[] fetch(URI uri) throws KeyResolutionException {
        var source = uri.toString();
        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw new ConfigurationException(source, "error retrieving " + source + ": only https URLs are supported");
        }
        var request = HttpRequest.newBuilder(uri)
                .header("Accept", "application/jwk+json, application/jwk-set+json, application/json, */*")
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new KeySourceException(source, "error retrieving " + source + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KeySourceException(source, "interrupted while retrieving " + source, e);
        }
        logger.debug("GET {} returned HTTP {}", source, response.statusCode());
        if (response.statusCode() < 200 || response.statusCode() > 299) {
            throw new RemoteKeySourceException(source, response.statusCode());
        }
        return response.body();
    }
}
