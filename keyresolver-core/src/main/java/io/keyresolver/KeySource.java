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
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;

/**
 * Where key data comes from: a local file, an HTTPS URL or an in-memory buffer.
 */
public sealed interface KeySource {

    /**
     * A name for this source used in log and error messages: the path, the URL or the name given to the buffer.
     */
    String name();

    /**
     * Reads the raw bytes of this source.
     *
     * @param fetcher the fetcher for remote sources.
     * @return the bytes.
     * @throws KeySourceException if the data cannot be read.
     */
    byte[] read(ByteFetcher fetcher) throws KeyResolutionException;

    static KeySource file(Path path) {
        return new FileSource(path);
    }

    /**
     * A remote source.
     *
     * @throws IllegalArgumentException if the URI is not an absolute https URI.
     */
    static KeySource url(URI uri) {
        return new UrlSource(uri);
    }

    static KeySource bytes(byte[] data, String name) {
        return new BytesSource(data, name);
    }

    /**
     * Interprets a string as a source: {@code https://} URLs are remote sources and anything else is a file path.
     *
     * @param location the URL or path.
     * @return the source.
     * @throws ConfigurationException if the location is a plain {@code http://} URL or cannot be parsed.
     */
    static KeySource parse(String location) throws ConfigurationException {
        requireNonNull(location, "location");
        var lower = location.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://")) {
            throw new ConfigurationException(location, "error retrieving " + location
                    + ": only https URLs are supported");
        }
        try {
            if (lower.startsWith("https://")) {
                return url(new URI(location));
            }
            return file(Path.of(location));
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new ConfigurationException(location, "invalid key location " + location, e);
        }
    }

    record FileSource(Path path) implements KeySource {
        public FileSource {
            requireNonNull(path, "path");
        }

        @Override
        public String name() {
            return path.toString();
        }

        @Override
        public byte[] read(ByteFetcher fetcher) throws KeyResolutionException {
            try {
                return Files.readAllBytes(path);
            } catch (IOException e) {
                throw new KeySourceException(name(), "error reading " + name(), e);
            }
        }
    }

    record UrlSource(URI uri) implements KeySource {
        public UrlSource {
            if (!"https".equalsIgnoreCase(requireNonNull(uri, "uri").getScheme()) || uri.getHost() == null) {
                throw new IllegalArgumentException("Only absolute https URLs are supported: " + uri);
            }
        }

        @Override
        public String name() {
            return uri.toString();
        }

        @Override
        public byte[] read(ByteFetcher fetcher) throws KeyResolutionException {
            return fetcher.fetch(uri);
        }
    }

    record BytesSource(byte[] data, String name) implements KeySource {
        public BytesSource {
            data = requireNonNull(data, "data").clone();
            requireNonNull(name, "name");
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public byte[] read(ByteFetcher fetcher) {
            return data.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof BytesSource that && name.equals(that.name)
                    && Arrays.equals(data, that.data);
        }

        @Override
        public int hashCode() {
            return 31 * name.hashCode() + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return "BytesSource[name=" + name + ", data=<" + data.length + " bytes>]";
        }
    }
}
