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

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j logger that redacts key material and raw bytes before they reach the logging
 * backend.
 */
final class RedactedLogger {
    private final Logger realLogger;

    private RedactedLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactedLogger getLogger(Class<?> forClass) {
        return new RedactedLogger(LoggerFactory.getLogger(forClass));
    }

    boolean isTraceEnabled() {
        return realLogger.isTraceEnabled();
    }

    boolean isDebugEnabled() {
        return realLogger.isDebugEnabled();
    }

    void trace(String s, Object... objects) {
        if (isTraceEnabled()) {
            realLogger.trace(s, redactAll(objects));
        }
    }

    void debug(String s, Object... objects) {
        if (isDebugEnabled()) {
            realLogger.debug(s, redactAll(objects));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[] bytes) {
            return maskForLog(bytes);
        } else if (arg instanceof Key key) {
            return key.getAlgorithm() + ":<redacted>";
        } else if (arg instanceof KeyMaterial material) {
            return material.describe();
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        // Throwables are passed through untouched so slf4j still prints the stack trace.
        return Arrays.stream(args).map(RedactedLogger::redact).toArray();
    }

    static String maskForLog(byte[] secret) {
        return secret == null ? "null" : "<" + secret.length + " bytes redacted>";
    }
}
