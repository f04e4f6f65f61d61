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

import java.math.BigInteger;
import java.util.Arrays;

final class Utils {

    static byte[] toUnsignedLittleEndian(BigInteger value, int length) {
        var bytes = toUnsignedBigEndian(value, length);
        reverse(bytes);
        return bytes;
    }

    static BigInteger fromUnsignedLittleEndian(byte[] littleEndian) {
        var bigEndian = littleEndian.clone();
        reverse(bigEndian);
        return new BigInteger(1, bigEndian);
    }

    /**
     * Encodes a non-negative integer as a big-endian octet string of exactly the given length, as required for EC
     * coordinates in JWK (RFC 7518, section 6.2.1.2).
     */
    static byte[] toUnsignedBigEndian(BigInteger value, int length) {
        var bytes = value.toByteArray();
        if (bytes.length > length && bytes[0] == 0) {
            // Remove sign byte
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        if (bytes.length > length) {
            throw new IllegalArgumentException("Value too large for " + length + " bytes");
        }
        if (bytes.length < length) {
            var padded = new byte[length];
            System.arraycopy(bytes, 0, padded, length - bytes.length, bytes.length);
            bytes = padded;
        }
        return bytes;
    }

    /**
     * Encodes a non-negative integer in the minimal number of big-endian octets, as used for RSA parameters.
     */
    static byte[] toUnsignedBigEndian(BigInteger value) {
        var bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        return bytes;
    }

    static void reverse(byte[] data) {
        byte tmp;
        for (int i = 0; i < (data.length >>> 1); ++i) {
            tmp = data[i];
            data[i] = data[data.length - i - 1];
            data[data.length - i - 1] = tmp;
        }
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    private Utils() {}
}
