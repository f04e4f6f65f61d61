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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.Provider;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.edec.EdECObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.asn1.x9.X9ObjectIdentifiers;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.bouncycastle.pkcs.PKCSException;

/**
 * Decodes keys from PEM containers. Supported blocks are:
 * <ul>
 *     <li>{@code PUBLIC KEY} (SubjectPublicKeyInfo),</li>
 *     <li>{@code PRIVATE KEY} (PKCS#8), {@code RSA PRIVATE KEY} (PKCS#1) and {@code EC PRIVATE KEY} (SEC1),</li>
 *     <li>{@code ENCRYPTED PRIVATE KEY} (encrypted PKCS#8),</li>
 *     <li>legacy OpenSSL {@code Proc-Type: 4,ENCRYPTED} private keys,</li>
 *     <li>{@code CERTIFICATE}: the key is the leaf's public key and all consecutive certificates form the chain.</li>
 * </ul>
 * The first key-bearing block is used. A password is only obtained for encrypted blocks.
 */
public final class PemDecoder {
    private static final RedactedLogger logger = RedactedLogger.getLogger(PemDecoder.class);
    private static final Provider BOUNCY_CASTLE = new BouncyCastleProvider();

    private static final Map<ASN1ObjectIdentifier, String> KEY_ALGORITHMS = Map.of(
            PKCSObjectIdentifiers.rsaEncryption, "RSA",
            PKCSObjectIdentifiers.id_RSASSA_PSS, "RSASSA-PSS",
            X9ObjectIdentifiers.id_ecPublicKey, "EC",
            EdECObjectIdentifiers.id_Ed25519, "Ed25519",
            EdECObjectIdentifiers.id_X25519, "X25519");

    /**
     * The contents of a decoded PEM container.
     *
     * @param material the key.
     * @param certificates the certificate chain if the container held certificates, otherwise empty.
     */
    public record Decoded(KeyMaterial material, List<X509Certificate> certificates) {
        public Decoded {
            certificates = List.copyOf(certificates);
        }
    }

    /**
     * Decodes the first key in the given PEM data.
     *
     * @param pem the PEM data.
     * @param password where to get the password if the key is encrypted.
     * @param source the name of the source, used in error messages.
     * @return the decoded key.
     * @throws UnrecognizedKeyFormatException if no supported PEM block is found.
     * @throws AuthenticationFailedException if an encrypted key cannot be decrypted with the password.
     * @throws KeyValidationException if the key uses an unsupported algorithm or curve, or is malformed.
     */
    public static Decoded decode(byte[] pem, PasswordSource password, String source) throws KeyResolutionException {
        try (var parser = new PEMParser(new StringReader(new String(pem, UTF_8)))) {
            var certificates = new ArrayList<X509Certificate>();
            Object object;
            while ((object = readObject(parser, source)) != null) {
                if (object instanceof X509CertificateHolder holder) {
                    certificates.add(toCertificate(holder, source));
                    continue;
                }
                if (!certificates.isEmpty()) {
                    break;
                }
                var material = decodeKey(object, password, source);
                if (material != null) {
                    return new Decoded(material, List.of());
                }
                logger.debug("Skipping unsupported PEM object {} in {}", object.getClass().getSimpleName(), source);
            }
            if (!certificates.isEmpty()) {
                var leafKey = JcaKeys.fromSupportedPublicKey(certificates.get(0).getPublicKey())
                        .orElseThrow(() -> new KeyValidationException(source, "error reading " + source
                                + ": unsupported certificate public key"));
                return new Decoded(leafKey, certificates);
            }
        } catch (IOException e) {
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": invalid PEM", e);
        }
        throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": no supported PEM block found");
    }

    private static Object readObject(PEMParser parser, String source) throws IOException,
            UnrecognizedKeyFormatException {
        try {
            return parser.readObject();
        } catch (IllegalArgumentException | IllegalStateException e) {
            // Bad base64 or DER inside a block surfaces as a runtime exception from BouncyCastle.
            throw new UnrecognizedKeyFormatException(source, "error reading " + source + ": invalid PEM", e);
        }
    }

    private static KeyMaterial decodeKey(Object object, PasswordSource password, String source)
            throws KeyResolutionException {
        if (object instanceof SubjectPublicKeyInfo publicKeyInfo) {
            return fromPublicKeyInfo(publicKeyInfo, source);
        } else if (object instanceof PrivateKeyInfo privateKeyInfo) {
            return fromPrivateKeyInfo(privateKeyInfo, source);
        } else if (object instanceof PEMKeyPair keyPair) {
            return fromPrivateKeyInfo(keyPair.getPrivateKeyInfo(), source);
        } else if (object instanceof PKCS8EncryptedPrivateKeyInfo encrypted) {
            return fromPrivateKeyInfo(decrypt(encrypted, password, source), source);
        } else if (object instanceof PEMEncryptedKeyPair encrypted) {
            return fromPrivateKeyInfo(decrypt(encrypted, password, source).getPrivateKeyInfo(), source);
        }
        return null;
    }

    private static PrivateKeyInfo decrypt(PKCS8EncryptedPrivateKeyInfo encrypted, PasswordSource password,
            String source) throws KeyResolutionException {
        var chars = toChars(password.obtain(source));
        try {
            logger.debug("Decrypting PKCS#8 key in {}", source);
            var decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder().setProvider(BOUNCY_CASTLE).build(chars);
            return encrypted.decryptPrivateKeyInfo(decryptor);
        } catch (PKCSException | OperatorCreationException | IllegalArgumentException e) {
            throw new AuthenticationFailedException(source, "error decrypting " + source, e);
        } finally {
            Arrays.fill(chars, '\0');
        }
    }

    private static PEMKeyPair decrypt(PEMEncryptedKeyPair encrypted, PasswordSource password, String source)
            throws KeyResolutionException {
        var chars = toChars(password.obtain(source));
        try {
            logger.debug("Decrypting legacy OpenSSL key in {}", source);
            var decryptor = new JcePEMDecryptorProviderBuilder().setProvider(BOUNCY_CASTLE).build(chars);
            return encrypted.decryptKeyPair(decryptor);
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new AuthenticationFailedException(source, "error decrypting " + source, e);
        } finally {
            Arrays.fill(chars, '\0');
        }
    }

    private static KeyMaterial fromPublicKeyInfo(SubjectPublicKeyInfo info, String source)
            throws KeyResolutionException {
        var keyFactory = keyFactory(info.getAlgorithm(), source);
        try {
            var publicKey = keyFactory.generatePublic(new X509EncodedKeySpec(info.getEncoded()));
            return JcaKeys.fromSupportedPublicKey(publicKey)
                    .orElseThrow(() -> new KeyValidationException(source, "error reading " + source
                            + ": unsupported curve"));
        } catch (GeneralSecurityException | IOException e) {
            throw new KeyValidationException(source, "error reading " + source + ": invalid public key", e);
        }
    }

    private static KeyMaterial fromPrivateKeyInfo(PrivateKeyInfo info, String source) throws KeyResolutionException {
        var keyFactory = keyFactory(info.getPrivateKeyAlgorithm(), source);
        byte[] encoded = null;
        try {
            encoded = info.getEncoded();
            return JcaKeys.fromKey(keyFactory.generatePrivate(new PKCS8EncodedKeySpec(encoded)));
        } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
            throw new KeyValidationException(source, "error reading " + source + ": invalid private key", e);
        } finally {
            Utils.wipe(encoded);
        }
    }

    private static KeyFactory keyFactory(AlgorithmIdentifier algorithm, String source) throws KeyResolutionException {
        var name = KEY_ALGORITHMS.get(algorithm.getAlgorithm());
        if (name == null) {
            throw new KeyValidationException(source, "error reading " + source + ": unsupported key algorithm "
                    + algorithm.getAlgorithm());
        }
        try {
            return KeyFactory.getInstance(name);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("JDK does not support " + name, e);
        }
    }

    private static X509Certificate toCertificate(X509CertificateHolder holder, String source)
            throws KeyResolutionException {
        try {
            var factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(holder.getEncoded()));
        } catch (GeneralSecurityException | IOException e) {
            throw new KeyValidationException(source, "error reading " + source + ": invalid certificate", e);
        }
    }

    private static char[] toChars(byte[] password) {
        try {
            var chars = UTF_8.decode(ByteBuffer.wrap(password));
            var result = new char[chars.remaining()];
            chars.get(result);
            if (chars.hasArray()) {
                Arrays.fill(chars.array(), '\0');
            }
            return result;
        } finally {
            Utils.wipe(password);
        }
    }

    private PemDecoder() {}
}
