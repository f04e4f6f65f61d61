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
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.util.Optional;

import org.bouncycastle.asn1.x9.ECNamedCurveTable;
import org.bouncycastle.asn1.x9.X9ECParameters;

/**
 * The NIST prime curves that may appear in an {@code EC} JSON Web Key.
 */
public enum EcCurve {
    P_256("P-256", "secp256r1", 32),
    P_384("P-384", "secp384r1", 48),
    P_521("P-521", "secp521r1", 66);

    private final String jwkName;
    private final String standardName;
    private final int coordinateLength;
    private volatile ECParameterSpec jcaParameters;

    EcCurve(String jwkName, String standardName, int coordinateLength) {
        this.jwkName = jwkName;
        this.standardName = standardName;
        this.coordinateLength = coordinateLength;
    }

    /**
     * The curve name used in the {@code crv} member of a JWK.
     */
    public String jwkName() {
        return jwkName;
    }

    /**
     * The SEC 2 name of the curve, as understood by the JCA.
     */
    public String standardName() {
        return standardName;
    }

    /**
     * The length in bytes of each encoded coordinate.
     */
    public int coordinateLength() {
        return coordinateLength;
    }

    public static Optional<EcCurve> forJwkName(String crv) {
        for (var curve : values()) {
            if (curve.jwkName.equals(crv)) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    /**
     * Identifies the curve of a JCA key by comparing the domain parameters.
     */
    public static Optional<EcCurve> forJcaParameters(ECParameterSpec params) {
        for (var curve : values()) {
            var known = curve.jcaParameters();
            if (known.getOrder().equals(params.getOrder())
                    && known.getGenerator().equals(params.getGenerator())
                    && known.getCurve().equals(params.getCurve())) {
                return Optional.of(curve);
            }
        }
        return Optional.empty();
    }

    X9ECParameters domainParameters() {
        return ECNamedCurveTable.getByName(standardName);
    }

    ECParameterSpec jcaParameters() {
        var params = jcaParameters;
        if (params == null) {
            try {
                var algorithmParameters = AlgorithmParameters.getInstance("EC");
                algorithmParameters.init(new ECGenParameterSpec(standardName));
                params = algorithmParameters.getParameterSpec(ECParameterSpec.class);
                jcaParameters = params;
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Curve " + jwkName + " not supported by this JVM", e);
            }
        }
        return params;
    }

    /**
     * Checks that the given affine coordinates describe a valid point on this curve.
     *
     * @throws IllegalArgumentException if the point is not on the curve.
     */
    void validatePoint(BigInteger x, BigInteger y) {
        var point = domainParameters().getCurve().validatePoint(x, y);
        if (point.isInfinity()) {
            throw new IllegalArgumentException("Point at infinity");
        }
    }

    /**
     * Computes the public point {@code d·G} for the private scalar {@code d}.
     *
     * @return the affine x and y coordinates.
     */
    BigInteger[] publicPoint(BigInteger d) {
        var params = domainParameters();
        if (d.signum() <= 0 || d.compareTo(params.getN()) >= 0) {
            throw new IllegalArgumentException("Private scalar out of range for " + jwkName);
        }
        var q = params.getG().multiply(d).normalize();
        return new BigInteger[] { q.getAffineXCoord().toBigInteger(), q.getAffineYCoord().toBigInteger() };
    }
}
