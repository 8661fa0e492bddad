package com.ghapp.auth.jwt.key;

import java.util.Arrays;
import java.util.Base64;

/**
 * DER bytes of a private key as they appeared in a PEM block.
 */
public final class PrivateKeyMaterial {

    private final byte[] der;

    public PrivateKeyMaterial(byte[] der) {
        this.der = der.clone();
    }

    public byte[] der() {
        return der.clone();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(der);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PrivateKeyMaterial other && Arrays.equals(der, other.der);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(der);
    }

    @Override
    public String toString() {
        return "PrivateKeyMaterial[" + der.length + " bytes]";
    }
}
