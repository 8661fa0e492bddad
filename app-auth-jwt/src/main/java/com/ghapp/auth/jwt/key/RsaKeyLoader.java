package com.ghapp.auth.jwt.key;

import com.ghapp.auth.jwt.AppAuthException;
import com.ghapp.auth.jwt.ErrorKind;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import java.io.IOException;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.util.NoSuchElementException;

/**
 * Turns PEM key material into a JCA RSA key. Accepts PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) as issued
 * by GitHub as well as PKCS#8 ({@code BEGIN PRIVATE KEY}).
 */
public final class RsaKeyLoader {
    private RsaKeyLoader() {}

    public static RSAPrivateKey toPrivateKey(PrivateKeyMaterial material) {
        try {
            ASN1Sequence sequence = ASN1Sequence.getInstance(material.der());
            PrivateKey key = new JcaPEMKeyConverter().getPrivateKey(toPrivateKeyInfo(sequence));
            if (key instanceof RSAPrivateKey rsa) {
                return rsa;
            }
            throw new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL,
                "Expected an RSA private key but found " + key.getAlgorithm());
        } catch (IOException | IllegalArgumentException | ClassCastException | NoSuchElementException e) {
            throw new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL, "Failed to parse RSA private key", e);
        }
    }

    // PKCS#8 wraps the key in SEQUENCE { version, AlgorithmIdentifier, OCTET STRING }; PKCS#1 starts with plain INTEGERs.
    private static PrivateKeyInfo toPrivateKeyInfo(ASN1Sequence sequence) throws IOException {
        if (sequence.size() > 1 && sequence.getObjectAt(1) instanceof ASN1Sequence) {
            return PrivateKeyInfo.getInstance(sequence);
        }
        org.bouncycastle.asn1.pkcs.RSAPrivateKey pkcs1 = org.bouncycastle.asn1.pkcs.RSAPrivateKey.getInstance(sequence);
        return new PrivateKeyInfo(new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE), pkcs1);
    }
}
