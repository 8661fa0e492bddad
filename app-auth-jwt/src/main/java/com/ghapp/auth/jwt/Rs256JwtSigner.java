package com.ghapp.auth.jwt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ghapp.auth.jwt.key.PrivateKeyMaterial;
import com.ghapp.auth.jwt.key.RsaKeyLoader;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.SecureRequest;
import io.jsonwebtoken.security.SecurityException;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.SecureRandom;
import java.util.Objects;

/**
 * RSASSA-PKCS1-v1_5 with SHA-256. The output is deterministic for a given key and claims.
 */
public final class Rs256JwtSigner implements JwtSigner {

    private final ObjectMapper mapper;

    public Rs256JwtSigner() {
        this(new ObjectMapper());
    }

    public Rs256JwtSigner(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String sign(JwtHeader header, JwtPayload.Claims claims, PrivateKeyMaterial key) {
        PrivateKey privateKey = RsaKeyLoader.toPrivateKey(key);

        String signingInput = encode(toJson(header)) + "." + encode(toJson(claims));
        byte[] signature;
        try {
            signature = Jwts.SIG.RS256.digest(
                new SigningRequest(new ByteArrayInputStream(signingInput.getBytes(StandardCharsets.US_ASCII)), privateKey));
        } catch (SecurityException e) {
            throw new AppAuthException(ErrorKind.INVALID_KEY_MATERIAL, "Unable to sign App JWT", e);
        }
        return signingInput + "." + Encoders.BASE64URL.encode(signature);
    }

    String toJson(Object segment) {
        try {
            return mapper.writeValueAsString(segment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JWT segment", e);
        }
    }

    private static String encode(String json) {
        return Encoders.BASE64URL.encode(json.getBytes(StandardCharsets.UTF_8));
    }

    private record SigningRequest(InputStream payload, PrivateKey key) implements SecureRequest<InputStream, PrivateKey> {

        @Override
        public InputStream getPayload() {
            return payload;
        }

        @Override
        public PrivateKey getKey() {
            return key;
        }

        @Override
        public Provider getProvider() {
            return null;
        }

        @Override
        public SecureRandom getSecureRandom() {
            return null;
        }
    }
}
