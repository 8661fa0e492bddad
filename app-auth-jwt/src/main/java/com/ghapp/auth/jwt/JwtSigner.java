package com.ghapp.auth.jwt;

import com.ghapp.auth.jwt.key.PrivateKeyMaterial;

/**
 * Produces the compact {@code header.payload.signature} form of an App JWT.
 */
public interface JwtSigner {

    /**
     * @throws AppAuthException with {@link ErrorKind#INVALID_KEY_MATERIAL} when the key cannot sign
     */
    String sign(JwtHeader header, JwtPayload.Claims claims, PrivateKeyMaterial key);

    default String sign(JwtHeader header, JwtPayload payload, PrivateKeyMaterial key) {
        return sign(header, payload.claims(), key);
    }
}
