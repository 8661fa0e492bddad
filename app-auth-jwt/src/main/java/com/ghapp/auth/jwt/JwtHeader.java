package com.ghapp.auth.jwt;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"typ", "alg"})
public record JwtHeader(@JsonProperty("typ") String type, @JsonProperty("alg") String algorithm) {

    public static final String RS256 = "RS256";

    public static final JwtHeader DEFAULT = new JwtHeader("JWT", RS256);
}
