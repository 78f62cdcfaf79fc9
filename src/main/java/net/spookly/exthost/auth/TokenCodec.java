package net.spookly.exthost.auth;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.exthost.error.AuthenticationException;
import net.spookly.exthost.extension.Capability;
import net.spookly.exthost.extension.ExtensionIdentity;

/**
 * Issues and verifies the HS256 compact tokens handed to launched extensions.
 * <p>
 * A token is bound to one host instance: it is signed with that instance's random key and
 * carries the instance address as audience, so it is useless against any other instance.
 */
public final class TokenCodec {
    public static final String ISSUER = "exthost";
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String JWT_ALGORITHM = "HS256";
    private static final String HEADER_JSON = "{\"alg\":\"HS256\",\"typ\":\"JWT\"}";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final Clock clock;
    private final Duration ttl;

    public TokenCodec() {
        this(Clock.systemUTC(), DEFAULT_TTL);
    }

    public TokenCodec(Clock clock, Duration ttl) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? DEFAULT_TTL : ttl;
    }

    /**
     * Mint a token for the extension, scoped to its declared capabilities and to this server.
     */
    public String generate(ExtensionIdentity extension, ServerInfo serverInfo) {
        if (extension == null) {
            throw new IllegalArgumentException("extension is required");
        }
        if (serverInfo == null) {
            throw new IllegalArgumentException("server info is required");
        }
        long issuedAt = clock.instant().getEpochSecond();
        List<String> capabilities = new ArrayList<>();
        for (Capability capability : extension.capabilities()) {
            capabilities.add(capability.id());
        }
        ExtensionClaims claims = new ExtensionClaims(
                extension.id(),
                ISSUER,
                List.of(serverInfo.address()),
                issuedAt,
                issuedAt + ttl.getSeconds(),
                capabilities
        );
        String signingInput = ENCODER.encodeToString(HEADER_JSON.getBytes(StandardCharsets.UTF_8))
                + "." + ENCODER.encodeToString(encode(claims));
        return signingInput + "." + ENCODER.encodeToString(sign(signingInput, serverInfo.signingKey()));
    }

    /**
     * Verify signature, issuer, audience and expiry and return the claims.
     *
     * @throws AuthenticationException on any failed check
     */
    public ExtensionClaims validate(String token, ServerInfo serverInfo) {
        if (serverInfo == null) {
            throw new IllegalArgumentException("server info is required");
        }
        String[] parts = split(token);
        Map<String, Object> header = decodeHeader(parts[0]);
        if (!JWT_ALGORITHM.equals(header.get("alg"))) {
            throw new AuthenticationException("unexpected signing algorithm");
        }
        byte[] signature = decodeSegment(parts[2], "signature");
        byte[] expected = sign(parts[0] + "." + parts[1], serverInfo.signingKey());
        if (!MessageDigest.isEqual(expected, signature)) {
            throw new AuthenticationException("invalid token signature");
        }
        ExtensionClaims claims = decodeClaims(parts[1]);
        if (!ISSUER.equals(claims.issuer())) {
            throw new AuthenticationException("invalid token issuer");
        }
        if (claims.audience() == null || !claims.audience().contains(serverInfo.address())) {
            throw new AuthenticationException("token audience does not match this server");
        }
        long now = clock.instant().getEpochSecond();
        if (now >= claims.expiresAt()) {
            throw new AuthenticationException("token has expired");
        }
        if (claims.subject() == null || claims.subject().trim().isEmpty()) {
            throw new AuthenticationException("token subject is missing");
        }
        return claims;
    }

    /**
     * Parse the claims without checking the signature. Never use the result to authorize a call.
     */
    public ExtensionClaims extractUnverified(String token) {
        return decodeClaims(split(token)[1]);
    }

    private String[] split(String token) {
        if (token == null || token.trim().isEmpty()) {
            throw new AuthenticationException("token is missing");
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
            throw new AuthenticationException("token is malformed");
        }
        return parts;
    }

    private Map<String, Object> decodeHeader(String segment) {
        try {
            return MAPPER.readValue(decodeSegment(segment, "header"), new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new AuthenticationException("token header is not valid JSON", e);
        }
    }

    private ExtensionClaims decodeClaims(String segment) {
        try {
            return MAPPER.readValue(decodeSegment(segment, "claims"), ExtensionClaims.class);
        } catch (IOException e) {
            throw new AuthenticationException("token claims are not valid JSON", e);
        }
    }

    private byte[] decodeSegment(String segment, String name) {
        try {
            return DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("token " + name + " is not base64url", e);
        }
    }

    private byte[] encode(ExtensionClaims claims) {
        try {
            return MAPPER.writeValueAsBytes(claims);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode token claims", e);
        }
    }

    private byte[] sign(String signingInput, byte[] key) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            return mac.doFinal(signingInput.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to compute token signature", e);
        }
    }
}
