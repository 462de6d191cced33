package com.catalog.browser.token;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Access credential issued by the catalog service.
 *
 * @param accessToken  the bearer value
 * @param tokenType    token type, usually {@code Bearer}
 * @param expiresAt    instant after which the service rejects the token
 * @param refreshToken refresh material, absent for client-credentials tokens
 */
public record AccessToken(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("refresh_token") String refreshToken
) {

    private static final int PREFIX_LENGTH = 8;

    /**
     * Creates a bearer token expiring {@code expiresIn} after {@code issuedAt}.
     */
    public static AccessToken bearer(String accessToken, Duration expiresIn, Instant issuedAt) {
        return new AccessToken(accessToken, "Bearer", issuedAt.plus(expiresIn), null);
    }

    /**
     * Returns true if the token has a value and an expiry.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return accessToken != null && !accessToken.isBlank() && expiresAt != null;
    }

    /**
     * Returns true if the token expires within {@code margin} of {@code now}.
     */
    public boolean isExpiring(Instant now, Duration margin) {
        return expiresAt == null || !now.plus(margin).isBefore(expiresAt);
    }

    /**
     * Returns the first characters of the token value, safe to log.
     */
    public String prefix() {
        if (accessToken == null) {
            return "";
        }
        return accessToken.substring(0, Math.min(PREFIX_LENGTH, accessToken.length()));
    }

    @Override
    public String toString() {
        return "AccessToken[" + prefix() + "..., type=" + tokenType + ", expiresAt=" + expiresAt + "]";
    }
}
