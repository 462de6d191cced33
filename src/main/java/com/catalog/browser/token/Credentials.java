package com.catalog.browser.token;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Client identifier and secret supplied by the operator.
 * Never cached, persisted or logged by the core.
 */
public record Credentials(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret
) {

    @JsonIgnore
    public boolean isComplete() {
        return clientId != null && !clientId.isBlank() && clientSecret != null && !clientSecret.isBlank();
    }

    @Override
    public String toString() {
        return "Credentials[clientId=" + clientId + ", clientSecret=***]";
    }
}
