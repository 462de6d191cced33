package com.catalog.browser.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Supplies client credentials on demand. Credentials are read each time a token is
 * requested and are not retained.
 */
@FunctionalInterface
public interface CredentialsSource {

    /**
     * Returns the credentials.
     *
     * @throws CredentialsMissingException if no usable credentials exist
     */
    Credentials load();

    /**
     * Reads {@code {"client_id": ..., "client_secret": ...}} from a JSON file.
     */
    static CredentialsSource fromFile(Path file, ObjectMapper objectMapper) {
        Logger log = LoggerFactory.getLogger(CredentialsSource.class);
        return () -> {
            Credentials credentials;
            try (InputStream in = Files.newInputStream(file)) {
                credentials = objectMapper.readValue(in, Credentials.class);
            } catch (NoSuchFileException e) {
                log.error("Credentials not found at {}", file.toAbsolutePath());
                throw new CredentialsMissingException(file, "file does not exist", e);
            } catch (IOException e) {
                log.error("Credentials at {} could not be read: {}", file.toAbsolutePath(), e.getMessage());
                throw new CredentialsMissingException(file, "file could not be read", e);
            }
            if (credentials == null || !credentials.isComplete()) {
                log.error("Credentials at {} lack client_id or client_secret", file.toAbsolutePath());
                throw new CredentialsMissingException(file, "client_id and client_secret are required", null);
            }
            return credentials;
        };
    }

    /**
     * Returns fixed credentials.
     */
    static CredentialsSource of(Credentials credentials) {
        return () -> {
            if (credentials == null || !credentials.isComplete()) {
                throw new CredentialsMissingException(null, "no credentials supplied", null);
            }
            return credentials;
        };
    }
}
