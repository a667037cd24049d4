package com.quickdeploy.back.session.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quickdeploy.back.session.model.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;

/**
 * Converts {@link SessionState} to and from the cookie-safe token the client carries.
 * JSON, then URL-safe Base64 without padding. The token is not signed.
 */
@Slf4j
@Component
public class SessionStateCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public String encode(SessionState state) {
        try {
            byte[] json = objectMapper.writeValueAsBytes(state == null ? SessionState.empty() : state);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session state", e);
        }
    }

    /**
     * Never fails: a missing or unreadable token is an empty session.
     */
    public SessionState decode(String token) {
        if (token == null || token.isBlank()) {
            return SessionState.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(token.trim());
            SessionState state = objectMapper.readValue(json, SessionState.class);
            return state == null ? SessionState.empty() : state.normalize();
        } catch (IllegalArgumentException | IOException e) {
            log.warn("Discarding unreadable session token: {}", e.getMessage());
            return SessionState.empty();
        }
    }
}
