package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FacebookGraphClientTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private RestTemplate restTemplate;

    private FacebookGraphClient client;

    @BeforeEach
    void setUp() {
        client = new FacebookGraphClient("https://graph.facebook.test/v18.0", "app-id", "app-secret",
                restTemplate, new RemoteErrorTranslator(objectMapper), CLOCK);
    }

    @Test
    void introspect_shouldReadDebugTokenResponse() throws Exception {
        when(restTemplate.getForObject(any(URI.class), eq(JsonNode.class))).thenReturn(objectMapper.readTree("""
                {"data": {"is_valid": true, "expires_at": 1717243200, "scopes": ["pages_manage_posts", "instagram_content_publish"]}}
                """));

        TokenIntrospection introspection = client.introspect("user-token");

        assertTrue(introspection.valid());
        assertEquals(LocalDateTime.of(2024, 6, 1, 12, 0), introspection.expiresAt());
        assertEquals(List.of("pages_manage_posts", "instagram_content_publish"), introspection.scopes());

        ArgumentCaptor<URI> uri = ArgumentCaptor.forClass(URI.class);
        verify(restTemplate).getForObject(uri.capture(), eq(JsonNode.class));
        assertTrue(uri.getValue().toString().contains("/debug_token"));
        assertTrue(uri.getValue().toString().contains("input_token=user-token"));
    }

    @Test
    void introspect_shouldTreatZeroExpiryAsNeverExpiring() throws Exception {
        when(restTemplate.getForObject(any(URI.class), eq(JsonNode.class))).thenReturn(objectMapper.readTree("""
                {"data": {"is_valid": false, "expires_at": 0, "error": {"message": "Session has expired"}}}
                """));

        TokenIntrospection introspection = client.introspect("user-token");

        assertFalse(introspection.valid());
        assertNull(introspection.expiresAt());
        assertEquals("Session has expired", introspection.error());
    }

    @Test
    void exchangeForLongLivedToken_shouldReturnTokenAndLifetime() throws Exception {
        when(restTemplate.getForObject(any(URI.class), eq(JsonNode.class))).thenReturn(objectMapper.readTree("""
                {"access_token": "long-lived", "token_type": "bearer", "expires_in": 5183944}
                """));

        ExchangedToken token = client.exchangeForLongLivedToken("short-lived");

        assertEquals("long-lived", token.accessToken());
        assertEquals(5183944, token.expiresInSeconds());
    }

    @Test
    void exchangeForLongLivedToken_shouldSurfaceExpiredTokenAsCredentialError() {
        when(restTemplate.getForObject(any(URI.class), eq(JsonNode.class))).thenThrow(new HttpClientErrorException(
                HttpStatus.BAD_REQUEST, "Bad Request",
                "{\"error\":{\"message\":\"Error validating access token\",\"code\":190}}".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8));

        CredentialException error = assertThrows(CredentialException.class, () -> client.exchangeForLongLivedToken("old"));

        assertEquals(Platform.FACEBOOK, error.getPlatform());
    }

    @Test
    void introspect_shouldRequireAppConfiguration() {
        FacebookGraphClient unconfigured = new FacebookGraphClient("https://graph.facebook.test/v18.0", "", "",
                restTemplate, new RemoteErrorTranslator(objectMapper), CLOCK);

        assertFalse(unconfigured.isConfigured());
        assertThrows(ValidationException.class, () -> unconfigured.introspect("token"));
        verifyNoInteractions(restTemplate);
    }
}
