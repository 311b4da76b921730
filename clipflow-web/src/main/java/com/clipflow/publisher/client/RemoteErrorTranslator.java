package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.CredentialException;
import com.clipflow.publisher.exception.NetworkException;
import com.clipflow.publisher.exception.PipelineException;
import com.clipflow.publisher.exception.RateLimitException;
import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.RemoteTransientException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.util.AppConstants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;
import java.util.Set;

/**
 * Maps HTTP client failures onto the pipeline error taxonomy: 429 is a rate limit, 5xx is
 * transient, any other status is a rejection and an unreachable host is a network failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteErrorTranslator {
    private static final Set<Integer> GRAPH_TOKEN_ERROR_CODES = Set.of(102, 190, 463, 467);
    private static final Set<Integer> GRAPH_THROTTLE_CODES = Set.of(4, 17, 32, 613);
    private static final int MAX_DETAIL_LENGTH = 300;

    private final ObjectMapper objectMapper;

    public PipelineException translate(String service, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            String message = service + " request failed with status " + status + ": " + detail(response);
            if (status == 429) {
                return new RateLimitException(service, message, e);
            }
            if (status >= 500) {
                return new RemoteTransientException(service, status, message, e);
            }
            return new RemoteRejectionException(service, status, message, e);
        }
        if (e instanceof ResourceAccessException) {
            return new NetworkException(service, service + " is unreachable: " + e.getMessage(), e);
        }
        // Unreadable response bodies end up here
        return new RemoteRejectionException(service, 0, service + " request failed: " + e.getMessage(), e);
    }

    /**
     * Graph API variant: expired or revoked tokens become {@link CredentialException} so callers can
     * refresh and retry, and Graph throttling codes become rate limits.
     */
    public PipelineException translateGraph(Platform platform, RestClientException e) {
        if (e instanceof RestClientResponseException response) {
            JsonNode error = graphError(response);
            int code = error.path("code").asInt(-1);
            String message = error.path("message").asText("");
            int status = response.getStatusCode().value();

            if (status == 401 || GRAPH_TOKEN_ERROR_CODES.contains(code) || mentionsToken(message)) {
                return new CredentialException(platform,
                        platform.getDisplayName() + " rejected the access token: " + detail(response), e);
            }
            if (GRAPH_THROTTLE_CODES.contains(code)) {
                return new RateLimitException(AppConstants.SERVICE_FACEBOOK,
                        AppConstants.SERVICE_FACEBOOK + " rate limit reached: " + message, e);
            }
        }
        return translate(AppConstants.SERVICE_FACEBOOK, e);
    }

    private static boolean mentionsToken(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("access token") || lower.contains("session");
    }

    private JsonNode graphError(RestClientResponseException response) {
        String body = response.getResponseBodyAsString();
        if (body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body).path("error");
        } catch (JsonProcessingException e) {
            log.debug("Graph error body is not JSON: {}", body);
            return objectMapper.createObjectNode();
        }
    }

    private String detail(RestClientResponseException response) {
        JsonNode error = graphError(response);
        String message = error.path("message").asText("");
        if (!message.isBlank()) {
            return message;
        }
        String body = response.getResponseBodyAsString();
        if (body.isBlank()) {
            return response.getStatusText();
        }
        return body.length() > MAX_DETAIL_LENGTH ? body.substring(0, MAX_DETAIL_LENGTH) : body;
    }
}
