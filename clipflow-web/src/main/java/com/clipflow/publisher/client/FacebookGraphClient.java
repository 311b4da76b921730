package com.clipflow.publisher.client;

import com.clipflow.publisher.exception.RemoteRejectionException;
import com.clipflow.publisher.exception.ValidationException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.util.AppConstants;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Meta Graph API calls shared by Facebook pages and Instagram business accounts: token
 * maintenance, the page connection handshake, video publishing and insights.
 */
@Slf4j
@Component
public class FacebookGraphClient implements CredentialExchangeClient {

    private final String graphUrl;
    private final String appId;
    private final String appSecret;
    private final RestTemplate restTemplate;
    private final RemoteErrorTranslator errorTranslator;
    private final Clock clock;

    public FacebookGraphClient(@Value("${app.facebook.graph-url:https://graph.facebook.com/v18.0}") String graphUrl,
                               @Value("${app.facebook.app-id:}") String appId,
                               @Value("${app.facebook.app-secret:}") String appSecret,
                               RestTemplate restTemplate,
                               RemoteErrorTranslator errorTranslator,
                               Clock clock) {
        this.graphUrl = graphUrl;
        this.appId = appId;
        this.appSecret = appSecret;
        this.restTemplate = restTemplate;
        this.errorTranslator = errorTranslator;
        this.clock = clock;
    }

    @Override
    public boolean isConfigured() {
        return appId != null && !appId.isBlank() && appSecret != null && !appSecret.isBlank();
    }

    @Override
    public TokenIntrospection introspect(String accessToken) {
        requireAppConfig();
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/debug_token")
                .queryParam("input_token", accessToken)
                .queryParam("access_token", appId + "|" + appSecret)
                .build().encode().toUri();
        JsonNode data = get(uri, Platform.FACEBOOK).path("data");

        List<String> scopes = new ArrayList<>();
        data.path("scopes").forEach(scope -> scopes.add(scope.asText()));

        // expires_at is in seconds; 0 marks a token that never expires
        long expiresAt = data.path("expires_at").asLong(0);
        LocalDateTime expiry = expiresAt > 0
                ? LocalDateTime.ofInstant(Instant.ofEpochSecond(expiresAt), clock.getZone())
                : null;

        String error = data.path("error").path("message").asText(null);
        return new TokenIntrospection(data.path("is_valid").asBoolean(false), expiry, scopes, error);
    }

    @Override
    public ExchangedToken exchangeForLongLivedToken(String accessToken) {
        requireAppConfig();
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/oauth/access_token")
                .queryParam("grant_type", "fb_exchange_token")
                .queryParam("client_id", appId)
                .queryParam("client_secret", appSecret)
                .queryParam("fb_exchange_token", accessToken)
                .build().encode().toUri();
        return toToken(get(uri, Platform.FACEBOOK));
    }

    public ExchangedToken exchangeAuthorizationCode(String code, String redirectUri) {
        requireAppConfig();
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/oauth/access_token")
                .queryParam("client_id", appId)
                .queryParam("client_secret", appSecret)
                .queryParam("redirect_uri", redirectUri)
                .queryParam("code", code)
                .build().encode().toUri();
        return toToken(get(uri, Platform.FACEBOOK));
    }

    public List<ManagedPage> listManagedPages(String userAccessToken) {
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/me/accounts")
                .queryParam("fields", "id,name,access_token")
                .queryParam("access_token", userAccessToken)
                .build().encode().toUri();
        List<ManagedPage> pages = new ArrayList<>();
        for (JsonNode page : get(uri, Platform.FACEBOOK).path("data")) {
            pages.add(new ManagedPage(
                    page.path("id").asText(),
                    page.path("name").asText(null),
                    page.path("access_token").asText(null)));
        }
        return pages;
    }

    public Optional<String> findInstagramAccountId(String pageId, String pageAccessToken) {
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/{pageId}")
                .queryParam("fields", "instagram_business_account")
                .queryParam("access_token", pageAccessToken)
                .buildAndExpand(pageId).encode().toUri();
        String id = get(uri, Platform.FACEBOOK).path("instagram_business_account").path("id").asText(null);
        return Optional.ofNullable(id).filter(value -> !value.isBlank());
    }

    public String publishPageVideo(String pageId, String fileUrl, String description, String accessToken) {
        Map<String, Object> body = Map.of(
                "file_url", fileUrl,
                "description", description,
                "access_token", accessToken);
        return requireId(post(graphUrl + "/" + pageId + "/videos", body, Platform.FACEBOOK), "video upload");
    }

    public String createReelContainer(String igUserId, String videoUrl, String caption, String accessToken) {
        Map<String, Object> body = Map.of(
                "media_type", "REELS",
                "video_url", videoUrl,
                "caption", caption,
                "access_token", accessToken);
        return requireId(post(graphUrl + "/" + igUserId + "/media", body, Platform.INSTAGRAM), "reel container");
    }

    public String containerStatus(String containerId, String accessToken) {
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/{containerId}")
                .queryParam("fields", "status_code")
                .queryParam("access_token", accessToken)
                .buildAndExpand(containerId).encode().toUri();
        return get(uri, Platform.INSTAGRAM).path("status_code").asText("");
    }

    public String publishContainer(String igUserId, String containerId, String accessToken) {
        Map<String, Object> body = Map.of(
                "creation_id", containerId,
                "access_token", accessToken);
        return requireId(post(graphUrl + "/" + igUserId + "/media_publish", body, Platform.INSTAGRAM), "media publish");
    }

    public Optional<String> permalink(String mediaId, String accessToken) {
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/{mediaId}")
                .queryParam("fields", "permalink")
                .queryParam("access_token", accessToken)
                .buildAndExpand(mediaId).encode().toUri();
        return Optional.ofNullable(get(uri, Platform.INSTAGRAM).path("permalink").asText(null));
    }

    /**
     * Latest value of each requested insight metric, keyed by metric name. Metrics the Graph API
     * omits are absent from the map.
     */
    public Map<String, JsonNode> fetchInsights(String objectId, List<String> metrics, String accessToken, Platform platform) {
        URI uri = UriComponentsBuilder.fromHttpUrl(graphUrl)
                .path("/{objectId}/insights")
                .queryParam("metric", String.join(",", metrics))
                .queryParam("access_token", accessToken)
                .buildAndExpand(objectId).encode().toUri();
        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (JsonNode metric : get(uri, platform).path("data")) {
            JsonNode latest = metric.path("values").path(0).path("value");
            if (!latest.isMissingNode()) {
                values.put(metric.path("name").asText(), latest);
            }
        }
        return values;
    }

    private JsonNode get(URI uri, Platform platform) {
        try {
            JsonNode response = restTemplate.getForObject(uri, JsonNode.class);
            return requireBody(response);
        } catch (RestClientException e) {
            throw errorTranslator.translateGraph(platform, e);
        }
    }

    private JsonNode post(String url, Map<String, Object> body, Platform platform) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            JsonNode response = restTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
            return requireBody(response);
        } catch (RestClientException e) {
            throw errorTranslator.translateGraph(platform, e);
        }
    }

    private static JsonNode requireBody(JsonNode response) {
        if (response == null) {
            throw new RemoteRejectionException(AppConstants.SERVICE_FACEBOOK, 0, "Empty response from Graph API");
        }
        return response;
    }

    private static String requireId(JsonNode response, String operation) {
        String id = response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            throw new RemoteRejectionException(AppConstants.SERVICE_FACEBOOK, 0,
                    "Graph API returned no id for " + operation);
        }
        return id;
    }

    private static ExchangedToken toToken(JsonNode response) {
        String token = response.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new RemoteRejectionException(AppConstants.SERVICE_FACEBOOK, 0, "No access token received");
        }
        return new ExchangedToken(token, response.path("expires_in").asLong(0));
    }

    private void requireAppConfig() {
        if (!isConfigured()) {
            throw new ValidationException("Facebook app ID or app secret not configured");
        }
    }
}
