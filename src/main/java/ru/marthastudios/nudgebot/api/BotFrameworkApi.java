package ru.marthastudios.nudgebot.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;
import ru.marthastudios.nudgebot.dto.botframework.ActivityDto;
import ru.marthastudios.nudgebot.dto.botframework.ResourceResponseDto;
import ru.marthastudios.nudgebot.dto.botframework.TokenResponseDto;
import ru.marthastudios.nudgebot.property.BotProperty;

/**
 * Bot Framework connector client: app token plus posting activities into conversations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BotFrameworkApi {
    private static final String TOKEN_URL_TEMPLATE = "https://login.microsoftonline.com/%s/oauth2/v2.0/token";
    private static final String MULTI_TENANT_AUTHORITY = "botframework.com";
    private static final String BOT_FRAMEWORK_SCOPE = "https://api.botframework.com/.default";
    private static final long TOKEN_EXPIRY_MARGIN_MS = 60000;

    private final RestTemplate restTemplate;
    private final BotProperty botProperty;

    private String cachedToken;
    private long tokenExpiresAt;

    public ResourceResponseDto sendToConversation(String serviceUrl, String conversationId, ActivityDto activity) {
        String url = trimServiceUrl(serviceUrl) + "/v3/conversations/" + conversationId + "/activities";

        return post(url, activity);
    }

    private ResourceResponseDto post(String url, ActivityDto activity) {
        HttpHeaders headers = new HttpHeaders();

        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(getAccessToken());

        HttpEntity<ActivityDto> requestEntity = new HttpEntity<>(activity, headers);

        ResponseEntity<ResourceResponseDto> responseEntity = restTemplate.postForEntity(url, requestEntity, ResourceResponseDto.class);

        return responseEntity.getBody();
    }

    synchronized String getAccessToken() {
        if (cachedToken != null && System.currentTimeMillis() < tokenExpiresAt) {
            return cachedToken;
        }

        HttpHeaders headers = new HttpHeaders();

        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();

        form.add("grant_type", "client_credentials");
        form.add("client_id", botProperty.getAppId());
        form.add("client_secret", botProperty.getAppSecret());
        form.add("scope", BOT_FRAMEWORK_SCOPE);

        HttpEntity<MultiValueMap<String, String>> requestEntity = new HttpEntity<>(form, headers);

        TokenResponseDto tokenResponseDto = restTemplate.postForEntity(getTokenUrl(), requestEntity, TokenResponseDto.class).getBody();

        if (tokenResponseDto == null || tokenResponseDto.getAccessToken() == null) {
            throw new IllegalStateException("Bot Framework token endpoint returned no access token");
        }

        cachedToken = tokenResponseDto.getAccessToken();

        long expiresInMs = tokenResponseDto.getExpiresIn() != null ? tokenResponseDto.getExpiresIn() * 1000 : 0;

        tokenExpiresAt = System.currentTimeMillis() + Math.max(0, expiresInMs - TOKEN_EXPIRY_MARGIN_MS);

        log.info("Fetched new Bot Framework access token");

        return cachedToken;
    }

    /**
     * Single-tenant registrations authenticate against their own tenant.
     */
    String getTokenUrl() {
        String tenantId = botProperty.getTenantId();

        return String.format(TOKEN_URL_TEMPLATE, tenantId == null || tenantId.isBlank() ? MULTI_TENANT_AUTHORITY : tenantId);
    }

    private static String trimServiceUrl(String serviceUrl) {
        return serviceUrl.endsWith("/") ? serviceUrl.substring(0, serviceUrl.length() - 1) : serviceUrl;
    }
}
