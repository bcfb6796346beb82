package com.williamcallahan.ratchet.chat;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link ChatClient} over the Slack Web API.
 *
 * <p>Slack reports most failures as HTTP 200 with {@code "ok": false}; those are raised as
 * {@link ChatApiException}, and throttling (HTTP 429 or {@code ratelimited}) as
 * {@link ChatRateLimitedException}.</p>
 */
public class SlackChatClient implements ChatClient {
    private static final Logger log = LoggerFactory.getLogger(SlackChatClient.class);

    private static final int CONNECT_TIMEOUT_SECONDS = 10;
    private static final int READ_TIMEOUT_SECONDS = 30;
    private static final int REPLIES_PAGE_SIZE = 200;
    private static final String RATE_LIMITED = "ratelimited";

    private final String baseUrl;
    private final String botToken;
    private final int historyPageSize;
    private final RestTemplate restTemplate;

    /**
     * Creates a client for the Slack Web API.
     *
     * @param baseUrl API root, normally {@code https://slack.com/api}
     * @param botToken bot OAuth token
     * @param historyPageSize messages per history page
     * @param restTemplateBuilder RestTemplate builder
     */
    public SlackChatClient(String baseUrl, String botToken, int historyPageSize, RestTemplateBuilder restTemplateBuilder) {
        this(baseUrl, botToken, historyPageSize, restTemplateBuilder
                .connectTimeout(Duration.ofSeconds(CONNECT_TIMEOUT_SECONDS))
                .readTimeout(Duration.ofSeconds(READ_TIMEOUT_SECONDS))
                .build());
    }

    SlackChatClient(String baseUrl, String botToken, int historyPageSize, RestTemplate restTemplate) {
        if (historyPageSize <= 0) {
            throw new IllegalArgumentException("historyPageSize must be positive");
        }
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.botToken = Objects.requireNonNull(botToken, "botToken");
        this.historyPageSize = historyPageSize;
        this.restTemplate = restTemplate;
    }

    @Override
    public HistoryPage fetchHistory(String channelId, SlackTimestamp oldestExclusive, String cursor) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl + "/conversations.history")
                .queryParam("channel", channelId)
                .queryParam("limit", historyPageSize)
                .queryParam("inclusive", false);
        if (oldestExclusive != null) {
            uri.queryParam("oldest", oldestExclusive.value());
        }
        if (cursor != null) {
            uri.queryParam("cursor", cursor);
        }
        HistoryResponse response = get("conversations.history", uri.encode().build().toUri(), HistoryResponse.class);
        List<ChatMessage> messages = toAscending(response.messages());
        log.debug("[SLACK] History page for {}: {} message(s), more={}", channelId, messages.size(), response.hasMore());
        return new HistoryPage(messages, response.hasMore() ? response.nextCursor() : null);
    }

    @Override
    public List<ChatMessage> fetchReplies(String channelId, SlackTimestamp parentTs) {
        List<ChatMessage> replies = new ArrayList<>();
        String cursor = null;
        do {
            UriComponentsBuilder uri = UriComponentsBuilder.fromUriString(baseUrl + "/conversations.replies")
                    .queryParam("channel", channelId)
                    .queryParam("ts", parentTs.value())
                    .queryParam("limit", REPLIES_PAGE_SIZE);
            if (cursor != null) {
                uri.queryParam("cursor", cursor);
            }
            HistoryResponse response = get("conversations.replies", uri.encode().build().toUri(), HistoryResponse.class);
            for (ChatMessage message : toAscending(response.messages())) {
                if (!parentTs.equals(message.timestamp())) {
                    replies.add(message);
                }
            }
            cursor = response.hasMore() ? response.nextCursor() : null;
        } while (cursor != null && !cursor.isBlank());
        return List.copyOf(replies);
    }

    @Override
    public ChannelInfo fetchChannelInfo(String channelId) {
        URI uri = UriComponentsBuilder.fromUriString(baseUrl + "/conversations.info")
                .queryParam("channel", channelId)
                .encode()
                .build()
                .toUri();
        ChannelInfoResponse response = get("conversations.info", uri, ChannelInfoResponse.class);
        if (response.channel() == null) {
            throw new ChatApiException("conversations.info returned no channel for " + channelId);
        }
        return new ChannelInfo(response.channel().id(), response.channel().name());
    }

    @Override
    public String postMessage(String channelId, String text, List<Map<String, Object>> blocks) {
        return post(new PostMessageRequest(channelId, text, blocks, null));
    }

    @Override
    public String postThreadReply(String channelId, SlackTimestamp threadTs, String text) {
        return post(new PostMessageRequest(channelId, text, null, threadTs.value()));
    }

    private String post(PostMessageRequest request) {
        HttpHeaders headers = authorizedHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        PostMessageResponse response = exchange(
                "chat.postMessage",
                URI.create(baseUrl + "/chat.postMessage"),
                HttpMethod.POST,
                new HttpEntity<>(request, headers),
                PostMessageResponse.class);
        return response.ts();
    }

    private <T extends SlackResponse> T get(String method, URI uri, Class<T> responseType) {
        return exchange(method, uri, HttpMethod.GET, new HttpEntity<>(authorizedHeaders()), responseType);
    }

    private <T extends SlackResponse> T exchange(
            String method, URI uri, HttpMethod httpMethod, HttpEntity<?> entity, Class<T> responseType) {
        T body;
        try {
            body = restTemplate.exchange(uri, httpMethod, entity, responseType).getBody();
        } catch (RestClientResponseException httpFailure) {
            if (httpFailure.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new ChatRateLimitedException(method, retryAfter(httpFailure.getResponseHeaders()));
            }
            throw new ChatApiException(
                    "Slack " + method + " failed with HTTP " + httpFailure.getStatusCode().value(), httpFailure);
        } catch (RestClientException transportFailure) {
            throw new ChatApiException("Slack " + method + " request failed: " + transportFailure.getMessage(), transportFailure);
        }
        if (body == null) {
            throw new ChatApiException("Slack " + method + " returned an empty body");
        }
        if (!body.ok()) {
            if (RATE_LIMITED.equals(body.error())) {
                throw new ChatRateLimitedException(method, null);
            }
            throw new ChatApiException("Slack " + method + " failed: " + body.error());
        }
        return body;
    }

    private HttpHeaders authorizedHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(botToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException unparseable) {
            log.debug("[SLACK] Ignoring non-numeric Retry-After header: {}", value);
            return null;
        }
    }

    private static List<ChatMessage> toAscending(List<SlackMessagePayload> payloads) {
        if (payloads == null) {
            return List.of();
        }
        return payloads.stream()
                .filter(payload -> payload.ts() != null)
                .map(SlackMessagePayload::toChatMessage)
                .sorted(Comparator.comparing(ChatMessage::timestamp))
                .toList();
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    interface SlackResponse {
        boolean ok();

        String error();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ResponseMetadata(@JsonProperty("next_cursor") String nextCursor) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record HistoryResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("error") String error,
            @JsonProperty("messages") List<SlackMessagePayload> messages,
            @JsonProperty("has_more") boolean hasMore,
            @JsonProperty("response_metadata") ResponseMetadata responseMetadata) implements SlackResponse {

        String nextCursor() {
            return responseMetadata == null ? null : responseMetadata.nextCursor();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChannelPayload(@JsonProperty("id") String id, @JsonProperty("name") String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChannelInfoResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("error") String error,
            @JsonProperty("channel") ChannelPayload channel) implements SlackResponse {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PostMessageRequest(
            @JsonProperty("channel") String channel,
            @JsonProperty("text") String text,
            @JsonProperty("blocks") List<Map<String, Object>> blocks,
            @JsonProperty("thread_ts") String threadTs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PostMessageResponse(
            @JsonProperty("ok") boolean ok,
            @JsonProperty("error") String error,
            @JsonProperty("ts") String ts) implements SlackResponse {}
}
