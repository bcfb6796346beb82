package com.williamcallahan.ratchet.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.ratchet.chat.SlackMessagePayload;
import com.williamcallahan.ratchet.domain.ChatMessage;
import com.williamcallahan.ratchet.domain.SlackTimestamp;
import com.williamcallahan.ratchet.jobs.InsertOptions;
import com.williamcallahan.ratchet.jobs.JobQueue;
import com.williamcallahan.ratchet.jobs.args.ChannelInfoArgs;
import com.williamcallahan.ratchet.service.ingestion.MessageIngestionService;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives the Slack Events API feed.
 *
 * <p>New messages are stored as live messages, reactions adjust stored counts, and channel renames
 * queue a channel info refresh. Every request is signature-checked before its body is read.</p>
 */
@RestController
@RequestMapping("/slack")
public class SlackEventsController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(SlackEventsController.class);

    private static final Set<String> IGNORED_MESSAGE_SUBTYPES = Set.of("message_changed", "message_deleted");

    private final SlackRequestVerifier verifier;
    private final MessageIngestionService ingestionService;
    private final JobQueue jobQueue;
    private final ObjectMapper objectMapper;

    public SlackEventsController(
            SlackRequestVerifier verifier,
            MessageIngestionService ingestionService,
            JobQueue jobQueue,
            ObjectMapper objectMapper,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.verifier = verifier;
        this.ingestionService = ingestionService;
        this.jobQueue = jobQueue;
        this.objectMapper = objectMapper;
    }

    /**
     * Handles one Events API delivery.
     *
     * @param timestamp {@code X-Slack-Request-Timestamp} header
     * @param signature {@code X-Slack-Signature} header
     * @param body raw request body, needed verbatim for signature verification
     * @return the URL verification challenge, or an acknowledgement
     */
    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> handleEvent(
            @RequestHeader(value = "X-Slack-Request-Timestamp", required = false) String timestamp,
            @RequestHeader(value = "X-Slack-Signature", required = false) String signature,
            @RequestBody String body) throws JsonProcessingException {
        verifier.verify(timestamp, signature, body);
        JsonNode envelope = objectMapper.readTree(body);
        if (envelope == null || !envelope.isObject()) {
            throw new IllegalArgumentException("Event body must be a JSON object");
        }

        String type = envelope.path("type").asText("");
        switch (type) {
            case "url_verification" -> {
                return ResponseEntity.ok(Map.of("challenge", envelope.path("challenge").asText("")));
            }
            case "event_callback" -> handleCallback(envelope.path("event"));
            default -> log.debug("[SLACK] Ignoring envelope of type '{}'", type);
        }
        return exceptionBuilder.buildSuccessResponse(Map.of());
    }

    private void handleCallback(JsonNode event) throws JsonProcessingException {
        String eventType = event.path("type").asText("");
        switch (eventType) {
            case "message" -> handleMessage(event);
            case "reaction_added" -> handleReaction(event, 1);
            case "reaction_removed" -> handleReaction(event, -1);
            case "channel_rename" -> handleRename(event);
            default -> log.debug("[SLACK] Ignoring event of type '{}'", eventType);
        }
    }

    private void handleMessage(JsonNode event) throws JsonProcessingException {
        String subtype = event.path("subtype").asText(null);
        if (subtype != null && IGNORED_MESSAGE_SUBTYPES.contains(subtype)) {
            log.debug("[SLACK] Ignoring message event with subtype {}", subtype);
            return;
        }
        String channelId = requireText(event, "channel");
        ChatMessage message = objectMapper.treeToValue(event, SlackMessagePayload.class).toChatMessage();
        if (message.ts() == null) {
            throw new IllegalArgumentException("Message event is missing ts");
        }
        if (ingestionService.recordLiveMessage(channelId, message)) {
            log.debug("[SLACK] Stored live message {} in {}", message.ts(), channelId);
        }
    }

    private void handleReaction(JsonNode event, int delta) {
        JsonNode item = event.path("item");
        if (!"message".equals(item.path("type").asText("message"))) {
            return;
        }
        String channelId = requireText(item, "channel");
        SlackTimestamp ts = SlackTimestamp.parse(requireText(item, "ts"));
        ingestionService.recordReaction(channelId, ts, requireText(event, "reaction"), delta);
    }

    private void handleRename(JsonNode event) {
        String channelId = requireText(event.path("channel"), "id");
        jobQueue.enqueue(new ChannelInfoArgs(channelId), InsertOptions.defaults().uniqueBy(channelId));
        log.info("[SLACK] Channel {} renamed; info refresh queued", channelId);
    }

    private static String requireText(JsonNode node, String field) {
        String value = node.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Event is missing '" + field + "'");
        }
        return value;
    }

    @ExceptionHandler(InvalidSlackSignatureException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSignature(InvalidSlackSignatureException signatureException) {
        log.warn("[SLACK] Rejected event: {}", signatureException.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.UNAUTHORIZED, signatureException.getMessage());
    }

    @ExceptionHandler(JsonProcessingException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedBody(JsonProcessingException malformed) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed event body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException validationException) {
        return handleValidationException(validationException);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, Object>> handleFailure(RuntimeException failure) {
        log.error("[SLACK] Event handling failed", failure);
        return handleServiceException(failure, "handle event");
    }
}
