package com.williamcallahan.ratchet.config;

import com.williamcallahan.ratchet.chat.ChatClient;
import com.williamcallahan.ratchet.chat.SlackChatClient;
import com.williamcallahan.ratchet.web.SlackRequestVerifier;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChatClientConfig {
    private static final Logger log = LoggerFactory.getLogger(ChatClientConfig.class);

    /**
     * @param appProperties application configuration
     * @param restTemplateBuilder RestTemplate builder
     * @return Slack Web API client
     */
    @Bean
    @ConditionalOnMissingBean(ChatClient.class)
    public ChatClient chatClient(AppProperties appProperties, RestTemplateBuilder restTemplateBuilder) {
        AppProperties.Slack slack = appProperties.getSlack();
        if (slack.getBotToken() == null || slack.getBotToken().isBlank()) {
            log.warn("[SLACK] No bot token configured (ratchet.slack.bot-token); Slack API calls will fail");
        }
        return new SlackChatClient(
                slack.getBaseUrl(),
                slack.getBotToken() == null ? "" : slack.getBotToken(),
                slack.getHistoryPageSize(),
                restTemplateBuilder);
    }

    @Bean
    public SlackRequestVerifier slackRequestVerifier(AppProperties appProperties, Clock clock) {
        return new SlackRequestVerifier(appProperties.getSlack().getSigningSecret(), clock);
    }
}
