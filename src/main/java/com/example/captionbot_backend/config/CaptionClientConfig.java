package com.example.captionbot_backend.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * HTTP clients for the captions API and for raw subtitle files handed out by the subtitle tool.
 * Per call timeouts are applied by the adapters; the connector timeouts here are upper bounds.
 */
@Configuration
public class CaptionClientConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CaptionClientConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(30);
    private static final int MAX_IN_MEMORY = 8 * 1024 * 1024;
    private static final String BROWSER_UA = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    @Bean
    @Qualifier("captionApiWebClient")
    public WebClient captionApiWebClient(WebClient.Builder builder, CaptionProperties props) {
        LOGGER.info("Configuring captions API client baseUrl={} connect={}ms response={}s",
                props.getApiBaseUrl(), CONNECT_TIMEOUT_MILLIS, RESPONSE_TIMEOUT.toSeconds());
        return builder.clone()
                .baseUrl(props.getApiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient()))
                .exchangeStrategies(strategies())
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_UA)
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                .build();
    }

    @Bean
    @Qualifier("subtitleWebClient")
    public WebClient subtitleWebClient(WebClient.Builder builder) {
        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient()))
                .exchangeStrategies(strategies())
                .defaultHeader(HttpHeaders.USER_AGENT, BROWSER_UA)
                .build();
    }

    private static HttpClient httpClient() {
        return HttpClient.create()
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .responseTimeout(RESPONSE_TIMEOUT);
    }

    private static ExchangeStrategies strategies() {
        return ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY))
                .build();
    }
}
