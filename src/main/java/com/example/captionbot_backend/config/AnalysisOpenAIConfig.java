package com.example.captionbot_backend.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(AnalysisProperties.class)
public class AnalysisOpenAIConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisOpenAIConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final Duration RESPONSE_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration READ_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration WRITE_TIMEOUT = Duration.ofMinutes(1);
    private static final int MAX_CONNECTIONS = 4;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean("analysisWebClient")
    WebClient analysisWebClient(AnalysisProperties props) {
        ConnectionProvider provider = ConnectionProvider.builder("openai-analysis")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .responseTimeout(RESPONSE_TIMEOUT)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(READ_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(WRITE_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                );

        LOGGER.info("Configuring analysis WebClient model={} connect={}ms response={}s maxConn={} apiKeyPresent={}",
                props.getModel(),
                CONNECT_TIMEOUT_MILLIS,
                RESPONSE_TIMEOUT.toSeconds(),
                MAX_CONNECTIONS,
                props.hasApiKey());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024));
        if (props.hasApiKey()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getApiKey().trim());
        }
        return builder.build();
    }
}
