package org.lite.ingestion.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * One client stack for both outbound concerns: document downloads and completion calls. The
 * socket timeout is the longer of the two configured timeouts; each caller applies its own
 * deadline on top.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    // Source documents are buffered whole before type detection
    private static final int MAX_DOCUMENT_BYTES = 64 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(IngestionProperties properties) {
        Duration completionTimeout = properties.getCompletion().getRequestTimeout();
        Duration downloadTimeout = properties.getPipeline().getDownloadTimeout();
        Duration socketTimeout = completionTimeout.compareTo(downloadTimeout) >= 0 ? completionTimeout : downloadTimeout;

        HttpClient httpClient = HttpClient.create(connectionProvider())
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .option(ChannelOption.TCP_NODELAY, true)
                .responseTimeout(socketTimeout)
                // Attachment links usually redirect to signed storage URLs
                .followRedirect(true)
                .doOnConnected(connection -> connection
                        .addHandlerLast(new ReadTimeoutHandler((int) socketTimeout.toSeconds()))
                        .addHandlerLast(new WriteTimeoutHandler((int) socketTimeout.toSeconds())));

        log.info("🌐 Outbound client ready (socket timeout {}s, document limit {} MB)",
                socketTimeout.toSeconds(), MAX_DOCUMENT_BYTES / (1024 * 1024));

        return WebClient.builder()
                .exchangeStrategies(exchangeStrategies())
                .clientConnector(new ReactorClientHttpConnector(httpClient));
    }

    private ConnectionProvider connectionProvider() {
        return ConnectionProvider.builder("ingestion-outbound")
                .maxConnections(50)
                .maxIdleTime(Duration.ofSeconds(20))
                .pendingAcquireTimeout(Duration.ofSeconds(45))
                .evictInBackground(Duration.ofSeconds(30))
                .build();
    }

    private ExchangeStrategies exchangeStrategies() {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().maxInMemorySize(MAX_DOCUMENT_BYTES);
                })
                .build();
    }
}
