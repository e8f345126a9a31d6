package com.forecastplatform.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastplatform.common.probability.CandidateValidator;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${services.research.base-url:http://localhost:8090}")
    private String researchUrl;

    @Value("${services.research.timeout-ms:30000}")
    private long researchTimeoutMs;

    @Value("${services.synthesis.base-url:http://localhost:8091}")
    private String synthesisUrl;

    @Value("${services.synthesis.timeout-ms:60000}")
    private long synthesisTimeoutMs;

    @Bean
    public WebClient researchClient(WebClient.Builder builder) {
        return collaboratorClient(builder, researchUrl, researchTimeoutMs, "research");
    }

    @Bean
    public WebClient synthesisClient(WebClient.Builder builder) {
        return collaboratorClient(builder, synthesisUrl, synthesisTimeoutMs, "synthesis");
    }

    @Bean
    public CandidateValidator candidateValidator(
            @Value("${forecast.validation.min-event-length:10}")         int minEventLength,
            @Value("${forecast.validation.min-justification-length:20}") int minJustificationLength) {
        return new CandidateValidator(minEventLength, minJustificationLength);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private WebClient collaboratorClient(WebClient.Builder builder, String baseUrl,
                                         long timeoutMs, String name) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofMillis(timeoutMs));

        return builder.clone()
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter(name))
            .filter(loggingFilter(name))
            .build();
    }

    private ExchangeFilterFunction serverErrorFilter(String name) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(
                    name + " collaborator server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter(String name) {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[Collaborator] Outbound request. collaborator={} method={} url={}",
                      name, clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
