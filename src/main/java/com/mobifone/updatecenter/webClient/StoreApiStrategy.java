package com.mobifone.updatecenter.webClient;

import com.mobifone.updatecenter.common.Constants;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Store platform HTTP API: installer submission, progress handles and the package inventory.
 */
@Component
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class StoreApiStrategy implements ApiStrategy {

    WebClient webClient;
    Duration timeout;

    public StoreApiStrategy(WebClient.Builder builder,
                            @Value("${store-api.url:http://localhost:8069/api}") String baseUrl,
                            @Value("${store-api.token:}") String token,
                            @Value("${store-api.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = builder
                .baseUrl(baseUrl)
                .defaultHeaders(h -> {
                    h.setContentType(MediaType.APPLICATION_JSON);
                    h.setAccept(List.of(MediaType.APPLICATION_JSON));
                    if (token != null && !token.isBlank()) {
                        h.setBearerAuth(token);
                    }
                })
                .build();
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public boolean isApplicable(String serviceType) {
        return Constants.STORE.NAME_SERVICE.equalsIgnoreCase(serviceType);
    }

    @Override
    public String callApi(HttpMethod method, String endpoint, Object requestBody, Object... uriVariables) {
        WebClient.RequestBodySpec requestSpec = webClient.method(method).uri(endpoint, uriVariables);

        WebClient.RequestHeadersSpec<?> spec = (method == HttpMethod.GET || requestBody == null)
                ? requestSpec
                : requestSpec.bodyValue(requestBody);

        String body = spec.retrieve()
                .onStatus(HttpStatusCode::isError, res -> res.createException()
                        .doOnNext(ex -> log.error("Store API [{} {}] returned {}: {}",
                                method, endpoint, ex.getStatusCode(), ex.getResponseBodyAsString())))
                .bodyToMono(String.class)
                .block(timeout);
        log.debug("Store API [{} {}] success", method, endpoint);
        return body;
    }

    @Override
    public Optional<String> fetchIfExists(String endpoint, Object... uriVariables) {
        return Optional.ofNullable(webClient.get()
                .uri(endpoint, uriVariables)
                .exchangeToMono(res -> {
                    if (res.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        return res.releaseBody().then(Mono.<String>empty());
                    }
                    if (res.statusCode().isError()) {
                        return res.createException().flatMap(Mono::<String>error);
                    }
                    return res.bodyToMono(String.class);
                })
                .block(timeout));
    }
}
