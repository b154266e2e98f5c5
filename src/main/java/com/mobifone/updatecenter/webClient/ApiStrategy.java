package com.mobifone.updatecenter.webClient;

import org.springframework.http.HttpMethod;

import java.util.Optional;

public interface ApiStrategy {
    boolean isApplicable(String serviceType);

    /** Calls the endpoint and returns the raw body; non-2xx responses surface as exceptions. */
    String callApi(HttpMethod method, String endpoint, Object requestBody, Object... uriVariables);

    /** GET that maps 404 to empty instead of an error. */
    Optional<String> fetchIfExists(String endpoint, Object... uriVariables);
}
