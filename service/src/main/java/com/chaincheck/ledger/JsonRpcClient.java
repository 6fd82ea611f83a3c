package com.chaincheck.ledger;

import com.chaincheck.error.LedgerUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC 2.0 client over {@link WebClient} with a bounded timeout per call.
 */
@Slf4j
public class JsonRpcClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    /**
     * Calls a JSON-RPC method.
     *
     * @param method Method name
     * @param params Positional parameters
     * @return The {@code result} member; {@link NullNode} when the result is null
     * @throws LedgerUnavailableException on transport failure, timeout or JSON-RPC error
     */
    public JsonNode call(String method, Object... params) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", method);
        request.put("params", Arrays.asList(params));

        log.debug("JSON-RPC request: method={}, params={}", method, request.get("params"));

        JsonNode response;
        try {
            response = webClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientException e) {
            throw new LedgerUnavailableException("JSON-RPC call " + method + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new LedgerUnavailableException("JSON-RPC call " + method + " timed out after " + timeout, e);
            }
            throw e;
        }

        if (response == null) {
            throw new LedgerUnavailableException("JSON-RPC call " + method + " returned an empty response");
        }
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            throw new LedgerUnavailableException("JSON-RPC call " + method + " returned error: "
                    + error.path("message").asText(error.toString()));
        }
        JsonNode result = response.get("result");
        return result == null ? NullNode.getInstance() : result;
    }
}
