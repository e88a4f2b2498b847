package com.darinrandal.chromedata.api;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.darinrandal.chromedata.util.EndpointResolver.ServiceEndpoints;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Posts SOAP envelopes to a ChromeData service endpoint and turns the replies
 * into {@link SoapResponse} objects. Faults and non-successful status codes are
 * reported as {@link ChromeDataException}s.
 */
@NonNullByDefault
public class SoapClient {

    public static final String OPERATION_DESCRIBE_VEHICLE = "describeVehicle";

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(SoapClient.class));

    private static final String REDACTED_VALUE = "***REDACTED***";
    private static final Pattern SECRET_ATTRIBUTE_PATTERN = Pattern.compile("(\\bsecret\\s*=\\s*\")([^\"]*)(\")",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SECRET_ELEMENT_PATTERN = Pattern
            .compile("(<(?:\\w+:)?secret>)([^<]*)(</(?:\\w+:)?secret>)", Pattern.CASE_INSENSITIVE);

    private final ServiceEndpoints ep;
    private final HttpClient httpClient;
    private final SoapEnvelopeWriter envelopeWriter;
    private final URI endpoint;

    public SoapClient(ServiceEndpoints ep, HttpClient httpClient) {
        this.ep = Objects.requireNonNull(ep, "ep");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.envelopeWriter = new SoapEnvelopeWriter(Objects.requireNonNull(ep.namespace, "namespace"),
                Objects.requireNonNull(ep.requestElement, "requestElement"));
        this.endpoint = URI.create(ep.postUrl());
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public SoapResponse describeVehicle(JsonObject parameters) throws ChromeDataException {
        return call(OPERATION_DESCRIBE_VEHICLE, parameters);
    }

    public CompletableFuture<SoapResponse> describeVehicleAsync(JsonObject parameters) {
        return callAsync(OPERATION_DESCRIBE_VEHICLE, parameters);
    }

    /**
     * Invokes {@code operation} and blocks until the reply arrives. I/O failures
     * are retried up to the configured number of times.
     */
    public SoapResponse call(String operation, JsonObject parameters) throws ChromeDataException {
        String envelope = envelopeWriter.write(parameters);
        HttpRequest request = buildRequest(envelope);
        IOException lastFailure = null;
        for (int attempt = 0; attempt <= ep.maxRetries; attempt++) {
            logRequest(operation, request, envelope);
            try {
                HttpResponse<String> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
                return toResponse(operation, resp);
            } catch (IOException e) {
                lastFailure = e;
                logger.debug("{} attempt {} against {} failed: {}", operation, attempt + 1, endpoint,
                        messageFor(e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ChromeDataException(operation + " request interrupted", e);
            }
        }
        IOException failure = Objects.requireNonNull(lastFailure);
        logger.warn("{} request to {} failed: {}", operation, endpoint, messageFor(failure));
        throw new ChromeDataException(operation + " request failed: " + messageFor(failure), failure);
    }

    /**
     * Invokes {@code operation} without blocking. The returned future fails with
     * a {@link ChromeDataException} under the same conditions as {@link #call}.
     */
    public CompletableFuture<SoapResponse> callAsync(String operation, JsonObject parameters) {
        String envelope;
        try {
            envelope = envelopeWriter.write(parameters);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        return sendAsync(operation, buildRequest(envelope), envelope, 0);
    }

    private CompletableFuture<SoapResponse> sendAsync(String operation, HttpRequest request, String envelope,
            int attempt) {
        logRequest(operation, request, envelope);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((resp, error) -> {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (cause instanceof IOException && attempt < ep.maxRetries) {
                            logger.debug("{} attempt {} against {} failed: {}", operation, attempt + 1, endpoint,
                                    cause.getMessage());
                            return sendAsync(operation, request, envelope, attempt + 1);
                        }
                        logger.warn("{} request to {} failed: {}", operation, endpoint, cause.getMessage());
                        return CompletableFuture.<SoapResponse> failedFuture(
                                new ChromeDataException(operation + " request failed: " + cause.getMessage(), cause));
                    }
                    try {
                        return CompletableFuture.completedFuture(toResponse(operation, resp));
                    } catch (ChromeDataException e) {
                        return CompletableFuture.<SoapResponse> failedFuture(e);
                    }
                }).thenCompose(Function.identity());
    }

    private HttpRequest buildRequest(String envelope) {
        return HttpRequest.newBuilder(endpoint).timeout(Duration.ofSeconds(ep.requestTimeoutSeconds))
                .header("Content-Type", "text/xml; charset=utf-8").header("SOAPAction", "\"" + ep.soapAction + "\"")
                .POST(HttpRequest.BodyPublishers.ofString(envelope, StandardCharsets.UTF_8)).build();
    }

    private SoapResponse toResponse(String operation, HttpResponse<String> resp) throws ChromeDataException {
        String body = resp.body() != null ? resp.body() : "";
        String bodyForLog = formatBodyForLog(body);
        logger.trace("Received {} response status={} body={}", operation, resp.statusCode(), bodyForLog);
        SoapResponse response = new SoapResponse(resp.statusCode(), body, bodyForLog);
        if (response.isFault()) {
            JsonElement faultElement = response.getBodyAsJson().get("Fault");
            JsonObject fault = faultElement != null && faultElement.isJsonObject() ? faultElement.getAsJsonObject()
                    : new JsonObject();
            String faultCode = text(fault, "faultcode");
            String faultString = text(fault, "faultstring");
            logger.warn("{} returned SOAP fault {}: {}", operation, faultCode, faultString);
            throw new SoapFaultException(faultCode, faultString, resp.statusCode());
        }
        if (!response.isSuccessful()) {
            logger.warn("{} request failed: {} {}", operation, resp.statusCode(), bodyForLog);
            throw new ChromeDataException(operation + " request failed: " + resp.statusCode(), resp.statusCode(),
                    null);
        }
        logger.debug("{} completed with status {}", operation, resp.statusCode());
        return response;
    }

    private void logRequest(String operation, HttpRequest request, String envelope) {
        if (!logger.isTraceEnabled()) {
            return;
        }
        logger.trace("Sending {} {} {} body={}", operation, request.method(), request.uri(),
                formatBodyForLog(envelope));
    }

    static String formatBodyForLog(@Nullable String body) {
        if (body == null) {
            return "<none>";
        }
        if (body.isEmpty()) {
            return "<empty>";
        }
        String sanitized = SECRET_ATTRIBUTE_PATTERN.matcher(body).replaceAll("$1" + REDACTED_VALUE + "$3");
        return SECRET_ELEMENT_PATTERN.matcher(sanitized).replaceAll("$1" + REDACTED_VALUE + "$3");
    }

    private static @Nullable String text(JsonObject object, String key) {
        JsonElement value = object.get(key);
        if (value == null || value.isJsonNull()) {
            return null;
        }
        return value.isJsonPrimitive() ? value.getAsString() : value.toString();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String messageFor(Exception exception) {
        String message = exception.getMessage();
        return (message == null || message.isBlank()) ? exception.getClass().getSimpleName() : message;
    }
}
