package com.darinrandal.chromedata.api;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

import com.darinrandal.chromedata.util.EndpointResolver;
import com.darinrandal.chromedata.util.EndpointResolver.ServiceEndpoints;

/**
 * Binds the caller's account credentials to the resolved service endpoints and
 * the HTTP client shared by all requests created from it.
 */
@NonNullByDefault
public class Adapter {

    private final AccountAuth auth;
    private final ServiceEndpoints endpoints;
    private final HttpClient httpClient;

    public Adapter(AccountAuth auth, ServiceEndpoints endpoints) {
        this(auth, endpoints, Objects.requireNonNull(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(endpoints.connectTimeoutSeconds)).build()));
    }

    public Adapter(AccountAuth auth, ServiceEndpoints endpoints, HttpClient httpClient) {
        this.auth = Objects.requireNonNull(auth, "auth");
        this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    /**
     * Creates an adapter using the bundled endpoint defaults, or the file named by
     * the {@value EndpointResolver#OVERRIDE_PROPERTY} system property. A
     * configuration without a url targets {@link AutomotiveDescriptionService#ADS_ENDPOINT}.
     */
    public static Adapter withDefaults(AccountAuth auth) throws ChromeDataException {
        try {
            return new Adapter(auth, EndpointResolver.defaults(AutomotiveDescriptionService.ADS_ENDPOINT));
        } catch (Exception e) {
            throw new ChromeDataException("Failed to load endpoint configuration: " + e.getMessage(), e);
        }
    }

    public AccountAuth getAuth() {
        return auth;
    }

    public ServiceEndpoints getEndpoints() {
        return endpoints;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }
}
