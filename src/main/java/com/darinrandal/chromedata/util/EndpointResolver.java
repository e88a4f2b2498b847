package com.darinrandal.chromedata.util;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Loads the service endpoint definitions shipped with the library, optionally
 * replaced by an override file on disk.
 */
public class EndpointResolver {

    public static final String DEFAULTS_RESOURCE = "chromedata/endpoints-defaults.json";
    public static final String OVERRIDE_PROPERTY = "chromedata.endpointsOverride";

    public static class ServiceEndpoints {
        public String url;
        public String namespace;
        public String requestElement;
        public String soapAction = "";
        public String country = "US";
        public String language = "en";
        public List<String> switches = new ArrayList<>();
        public int concurrency = 15;
        public int connectTimeoutSeconds = 10;
        public int requestTimeoutSeconds = 60;
        public int maxRetries = 1;

        /**
         * Address the SOAP envelope is posted to, i.e. the configured URL
         * without a trailing {@code ?wsdl} query.
         */
        public String postUrl() {
            int query = url.indexOf('?');
            return query < 0 ? url : url.substring(0, query);
        }
    }

    public static JsonNode loadTree(ClassLoader cl, String overridePath) throws Exception {
        ObjectMapper om = new ObjectMapper();
        if (overridePath != null && !overridePath.isBlank()) {
            Path p = Path.of(overridePath);
            if (Files.exists(p)) {
                try (InputStream in = Files.newInputStream(p)) {
                    return om.readTree(in);
                }
            }
        }
        try (InputStream in = cl.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) throw new IllegalStateException(DEFAULTS_RESOURCE + " not found in resources");
            return om.readTree(in);
        }
    }

    /**
     * Resolves the description service defaults, honouring the
     * {@value #OVERRIDE_PROPERTY} system property. {@code fallbackUrl} is used
     * when the configuration names no url.
     */
    public static ServiceEndpoints defaults(String fallbackUrl) throws Exception {
        JsonNode root = loadTree(EndpointResolver.class.getClassLoader(), System.getProperty(OVERRIDE_PROPERTY));
        return resolve(root, "description", "7b", fallbackUrl);
    }

    public static ServiceEndpoints resolve(JsonNode root, String service, String version) {
        return resolve(root, service, version, null);
    }

    public static ServiceEndpoints resolve(JsonNode root, String service, String version, String fallbackUrl) {
        JsonNode n = root.path(service).path(version);
        if (n.isMissingNode()) throw new IllegalArgumentException("No endpoints for service=" + service + " version=" + version);
        ServiceEndpoints e = new ServiceEndpoints();
        e.url = text(n, "url");
        if (e.url == null || e.url.isBlank()) e.url = fallbackUrl;
        if (e.url == null || e.url.isBlank()) throw new IllegalArgumentException("Missing url for service=" + service + " version=" + version);
        e.namespace = text(n, "namespace");
        e.requestElement = text(n, "requestElement");
        String soapAction = text(n, "soapAction");
        if (soapAction != null) e.soapAction = soapAction;
        String country = text(n, "accountInfo", "country");
        if (country != null) e.country = country;
        String language = text(n, "accountInfo", "language");
        if (language != null) e.language = language;
        for (JsonNode s : n.path("switches")) {
            e.switches.add(s.asText());
        }
        e.concurrency = n.path("concurrency").asInt(e.concurrency);
        e.connectTimeoutSeconds = n.path("connectTimeoutSeconds").asInt(e.connectTimeoutSeconds);
        e.requestTimeoutSeconds = n.path("requestTimeoutSeconds").asInt(e.requestTimeoutSeconds);
        e.maxRetries = Math.max(0, n.path("maxRetries").asInt(e.maxRetries));
        return e;
    }

    private static String text(JsonNode n, String... path) {
        JsonNode cur = n;
        for (String p : path) {
            cur = cur.path(p);
        }
        return cur.isMissingNode() ? null : cur.asText(null);
    }
}
