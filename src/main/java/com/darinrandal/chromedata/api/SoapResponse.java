package com.darinrandal.chromedata.api;

import java.io.IOException;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Represents a SOAP response from a ChromeData service.
 */
@NonNullByDefault
public class SoapResponse {
    private static final Logger logger = LoggerFactory.getLogger(SoapResponse.class);

    private final int statusCode;
    private final String body;
    private final String bodyForLog;
    private @Nullable JsonObject parsedBody;

    public SoapResponse(int statusCode, String body, String bodyForLog) {
        this.statusCode = statusCode;
        this.body = body;
        this.bodyForLog = bodyForLog;
    }

    /**
     * Returns the children of the SOAP body as JSON. A body that cannot be parsed
     * yields an empty object.
     */
    public synchronized JsonObject getBodyAsJson() {
        JsonObject parsed = parsedBody;
        if (parsed == null) {
            parsed = new JsonObject();
            if (!body.isEmpty()) {
                try {
                    parsed = SoapEnvelopeReader.readBody(body);
                } catch (IOException e) {
                    logger.debug("Failed to parse SOAP body: {}", e.getMessage());
                }
            }
            parsedBody = parsed;
        }
        return parsed;
    }

    /**
     * Returns the payload element named {@code name} from the SOAP body, or
     * {@code null} if the body does not carry it as an element.
     */
    public @Nullable JsonObject getPayload(String name) {
        JsonElement payload = getBodyAsJson().get(name);
        return payload != null && payload.isJsonObject() ? payload.getAsJsonObject() : null;
    }

    public boolean isFault() {
        return getBodyAsJson().has("Fault");
    }

    public String getBody() {
        return body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBodyForLog() {
        return bodyForLog;
    }

    public boolean isSuccessful() {
        return statusCode / 100 == 2;
    }

    public boolean isClientError() {
        return statusCode / 100 == 4;
    }
}
