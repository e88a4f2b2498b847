package com.darinrandal.chromedata;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads test resources as strings.
 */
public final class Fixtures {

    public static final String DESCRIBE_VEHICLE_RESPONSE = "ads/describe-vehicle-response.xml";
    public static final String SOAP_FAULT = "ads/soap-fault.xml";

    private Fixtures() {
    }

    public static String read(String resource) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException(resource + " not found");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
