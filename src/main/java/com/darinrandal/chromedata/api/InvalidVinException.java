package com.darinrandal.chromedata.api;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Thrown when a VIN fails the local check digit verification, before any
 * network call is made.
 */
@NonNullByDefault
public class InvalidVinException extends ChromeDataException {

    private static final long serialVersionUID = 1L;

    private final String vin;

    public InvalidVinException(String vin) {
        super("Invalid VIN: " + vin);
        this.vin = vin;
    }

    public String getVin() {
        return vin;
    }
}
