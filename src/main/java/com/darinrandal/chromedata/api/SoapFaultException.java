package com.darinrandal.chromedata.api;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * A SOAP fault returned by the remote service.
 */
@NonNullByDefault
public class SoapFaultException extends ChromeDataException {

    private static final long serialVersionUID = 1L;

    private final @Nullable String faultCode;
    private final @Nullable String faultString;

    public SoapFaultException(@Nullable String faultCode, @Nullable String faultString, int statusCode) {
        super("SOAP fault " + faultCode + ": " + faultString, statusCode, null);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public @Nullable String getFaultCode() {
        return faultCode;
    }

    public @Nullable String getFaultString() {
        return faultString;
    }
}
