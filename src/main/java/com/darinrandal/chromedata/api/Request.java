package com.darinrandal.chromedata.api;

import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;

/**
 * Base class of the ChromeData service requests.
 */
@NonNullByDefault
public abstract class Request {

    protected final Adapter adapter;

    protected Request(Adapter adapter) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
    }

    public Adapter getAdapter() {
        return adapter;
    }
}
