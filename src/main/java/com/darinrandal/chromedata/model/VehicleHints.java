package com.darinrandal.chromedata.model;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

import com.google.gson.JsonObject;

/**
 * Optional vehicle details that help the description service narrow a VIN
 * down to an exact style. Unset values are left out of the request.
 */
@NonNullByDefault
public class VehicleHints {
    private @Nullable String trimName;
    private @Nullable String manufacturerModelCode;
    private @Nullable Double wheelBase;
    private @Nullable String oemOptionCode;
    private @Nullable String exteriorColorName;
    private @Nullable String interiorColorName;
    private @Nullable String styleName;
    private @Nullable Integer reducingStyleId;
    private @Nullable String reducingAcode;

    public VehicleHints trimName(String trimName) {
        this.trimName = trimName;
        return this;
    }

    public VehicleHints manufacturerModelCode(String manufacturerModelCode) {
        this.manufacturerModelCode = manufacturerModelCode;
        return this;
    }

    public VehicleHints wheelBase(double wheelBase) {
        this.wheelBase = wheelBase;
        return this;
    }

    public VehicleHints oemOptionCode(String oemOptionCode) {
        this.oemOptionCode = oemOptionCode;
        return this;
    }

    public VehicleHints exteriorColorName(String exteriorColorName) {
        this.exteriorColorName = exteriorColorName;
        return this;
    }

    public VehicleHints interiorColorName(String interiorColorName) {
        this.interiorColorName = interiorColorName;
        return this;
    }

    public VehicleHints styleName(String styleName) {
        this.styleName = styleName;
        return this;
    }

    public VehicleHints reducingStyleId(int reducingStyleId) {
        this.reducingStyleId = reducingStyleId;
        return this;
    }

    public VehicleHints reducingAcode(String reducingAcode) {
        this.reducingAcode = reducingAcode;
        return this;
    }

    /**
     * Renders the hints as request parameters, using the element names of the
     * description service.
     */
    public JsonObject toParameters() {
        JsonObject p = new JsonObject();
        addIfSet(p, "trimName", trimName);
        addIfSet(p, "manufacturerModelCode", manufacturerModelCode);
        if (wheelBase != null) {
            p.addProperty("wheelBase", wheelBase);
        }
        addIfSet(p, "OEMOptionCode", oemOptionCode);
        addIfSet(p, "exteriorColorName", exteriorColorName);
        addIfSet(p, "interiorColorName", interiorColorName);
        addIfSet(p, "styleName", styleName);
        if (reducingStyleId != null) {
            p.addProperty("reducingStyleId", reducingStyleId);
        }
        addIfSet(p, "reducingAcode", reducingAcode);
        return p;
    }

    private static void addIfSet(JsonObject p, String name, @Nullable String value) {
        if (value != null && !value.isBlank()) {
            p.addProperty(name, value);
        }
    }
}
