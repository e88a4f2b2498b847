package com.darinrandal.chromedata.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

import com.darinrandal.chromedata.api.SoapResponse;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Typed access to an Automotive Description Service reply. The getters read
 * from the {@code VehicleDescription} element; repeated elements are always
 * returned as lists, so a single style and several styles look the same to the
 * caller.
 */
@NonNullByDefault
public class AdsResponse {

    public static final String RESPONSE_ELEMENT = "VehicleDescription";
    public static final String STATUS_SUCCESSFUL = "Successful";
    public static final String STATUS_CONDITIONALLY_SUCCESSFUL = "ConditionallySuccessful";

    private final SoapResponse response;
    private final JsonObject description;
    private final JsonObject parameters;

    public AdsResponse(SoapResponse response) {
        this(response, new JsonObject());
    }

    public AdsResponse(SoapResponse response, JsonObject parameters) {
        this.response = Objects.requireNonNull(response, "response");
        this.parameters = Objects.requireNonNull(parameters, "parameters").deepCopy();
        this.description = locateDescription(response);
    }

    private static JsonObject locateDescription(SoapResponse response) {
        JsonObject payload = response.getPayload(RESPONSE_ELEMENT);
        if (payload != null) {
            return payload;
        }
        for (Map.Entry<String, JsonElement> entry : response.getBodyAsJson().entrySet()) {
            JsonElement value = entry.getValue();
            if (value != null && value.isJsonObject()) {
                return value.getAsJsonObject();
            }
        }
        return new JsonObject();
    }

    public @Nullable String getResponseCode() {
        return attribute(object("responseStatus"), "responseCode");
    }

    public @Nullable String getResponseDescription() {
        return attribute(object("responseStatus"), "description");
    }

    /**
     * True when the service reports a successful or conditionally successful
     * decode.
     */
    public boolean isSuccessful() {
        String code = getResponseCode();
        return STATUS_SUCCESSFUL.equals(code) || STATUS_CONDITIONALLY_SUCCESSFUL.equals(code);
    }

    public @Nullable Integer getModelYear() {
        String year = getString("modelYear");
        if (year == null || year.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(year.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public @Nullable String getBestMakeName() {
        return getString("bestMakeName");
    }

    public @Nullable String getBestModelName() {
        return getString("bestModelName");
    }

    public @Nullable String getBestStyleName() {
        return getString("bestStyleName");
    }

    public @Nullable String getBestTrimName() {
        return getString("bestTrimName");
    }

    public @Nullable String getCountry() {
        return getString("country");
    }

    public @Nullable String getLanguage() {
        return getString("language");
    }

    public @Nullable JsonObject getVinDescription() {
        return object("vinDescription");
    }

    public List<JsonObject> getStyles() {
        return objects("style");
    }

    public List<JsonObject> getEngines() {
        return objects("engine");
    }

    public List<JsonObject> getStandardEquipment() {
        return objects("standard");
    }

    public List<JsonObject> getGenericEquipment() {
        return objects("genericEquipment");
    }

    public List<JsonObject> getConsumerInformation() {
        return objects("consumerInformation");
    }

    public List<JsonObject> getTechnicalSpecifications() {
        return objects("technicalSpecification");
    }

    public List<JsonObject> getExteriorColors() {
        return objects("exteriorColor");
    }

    public List<JsonObject> getInteriorColors() {
        return objects("interiorColor");
    }

    public List<JsonObject> getFactoryOptions() {
        return objects("factoryOption");
    }

    public List<JsonObject> getMediaGallery() {
        return objects("mediaGallery");
    }

    /**
     * Returns the raw element or attribute named {@code name}, or {@code null}.
     */
    public @Nullable JsonElement get(String name) {
        return description.get(name);
    }

    public @Nullable String getString(String name) {
        JsonElement value = description.get(name);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    /**
     * Returns a copy of the caller supplied parameters the request was made with.
     */
    public JsonObject getParameters() {
        return parameters.deepCopy();
    }

    public JsonObject getDescription() {
        return description.deepCopy();
    }

    public SoapResponse getRaw() {
        return response;
    }

    private @Nullable JsonObject object(String name) {
        JsonElement value = description.get(name);
        return value != null && value.isJsonObject() ? value.getAsJsonObject() : null;
    }

    private List<JsonObject> objects(String name) {
        JsonElement value = description.get(name);
        List<JsonObject> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value.isJsonArray()) {
            for (JsonElement item : value.getAsJsonArray()) {
                if (item.isJsonObject()) {
                    result.add(item.getAsJsonObject());
                }
            }
        } else if (value.isJsonObject()) {
            result.add(value.getAsJsonObject());
        }
        return result;
    }

    private static @Nullable String attribute(@Nullable JsonObject object, String name) {
        if (object == null) {
            return null;
        }
        JsonElement value = object.get(name);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }
}
