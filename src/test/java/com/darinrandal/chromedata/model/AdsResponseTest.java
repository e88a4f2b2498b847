package com.darinrandal.chromedata.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.junit.jupiter.api.Test;

import com.darinrandal.chromedata.Fixtures;
import com.darinrandal.chromedata.api.SoapResponse;
import com.google.gson.JsonObject;

/**
 * Tests for {@link AdsResponse}.
 */
public @NonNullByDefault @SuppressWarnings("null") class AdsResponseTest {

    private static SoapResponse describeResponse() {
        String body = Fixtures.read(Fixtures.DESCRIBE_VEHICLE_RESPONSE);
        return new SoapResponse(200, body, body);
    }

    @Test
    void exposesTopLevelDescriptionAttributes() {
        AdsResponse response = new AdsResponse(describeResponse());

        assertEquals("Successful", response.getResponseCode());
        assertEquals("Successful", response.getResponseDescription());
        assertTrue(response.isSuccessful());
        assertEquals(Integer.valueOf(2007), response.getModelYear());
        assertEquals("Honda", response.getBestMakeName());
        assertEquals("Civic Cpe", response.getBestModelName());
        assertEquals("2dr Man EX", response.getBestStyleName());
        assertEquals("EX", response.getBestTrimName());
        assertEquals("US", response.getCountry());
        assertEquals("en", response.getLanguage());
    }

    @Test
    void repeatedAndSingleElementsAreBothLists() {
        AdsResponse response = new AdsResponse(describeResponse());

        List<JsonObject> styles = response.getStyles();
        assertEquals(2, styles.size());
        assertEquals("288637", styles.get(0).get("id").getAsString());
        assertEquals("18460.0", styles.get(0).getAsJsonObject("basePrice").get("msrp").getAsString());
        assertEquals("2dr Auto EX", styles.get(1).get("name").getAsString());

        assertEquals(1, response.getEngines().size());
        assertEquals("Gas I4", response.getEngines().get(0).getAsJsonObject("engineType").get("value").getAsString());
        assertEquals(1, response.getExteriorColors().size());
        assertTrue(response.getInteriorColors().isEmpty());
        assertTrue(response.getFactoryOptions().isEmpty());
        assertTrue(response.getTechnicalSpecifications().isEmpty());
    }

    @Test
    void vinDescriptionKeepsTextAlongsideAttributes() {
        JsonObject vinDescription = new AdsResponse(describeResponse()).getVinDescription();

        assertNotNull(vinDescription);
        assertEquals("2HGFG12567H500000", vinDescription.get("vin").getAsString());
        assertEquals("Honda Canada", vinDescription.get("WorldManufacturerIdentifier").getAsString());
        JsonObject marketClass = vinDescription.getAsJsonObject("marketClass");
        assertEquals("1", marketClass.get("id").getAsString());
        assertEquals("Small Car", marketClass.get("value").getAsString());
    }

    @Test
    void parametersAreCopied() {
        JsonObject parameters = new JsonObject();
        parameters.addProperty("trimName", "EX");
        AdsResponse response = new AdsResponse(describeResponse(), parameters);

        parameters.addProperty("styleName", "changed later");
        response.getParameters().addProperty("wheelBase", 104.3);

        assertEquals(1, response.getParameters().size());
        assertEquals("EX", response.getParameters().get("trimName").getAsString());
    }

    @Test
    void rawResponseIsRetained() {
        SoapResponse raw = describeResponse();

        assertSame(raw, new AdsResponse(raw).getRaw());
    }

    @Test
    void bodyWithoutDescriptionYieldsEmptyAccessors() {
        AdsResponse response = new AdsResponse(new SoapResponse(200, "not xml", "not xml"));

        assertNull(response.getResponseCode());
        assertFalse(response.isSuccessful());
        assertNull(response.getModelYear());
        assertNull(response.getVinDescription());
        assertTrue(response.getStyles().isEmpty());
        assertNull(response.get("style"));
        assertEquals(0, response.getDescription().size());
    }
}
