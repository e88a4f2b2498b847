package com.darinrandal.chromedata.api;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.darinrandal.chromedata.api.RequestPool.FulfilledCallback;
import com.darinrandal.chromedata.api.RequestPool.RejectedCallback;
import com.darinrandal.chromedata.model.AdsResponse;
import com.darinrandal.chromedata.model.VehicleHints;
import com.darinrandal.chromedata.util.EndpointResolver.ServiceEndpoints;
import com.darinrandal.chromedata.util.VinValidator;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Client for the ChromeData Automotive Description Service (ADS). Decodes VINs
 * through the {@code describeVehicle} operation, either one at a time or pooled
 * with a bounded number of concurrent calls.
 *
 * <p>
 * The fluent {@code include*}/{@code exclude*} methods change the parameters
 * sent with every subsequent request of this instance.
 */
@NonNullByDefault
public class AutomotiveDescriptionService extends Request {

    /** Automotive Description Service endpoint. */
    public static final String ADS_ENDPOINT = "http://services.chromedata.com/Description/7b?wsdl";

    public static final String SWITCH_KEY = "switch";

    private final Logger logger = Objects.requireNonNull(LoggerFactory.getLogger(AutomotiveDescriptionService.class));

    private final SoapClient client;
    private final JsonObject parameters = new JsonObject();
    private final List<String> addedSwitches = new ArrayList<>();
    private volatile boolean vinValidation = true;

    public AutomotiveDescriptionService(Adapter adapter) {
        this(adapter, new SoapClient(adapter.getEndpoints(), adapter.getHttpClient()));
    }

    AutomotiveDescriptionService(Adapter adapter, SoapClient client) {
        super(adapter);
        this.client = Objects.requireNonNull(client, "client");
    }

    public AdsResponse byVin(String vin) throws ChromeDataException {
        return byVin(vin, new JsonObject());
    }

    public AdsResponse byVin(String vin, VehicleHints hints) throws ChromeDataException {
        return byVin(vin, hints.toParameters());
    }

    /**
     * Decodes a VIN and blocks until the service answers. The supplied
     * parameters override any parameter of the same name; see
     * {@link VehicleHints} for the ones that improve exact style matching.
     *
     * @throws InvalidVinException if VIN validation is enabled and the check digit is wrong
     * @throws SoapFaultException if the service answers with a fault
     * @throws ChromeDataException if the request fails for any other reason
     */
    public AdsResponse byVin(String vin, JsonObject overrides) throws ChromeDataException {
        checkVin(vin);
        SoapResponse response = client.describeVehicle(buildParameters(vin, overrides));
        return new AdsResponse(response, overrides);
    }

    public CompletableFuture<SoapResponse> byVinAsync(String vin) {
        return byVinAsync(vin, new JsonObject());
    }

    /**
     * Starts decoding a VIN without blocking. Intended for use with
     * {@link #pool}. An invalid VIN yields a future that has already failed
     * with {@link InvalidVinException}.
     */
    public CompletableFuture<SoapResponse> byVinAsync(String vin, JsonObject overrides) {
        try {
            checkVin(vin);
        } catch (InvalidVinException e) {
            return CompletableFuture.failedFuture(e);
        }
        return client.describeVehicleAsync(buildParameters(vin, overrides));
    }

    public void pool(Iterable<? extends Supplier<? extends CompletableFuture<SoapResponse>>> requests,
            FulfilledCallback<AdsResponse> fulfilled, RejectedCallback rejected) throws ChromeDataException {
        pool(requests, fulfilled, rejected, adapter.getEndpoints().concurrency);
    }

    /**
     * Runs the given requests with at most {@code concurrency} in flight and
     * waits until all of them have settled. Each request is started only when a
     * slot frees up, so {@code requests} may be produced lazily.
     * {@code fulfilled} receives an {@link AdsResponse}, the index of the request
     * and the aggregate future; completing the aggregate stops the pool.
     * Callbacks are invoked one at a time.
     *
     * @throws ChromeDataException if a callback throws
     */
    public void pool(Iterable<? extends Supplier<? extends CompletableFuture<SoapResponse>>> requests,
            FulfilledCallback<AdsResponse> fulfilled, RejectedCallback rejected, int concurrency)
            throws ChromeDataException {
        logger.debug("Pooling description requests with concurrency {}", concurrency);
        CompletableFuture<Void> aggregate = RequestPool.<SoapResponse> eachLimit(requests, concurrency,
                (response, index, agg) -> fulfilled.onFulfilled(new AdsResponse(response), index, agg), rejected);
        try {
            aggregate.get();
        } catch (CancellationException e) {
            logger.debug("Description request pool cancelled");
        } catch (ExecutionException e) {
            Throwable cause = SoapClient.unwrap(e);
            if (cause instanceof ChromeDataException) {
                throw (ChromeDataException) cause;
            }
            throw new ChromeDataException("Pooled description request failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            aggregate.cancel(false);
            throw new ChromeDataException("Interrupted while waiting for pooled requests", e);
        }
    }

    public void poolVins(Iterable<String> vins, FulfilledCallback<AdsResponse> fulfilled, RejectedCallback rejected)
            throws ChromeDataException {
        poolVins(vins, fulfilled, rejected, adapter.getEndpoints().concurrency);
    }

    /**
     * Pools {@link #byVinAsync(String)} over the given VINs. Callback indices
     * follow the iteration order of {@code vins}.
     */
    public void poolVins(Iterable<String> vins, FulfilledCallback<AdsResponse> fulfilled, RejectedCallback rejected,
            int concurrency) throws ChromeDataException {
        Objects.requireNonNull(vins, "vins");
        Iterable<Supplier<CompletableFuture<SoapResponse>>> requests = () -> new Iterator<>() {
            private final Iterator<String> it = vins.iterator();

            @Override
            public boolean hasNext() {
                return it.hasNext();
            }

            @Override
            public Supplier<CompletableFuture<SoapResponse>> next() {
                String vin = it.next();
                return () -> byVinAsync(vin);
            }
        };
        pool(requests, fulfilled, rejected, concurrency);
    }

    public SoapClient getClient() {
        return client;
    }

    /**
     * Verifies a VIN check digit without contacting the service.
     */
    public boolean isValidVin(String vin) {
        return VinValidator.isValid(vin);
    }

    /**
     * Enables or disables the local check digit verification done before each
     * request. Enabled by default.
     */
    public AutomotiveDescriptionService setVinValidation(boolean enabled) {
        this.vinValidation = enabled;
        return this;
    }

    /**
     * Add color matched photos in response.
     */
    public synchronized AutomotiveDescriptionService includeColorMatchedPhotos() {
        parameters.addProperty("includeMediaGallery", "ColorMatch");
        return this;
    }

    /**
     * Add available equipment in response.
     */
    public synchronized AutomotiveDescriptionService includeAvailableEquipment() {
        addedSwitches.add("ShowAvailableEquipment");
        return this;
    }

    /**
     * Include extended descriptions of Chrome options.
     */
    public synchronized AutomotiveDescriptionService includeExtendedDescriptions() {
        addedSwitches.add("ShowExtendedDescriptions");
        return this;
    }

    /**
     * Exclude fleet vehicles from the request.
     */
    public synchronized AutomotiveDescriptionService excludeFleet() {
        parameters.addProperty("vehicleProcessMode", "ExcludeFleetOnly");
        parameters.addProperty("optionsProcessMode", "ExcludeFleetOnly");
        return this;
    }

    /**
     * Merges the instance parameters, account data with the fixed switches, and
     * the caller overrides, in that order; a later source replaces a top-level
     * key of an earlier one. Switches added through the fluent methods are
     * appended to the fixed switches.
     */
    public synchronized JsonObject buildParameters(String vin, JsonObject overrides) {
        Objects.requireNonNull(vin, "vin");
        Objects.requireNonNull(overrides, "overrides");
        ServiceEndpoints ep = adapter.getEndpoints();
        AccountAuth auth = adapter.getAuth();

        JsonObject merged = parameters.deepCopy();

        JsonObject accountInfo = new JsonObject();
        accountInfo.addProperty("number", auth.getAccountNumber());
        accountInfo.addProperty("secret", auth.getAccountSecret());
        accountInfo.addProperty("country", ep.country);
        accountInfo.addProperty("language", ep.language);
        merged.add("accountInfo", accountInfo);
        merged.addProperty("vin", vin);

        Set<String> switches = new LinkedHashSet<>(ep.switches);
        switches.addAll(addedSwitches);
        JsonArray switchArray = new JsonArray();
        switches.forEach(switchArray::add);
        merged.add(SWITCH_KEY, switchArray);

        for (Map.Entry<String, JsonElement> entry : overrides.entrySet()) {
            merged.add(entry.getKey(), Objects.requireNonNull(entry.getValue()).deepCopy());
        }
        return merged;
    }

    private void checkVin(String vin) throws InvalidVinException {
        if (vinValidation && !VinValidator.isValid(vin)) {
            logger.debug("Rejecting VIN {} before request: check digit mismatch or malformed", vin);
            throw new InvalidVinException(vin);
        }
    }
}
