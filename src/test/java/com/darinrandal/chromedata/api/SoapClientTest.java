package com.darinrandal.chromedata.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.darinrandal.chromedata.Fixtures;
import com.darinrandal.chromedata.util.EndpointResolver.ServiceEndpoints;
import com.google.gson.JsonObject;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * Tests for {@link SoapClient}.
 */
public @NonNullByDefault @SuppressWarnings("null") class SoapClientTest {

    private HttpServer server;
    private ExecutorService executor;
    private boolean serverStopped;
    private final AtomicReference<@Nullable String> requestBody = new AtomicReference<>();
    private final AtomicReference<@Nullable String> soapAction = new AtomicReference<>();
    private final AtomicReference<@Nullable String> contentType = new AtomicReference<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger responseStatus = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("");

    @BeforeEach
    public void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        responseBody.set(Fixtures.read(Fixtures.DESCRIBE_VEHICLE_RESPONSE));
        server.createContext("/Description/7b", this::handle);
        server.start();
    }

    @AfterEach
    public void stopServer() throws InterruptedException {
        if (!serverStopped) {
            server.stop(0);
        }
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private void handle(HttpExchange exchange) throws IOException {
        calls.incrementAndGet();
        requestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        soapAction.set(exchange.getRequestHeaders().getFirst("SOAPAction"));
        contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
        byte[] payload = responseBody.get().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/xml; charset=utf-8");
        exchange.sendResponseHeaders(responseStatus.get(), payload.length);
        exchange.getResponseBody().write(payload);
        exchange.getResponseBody().close();
    }

    private ServiceEndpoints endpoints(int port) {
        ServiceEndpoints ep = new ServiceEndpoints();
        ep.url = "http://localhost:" + port + "/Description/7b?wsdl";
        ep.namespace = "urn:description7b.services.chrome.com";
        ep.requestElement = "VehicleDescriptionRequest";
        ep.requestTimeoutSeconds = 5;
        return ep;
    }

    private SoapClient client() {
        return new SoapClient(endpoints(server.getAddress().getPort()), HttpClient.newHttpClient());
    }

    private static JsonObject parameters() {
        JsonObject p = new JsonObject();
        JsonObject accountInfo = new JsonObject();
        accountInfo.addProperty("number", "123456");
        accountInfo.addProperty("secret", "top-secret");
        p.add("accountInfo", accountInfo);
        p.addProperty("vin", "2HGFG12567H500000");
        return p;
    }

    @Test
    void describeVehiclePostsEnvelopeToEndpointWithoutWsdlQuery() throws Exception {
        SoapClient client = client();

        SoapResponse response = client.describeVehicle(parameters());

        assertEquals(200, response.getStatusCode());
        assertTrue(response.isSuccessful());
        assertEquals("/Description/7b", client.getEndpoint().getPath());
        assertEquals("\"\"", soapAction.get());
        assertTrue(contentType.get().startsWith("text/xml"));
        String body = requestBody.get();
        assertTrue(body.contains("VehicleDescriptionRequest"));
        assertTrue(body.contains("secret=\"top-secret\""));
        assertTrue(body.contains(">2HGFG12567H500000<"));
        assertEquals("Successful", response.getPayload("VehicleDescription").getAsJsonObject("responseStatus")
                .get("responseCode").getAsString());
    }

    @Test
    void soapFaultIsRaisedWithFaultDetails() {
        responseStatus.set(500);
        responseBody.set(Fixtures.read(Fixtures.SOAP_FAULT));

        SoapFaultException fault = assertThrows(SoapFaultException.class,
                () -> client().describeVehicle(parameters()));

        assertEquals("soap:Client", fault.getFaultCode());
        assertEquals("Invalid account number or secret", fault.getFaultString());
        assertEquals(500, fault.getStatusCode());
    }

    @Test
    void nonSuccessfulStatusWithoutFaultIsRaised() {
        responseStatus.set(503);
        responseBody.set("Service Unavailable");

        ChromeDataException error = assertThrows(ChromeDataException.class,
                () -> client().describeVehicle(parameters()));

        assertFalse(error instanceof SoapFaultException);
        assertEquals(503, error.getStatusCode());
        assertEquals(1, calls.get());
    }

    @Test
    void asyncCallCompletesWithParsedResponse() throws Exception {
        SoapResponse response = client().describeVehicleAsync(parameters()).get(5, TimeUnit.SECONDS);

        assertEquals("Honda", response.getPayload("VehicleDescription").get("bestMakeName").getAsString());
    }

    @Test
    void asyncFaultFailsTheFuture() {
        responseStatus.set(500);
        responseBody.set(Fixtures.read(Fixtures.SOAP_FAULT));

        CompletableFuture<SoapResponse> future = client().describeVehicleAsync(parameters());

        ExecutionException error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(SoapFaultException.class, error.getCause());
    }

    @Test
    void unreachableEndpointIsRetriedThenReported() throws Exception {
        int port = server.getAddress().getPort();
        server.stop(0);
        serverStopped = true;
        ServiceEndpoints ep = endpoints(port);
        ep.maxRetries = 1;
        SoapClient client = new SoapClient(ep, HttpClient.newHttpClient());

        ChromeDataException error = assertThrows(ChromeDataException.class, () -> client.describeVehicle(parameters()));
        assertEquals(-1, error.getStatusCode());
        assertInstanceOf(IOException.class, error.getCause());

        ExecutionException asyncError = assertThrows(ExecutionException.class,
                () -> client.describeVehicleAsync(parameters()).get(5, TimeUnit.SECONDS));
        assertInstanceOf(ChromeDataException.class, asyncError.getCause());
    }

    @Test
    void logBodiesHaveSecretsRedacted() {
        String envelope = "<urn:accountInfo number=\"1\" secret=\"abc\"/><secret>xyz</secret>";

        String sanitized = SoapClient.formatBodyForLog(envelope);

        assertFalse(sanitized.contains("abc"));
        assertFalse(sanitized.contains("xyz"));
        assertTrue(sanitized.contains("number=\"1\""));
        assertEquals("<none>", SoapClient.formatBodyForLog(null));
        assertEquals("<empty>", SoapClient.formatBodyForLog(""));
    }
}
