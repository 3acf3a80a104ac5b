package com.attorneyroster.scrape.http;

import com.attorneyroster.config.RosterProperties;
import com.attorneyroster.scrape.model.FetchMethod;
import com.attorneyroster.scrape.model.HttpFetchResult;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private PoliteHttpClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();

        RosterProperties properties = new RosterProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMinMs(0);
        properties.setPerHostDelayMaxMs(0);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxAttempts(3);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        properties.setRateLimitCooldownMs(0);

        executor = Executors.newFixedThreadPool(1);
        client = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void exhaustsConfiguredAttemptsOnServerErrors() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        HttpFetchResult result = client.get(server.url("/search").toString());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.statusCode()).isEqualTo(500);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void recoversWhenALaterAttemptSucceeds() {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        HttpFetchResult result = client.get(server.url("/search").toString());

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("ok");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void clientErrorsAreRetriedToo() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(404));

        HttpFetchResult result = client.get(server.url("/missing").toString());

        assertThat(result.failureSummary()).isEqualTo("http_status_404");
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void invalidUrlFailsWithoutRequests() {
        HttpFetchResult result = client.get("   ");

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void postSendsFormEncodedParameters() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html></html>"));
        Map<String, String> form = new LinkedHashMap<>();
        form.put("City", "San Antonio");
        form.put("State", "TX");
        form.put("LastName", "");

        HttpFetchResult result = client.fetch(server.url("/search").toString(), FetchMethod.POST, form);

        assertThat(result.isSuccessful()).isTrue();
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getHeader("Content-Type")).startsWith("application/x-www-form-urlencoded");
        assertThat(request.getHeader("User-Agent")).startsWith("attorney-roster/0.1");
        assertThat(request.getBody().readUtf8()).isEqualTo("City=San+Antonio&State=TX&LastName=");
    }

    @Test
    void getAppendsParametersToTheQuery() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html></html>"));

        client.fetch(server.url("/search?page=2").toString(), FetchMethod.GET, Map.of("LastName", "A"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/search?page=2&LastName=A");
    }
}
