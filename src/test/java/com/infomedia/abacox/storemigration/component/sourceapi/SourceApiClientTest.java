package com.infomedia.abacox.storemigration.component.sourceapi;

import com.infomedia.abacox.storemigration.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.storemigration.component.ratelimit.FixedRateLimiter;
import com.infomedia.abacox.storemigration.component.ratelimit.RateLimitedCall;
import com.infomedia.abacox.storemigration.component.staging.EntityKind;
import com.infomedia.abacox.storemigration.dto.connection.ConnectionTestResult;
import com.infomedia.abacox.storemigration.exception.SourceApiException;
import com.infomedia.abacox.storemigration.support.ManualTimeSource;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceApiClientTest {

    private final ManualTimeSource time = new ManualTimeSource();
    private MockWebServer server;
    private SourceApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        EasyHttpClient httpClient = EasyHttpClient.builder()
                .baseUrl(server.url("/v1/").toString())
                .basicAuth("key", "secret")
                .build();
        client = new SourceApiClient(httpClient,
                new RateLimitedCall(new FixedRateLimiter(100, time), time, Duration.ofSeconds(60)));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void fetchesAPageWithPagingParameters() throws Exception {
        server.enqueue(json("""
                {"count": 2500, "next": "https://api.example.com/v1/customers/?page=4", "results": [{"id": 1}, {"id": 2}]}
                """));

        SourcePage page = client.fetchPage(EntityKind.CUSTOMER, 3, 1000);

        assertThat(page.getResults()).hasSize(2);
        assertThat(page.getNext()).endsWith("page=4");
        assertThat(page.getCount()).isEqualTo(2500L);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getRequestUrl().encodedPath()).isEqualTo("/v1/customers/");
        assertThat(request.getRequestUrl().queryParameter("page")).isEqualTo("3");
        assertThat(request.getRequestUrl().queryParameter("limit")).isEqualTo("1000");
        assertThat(request.getHeader("Authorization")).startsWith("Basic ");
    }

    @Test
    void lastPageHasNoNextLink() {
        server.enqueue(json("{\"next\": null, \"results\": []}"));

        SourcePage page = client.fetchPage(EntityKind.ORDER, 9, 1000);

        assertThat(page.isEmpty()).isTrue();
        assertThat(page.hasNext()).isFalse();
        assertThat(page.getCount()).isNull();
    }

    @Test
    void throttledRequestIsRetriedOnceAfterRetryAfter() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));
        server.enqueue(json("{\"results\": [{\"id\": 5}]}"));

        SourcePage page = client.fetchPage(EntityKind.CUSTOMER, 0, 10);

        assertThat(page.getResults()).hasSize(1);
        assertThat(server.getRequestCount()).isEqualTo(2);
        assertThat(time.getSleeps()).contains(Duration.ofSeconds(7));
    }

    @Test
    void serverErrorBecomesSourceApiException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        assertThatThrownBy(() -> client.fetchPage(EntityKind.CUSTOMER, 0, 10))
                .isInstanceOf(SourceApiException.class)
                .hasMessageContaining("500");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void singleRecordNotFoundIsEmpty() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(json("{\"id\": 12, \"email\": \"a@example.com\"}"));

        assertThat(client.fetchRecord(EntityKind.CUSTOMER, 11)).isEmpty();
        assertThat(client.fetchRecord(EntityKind.CUSTOMER, 12)).get()
                .satisfies(node -> assertThat(node.get("email").asText()).isEqualTo("a@example.com"));
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/customers/11/");
    }

    @Test
    void connectionTestReportsFailureWithoutThrowing() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("bad credentials"));

        ConnectionTestResult result = client.testConnection();

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).contains("401");
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
