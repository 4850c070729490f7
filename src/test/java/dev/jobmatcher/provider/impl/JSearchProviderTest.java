package dev.jobmatcher.provider.impl;

import dev.jobmatcher.config.ProvidersConfig;
import dev.jobmatcher.exception.ProviderException;
import dev.jobmatcher.metrics.SearchMetrics;
import dev.jobmatcher.model.Listing;
import dev.jobmatcher.model.SearchFilters;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class JSearchProviderTest {

    private MockWebServer mockWebServer;
    private JSearchProvider provider;

    @Mock
    private SearchMetrics metrics;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();

        ProvidersConfig config = new ProvidersConfig();
        config.getJsearch().setBaseUrl("http://localhost:" + mockWebServer.getPort());
        config.getJsearch().setApiKey("rapid-key");
        provider = new JSearchProvider(WebClient.builder(), config, metrics);
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void shouldSkipRecordsWithoutEmployerAndBuildLocation() throws InterruptedException {
        String body = """
                {
                  "status": "OK",
                  "data": [
                    {
                      "job_title": "Site Reliability Engineer",
                      "employer_name": "Hooli",
                      "job_city": "Denver",
                      "job_state": "CO",
                      "job_apply_link": "https://hooli.example/apply",
                      "job_min_salary": 140000,
                      "job_max_salary": 180000,
                      "job_employment_type": "FULLTIME"
                    },
                    {
                      "job_title": "Mystery Role",
                      "job_city": "Nowhere"
                    },
                    {
                      "job_title": "DevOps Engineer",
                      "employer_name": "Pied Piper",
                      "job_url": "https://pp.example/jobs/1"
                    }
                  ]
                }
                """;
        mockWebServer.enqueue(new MockResponse().setBody(body)
                .addHeader("Content-Type", "application/json")
                .addHeader("x-rapidapi-quota-left", "3"));

        StepVerifier.create(provider.search("remote devops engineer", SearchFilters.none()))
                .assertNext(listings -> {
                    assertThat(listings).extracting(Listing::getCompany).containsExactly("Hooli", "Pied Piper");
                    assertThat(listings.get(0).getLocation()).isEqualTo("Denver, CO");
                    assertThat(listings.get(0).getSalary()).isEqualTo("$140k - $180k");
                    assertThat(listings.get(1).getLocation()).isEqualTo("Remote");
                    assertThat(listings.get(1).getLink()).isEqualTo("https://pp.example/jobs/1");
                })
                .verifyComplete();

        RecordedRequest request = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getHeader("X-RapidAPI-Key")).isEqualTo("rapid-key");
        assertThat(request.getHeader("X-RapidAPI-Host")).isEqualTo("localhost");
        assertThat(request.getRequestUrl().queryParameter("remote_jobs_only")).isEqualTo("true");
    }

    @Test
    void shouldReportForbiddenAsUnauthorized() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(403));

        StepVerifier.create(provider.search("remote developer", SearchFilters.none()))
                .expectErrorSatisfies(error ->
                        assertThat(((ProviderException) error).getKind()).isEqualTo(ProviderException.Kind.UNAUTHORIZED))
                .verify();
    }
}
