package com.hcpbridge.leadwebhook.infrastructure.hcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcpbridge.leadwebhook.domain.exception.UpstreamException;
import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.CustomerCandidate;
import com.hcpbridge.leadwebhook.domain.model.Lead;
import com.hcpbridge.leadwebhook.domain.model.LineItem;
import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;
import com.hcpbridge.leadwebhook.infrastructure.config.HcpClientConfig;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import com.hcpbridge.leadwebhook.infrastructure.metrics.MetricsPublisher;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HcpCustomerPlatformClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();
    private SimpleMeterRegistry meterRegistry;
    private HcpCustomerPlatformClient client;

    @BeforeEach
    void setUp() {
        WebClient webClient = WebClient.builder()
                .baseUrl("https://hcp.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(responses.isEmpty() ? json(HttpStatus.OK, "{}") : responses.poll());
                })
                .build();
        RateLimiter rateLimiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(100)
                .limitRefreshPeriod(Duration.ofMillis(10))
                .timeoutDuration(Duration.ofSeconds(1))
                .build());
        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(HcpClientConfig::isRetryable)
                .build());
        meterRegistry = new SimpleMeterRegistry();
        LeadConfig leadConfig = new LeadConfig("pro_1", "Website", "415", "CA", "US",
                "Plumbing Demand Maintenance", 0.8);
        client = new HcpCustomerPlatformClient(webClient, leadConfig, new MetricsPublisher(meterRegistry),
                rateLimiter, CircuitBreaker.ofDefaults("test"), retry, new HcpCallPacer(Duration.ZERO, Schedulers.parallel()));
    }

    @Test
    void shouldSearchCustomersAndReadCandidates() {
        responses.add(json(HttpStatus.OK, """
                {"customers": [{
                  "id": "cus_1",
                  "email": "jane@example.com",
                  "mobile_number": null,
                  "home_number": "+14155550123",
                  "addresses": [{"id": "adr_1", "street": "123 Main St", "city": "San Francisco",
                                 "state": "CA", "zip": "94102", "country": "US"}]
                }]}
                """));

        StepVerifier.create(client.findCustomersByPhone("4155550123"))
                .assertNext(candidate -> {
                    assertThat(candidate.customerId()).isEqualTo("cus_1");
                    assertThat(candidate.phone()).isEqualTo("+14155550123");
                    assertThat(candidate.addresses()).singleElement()
                            .satisfies(a -> assertThat(a.address().oneLine())
                                    .isEqualTo("123 Main St, San Francisco, CA 94102"));
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.url().getPath()).isEqualTo("/customers");
        assertThat(request.url().getQuery()).isEqualTo("q=4155550123");
    }

    @Test
    void shouldEncodeEmailInSearchQuery() {
        responses.add(json(HttpStatus.OK, "{\"customers\": []}"));

        StepVerifier.create(client.findCustomersByEmail("jane+plumbing@example.com"))
                .verifyComplete();

        assertThat(requests.get(0).url().getRawQuery()).isEqualTo("q=jane%2Bplumbing%40example.com");
    }

    @Test
    void shouldCreateCustomerWithE164MobileNumber() {
        responses.add(json(HttpStatus.CREATED, "{\"id\": \"cus_new\"}"));
        Contact contact = new Contact("Jane", "Doe", "jane@example.com", "4155550123", "", null, true);

        StepVerifier.create(client.createCustomer(contact))
                .expectNext("cus_new")
                .verifyComplete();

        JsonNode body = body(requests.get(0));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/customers");
        assertThat(body.get("first_name").asText()).isEqualTo("Jane");
        assertThat(body.get("mobile_number").asText()).isEqualTo("+14155550123");
        assertThat(body.get("lead_source").asText()).isEqualTo("Website");
        assertThat(body.get("notifications_enabled").asBoolean()).isTrue();
    }

    @Test
    void shouldReadAddressIdFromWrappedResponse() {
        responses.add(json(HttpStatus.CREATED, "{\"address\": {\"id\": \"adr_9\"}}"));
        ServiceAddress address = new ServiceAddress("1 Elm St", null, "Oakland", "CA", "94607", "US");

        StepVerifier.create(client.createAddress("cus_1", address))
                .expectNext("adr_9")
                .verifyComplete();

        JsonNode body = body(requests.get(0));
        assertThat(requests.get(0).url().getPath()).isEqualTo("/customers/cus_1/addresses");
        assertThat(body.get("type").asText()).isEqualTo("service");
        assertThat(body.has("street_line_2")).isFalse();
    }

    @Test
    void shouldSendLeadWithQuoteOnlyLineItems() {
        responses.add(json(HttpStatus.CREATED, "{\"id\": \"lead_1\"}"));
        Lead lead = new Lead("cus_1", null, "pro_1", "Website", "Plumbing Estimate",
                List.of(LineItem.quoteOnly("Water Heater Service", "Leaking")), "note", List.of());

        StepVerifier.create(client.createLead(lead))
                .expectNext("lead_1")
                .verifyComplete();

        JsonNode body = body(requests.get(0));
        assertThat(body.has("address_id")).isFalse();
        assertThat(body.get("assigned_employee_id").asText()).isEqualTo("pro_1");
        assertThat(body.get("line_items").get(0).get("name").asText()).isEqualTo("Water Heater Service");
        assertThat(body.get("line_items").get(0).get("unit_price").asInt()).isZero();
        assertThat(body.get("note").asText()).isEqualTo("note");
        assertThat(meterRegistry.counter("hcp.request.count", "operation", "createLead", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldRetryServerErrorsThenSucceed() {
        responses.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));
        responses.add(json(HttpStatus.TOO_MANY_REQUESTS, "{}"));
        responses.add(json(HttpStatus.CREATED, "{\"id\": \"cus_new\"}"));

        StepVerifier.create(client.createCustomer(new Contact("Jane", "Doe", "jane@example.com", "4155550123",
                        "", null, false)))
                .expectNext("cus_new")
                .verifyComplete();

        assertThat(requests).hasSize(3);
    }

    @Test
    void shouldNotRetryClientErrors() {
        responses.add(json(HttpStatus.UNPROCESSABLE_ENTITY, "{\"error\": \"invalid email\"}"));

        StepVerifier.create(client.createCustomer(new Contact("Jane", "Doe", "bad", "4155550123", "", null, false)))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(UpstreamException.class);
                    assertThat(((UpstreamException) e).getStatusCode()).isEqualTo(422);
                })
                .verify();

        assertThat(requests).hasSize(1);
    }

    @Test
    void shouldFailWhenResponseHasNoId() {
        responses.add(json(HttpStatus.OK, "{\"lead\": {}}"));
        Lead lead = new Lead("cus_1", "adr_1", "pro_1", "Website", "Plumbing Estimate", List.of(), "note", List.of());

        StepVerifier.create(client.createLead(lead))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamException.class)
                        .hasMessageContaining("did not include an id"))
                .verify();
    }

    @Test
    void shouldFailWhenCreateResponseHasEmptyBody() {
        responses.add(ClientResponse.create(HttpStatus.CREATED).build());

        StepVerifier.create(client.createCustomer(new Contact("Jane", "Doe", "jane@example.com", "4155550123",
                        "", null, false)))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UpstreamException.class)
                        .hasMessage("createCustomer returned an empty body"))
                .verify();

        assertThat(requests).hasSize(1);
        assertThat(meterRegistry.counter("hcp.request.count", "operation", "createCustomer", "status", "error").count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCountResponseWithoutIdAsError() {
        responses.add(json(HttpStatus.OK, "{\"address\": {}}"));

        StepVerifier.create(client.createAddress("cus_1", new ServiceAddress("1 Elm St", null, null, null, null, null)))
                .expectError(UpstreamException.class)
                .verify();

        assertThat(meterRegistry.counter("hcp.request.count", "operation", "createAddress", "status", "success").count())
                .isZero();
        assertThat(meterRegistry.counter("hcp.request.count", "operation", "createAddress", "status", "error").count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldFallBackToHomeOrWorkNumber() throws Exception {
        CustomerCandidate candidate = HcpCustomerPlatformClient.toCandidate(objectMapper.readTree(
                "{\"id\": \"cus_2\", \"mobile_number\": \"\", \"work_number\": \"4155550000\"}"));

        assertThat(candidate.phone()).isEqualTo("4155550000");
        assertThat(candidate.email()).isNull();
        assertThat(candidate.addresses()).isEmpty();
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build();
    }

    private JsonNode body(ClientRequest request) {
        MockClientHttpRequest written = new MockClientHttpRequest(request.method(), request.url());
        request.writeTo(written, ExchangeStrategies.withDefaults()).block();
        try {
            return objectMapper.readTree(written.getBodyAsString().block());
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
