package com.hcpbridge.leadwebhook.infrastructure.hcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.hcpbridge.leadwebhook.domain.exception.UpstreamException;
import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.CustomerAddress;
import com.hcpbridge.leadwebhook.domain.model.CustomerCandidate;
import com.hcpbridge.leadwebhook.domain.model.Lead;
import com.hcpbridge.leadwebhook.domain.model.LineItem;
import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;
import com.hcpbridge.leadwebhook.domain.port.CustomerPlatformGateway;
import com.hcpbridge.leadwebhook.domain.util.PhoneNumbers;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import com.hcpbridge.leadwebhook.infrastructure.metrics.MetricsPublisher;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Housecall Pro implementation of {@link CustomerPlatformGateway}.
 * Every request is spaced from the previous one by the shared {@link HcpCallPacer}, waits on the rate limiter,
 * and is retried on throttling, server and connection errors.
 */
@Component
public class HcpCustomerPlatformClient implements CustomerPlatformGateway {

    private static final Logger logger = LoggerFactory.getLogger(HcpCustomerPlatformClient.class);
    private final WebClient webClient;
    private final LeadConfig leadConfig;
    private final MetricsPublisher metricsPublisher;
    private final RateLimiter hcpRateLimiter;
    private final CircuitBreaker hcpCircuitBreaker;
    private final Retry hcpRetry;
    private final HcpCallPacer callPacer;

    public HcpCustomerPlatformClient(@Qualifier("hcpWebClient") WebClient webClient, LeadConfig leadConfig,
                                     MetricsPublisher metricsPublisher,
                                     @Qualifier("hcpRateLimiter") RateLimiter hcpRateLimiter,
                                     @Qualifier("hcpCircuitBreaker") CircuitBreaker hcpCircuitBreaker,
                                     @Qualifier("hcpRetry") Retry hcpRetry, HcpCallPacer callPacer) {
        this.webClient = webClient;
        this.leadConfig = leadConfig;
        this.metricsPublisher = metricsPublisher;
        this.hcpRateLimiter = hcpRateLimiter;
        this.hcpCircuitBreaker = hcpCircuitBreaker;
        this.hcpRetry = hcpRetry;
        this.callPacer = callPacer;
    }

    @Override
    public Flux<CustomerCandidate> findCustomersByPhone(String phone) {
        return searchCustomers("findCustomersByPhone", phone);
    }

    @Override
    public Flux<CustomerCandidate> findCustomersByEmail(String email) {
        return searchCustomers("findCustomersByEmail", email);
    }

    @Override
    public Mono<String> createCustomer(Contact contact) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("first_name", contact.firstName());
        body.put("last_name", contact.lastName());
        body.put("email", contact.email());
        body.put("mobile_number", PhoneNumbers.toE164(contact.phone()));
        body.put("lead_source", leadConfig.leadSource());
        body.put("notifications_enabled", contact.smsConsent());

        return create("createCustomer", "/customers", body, response -> response);
    }

    @Override
    public Mono<String> createAddress(String customerId, ServiceAddress address) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", "service");
        putIfPresent(body, "street", address.street());
        putIfPresent(body, "street_line_2", address.streetLine2());
        putIfPresent(body, "city", address.city());
        putIfPresent(body, "state", address.state());
        putIfPresent(body, "zip", address.zip());
        putIfPresent(body, "country", address.country());

        return create("createAddress", "/customers/" + customerId + "/addresses", body,
                response -> response.has("address") ? response.get("address") : response);
    }

    @Override
    public Mono<String> createLead(Lead lead) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("customer_id", lead.customerId());
        putIfPresent(body, "address_id", lead.addressId());
        body.put("assigned_employee_id", lead.employeeId());
        body.put("lead_source", lead.leadSource());
        body.put("job_type", lead.jobType());
        if (!lead.lineItems().isEmpty()) {
            body.put("line_items", lead.lineItems().stream().map(HcpCustomerPlatformClient::lineItemBody).toList());
        }
        body.put("note", lead.privateNote());

        return create("createLead", "/leads", body, response -> response);
    }

    private Flux<CustomerCandidate> searchCustomers(String operation, String query) {
        Mono<JsonNode> request = webClient.get()
                .uri(builder -> builder.path("/customers").queryParam("q", "{q}").build(query))
                .retrieve()
                .bodyToMono(JsonNode.class);
        return call(operation, request)
                .flatMapMany(response -> Flux.fromIterable(response.path("customers")))
                .map(HcpCustomerPlatformClient::toCandidate);
    }

    /**
     * Posts {@code body} and reads the new record's id from the node {@code idHolder} picks out of the response.
     * An empty body or a missing id fails the call.
     */
    private Mono<String> create(String operation, String path, Map<String, Object> body,
                                UnaryOperator<JsonNode> idHolder) {
        logger.debug("{} request body: {}", operation, body);
        Mono<String> request = webClient.post()
                .uri(path)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .switchIfEmpty(Mono.error(() -> new UpstreamException(0, operation + " returned an empty body")))
                .map(response -> requireId(operation, idHolder.apply(response)));
        return call(operation, request);
    }

    private <T> Mono<T> call(String operation, Mono<T> request) {
        return request
                .transform(callPacer::pace)
                .transformDeferred(RateLimiterOperator.of(hcpRateLimiter))
                .transformDeferred(CircuitBreakerOperator.of(hcpCircuitBreaker))
                .transformDeferred(RetryOperator.of(hcpRetry))
                .doOnSuccess(v -> metricsPublisher.incrementHcpRequest(operation, "success"))
                .doOnError(e -> {
                    metricsPublisher.incrementHcpRequest(operation, "error");
                    logger.error("HCP {} failed, error: {}", operation, e.getMessage());
                })
                .onErrorMap(e -> !(e instanceof UpstreamException), e -> toUpstreamException(operation, e));
    }

    private static UpstreamException toUpstreamException(String operation, Throwable e) {
        if (e instanceof WebClientResponseException response) {
            logger.error("HCP {} response status: {}, body: {}", operation, response.getStatusCode().value(),
                    response.getResponseBodyAsString());
            return new UpstreamException(response.getStatusCode().value(),
                    operation + " returned HTTP " + response.getStatusCode().value(), e);
        }
        if (e instanceof CallNotPermittedException) {
            return new UpstreamException(0, operation + " rejected: HCP circuit breaker is open", e);
        }
        if (e instanceof RequestNotPermitted) {
            return new UpstreamException(0, operation + " timed out waiting for the HCP rate limiter", e);
        }
        return new UpstreamException(0, operation + " failed: " + e.getMessage(), e);
    }

    private static String requireId(String operation, JsonNode response) {
        String id = response == null ? null : response.path("id").asText(null);
        if (id == null || id.isBlank()) {
            logger.warn("No id in {} response: {}", operation, response);
            throw new UpstreamException(0, operation + " response did not include an id");
        }
        return id;
    }

    static CustomerCandidate toCandidate(JsonNode customer) {
        List<CustomerAddress> addresses = new ArrayList<>();
        for (JsonNode address : customer.path("addresses")) {
            addresses.add(new CustomerAddress(
                    text(address, "id"),
                    new ServiceAddress(
                            text(address, "street"),
                            text(address, "street_line_2"),
                            text(address, "city"),
                            text(address, "state"),
                            text(address, "zip"),
                            text(address, "country"))));
        }
        String phone = firstPresent(
                text(customer, "mobile_number"), text(customer, "home_number"), text(customer, "work_number"));
        return new CustomerCandidate(text(customer, "id"), phone, text(customer, "email"), addresses);
    }

    private static Map<String, Object> lineItemBody(LineItem item) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", item.description());
        putIfPresent(body, "description", item.details());
        body.put("quantity", item.quantity());
        body.put("unit_price", item.unitPrice());
        body.put("kind", "labor");
        return body;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static String firstPresent(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static void putIfPresent(Map<String, Object> body, String key, String value) {
        if (value != null) {
            body.put(key, value);
        }
    }
}
