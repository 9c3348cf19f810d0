package com.hcpbridge.leadwebhook.domain.port;

import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.CustomerCandidate;
import com.hcpbridge.leadwebhook.domain.model.Lead;
import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Operations the lead pipeline needs from the customer platform.
 * Every operation signals {@link com.hcpbridge.leadwebhook.domain.exception.UpstreamException} on a non-success response.
 */
public interface CustomerPlatformGateway {

    Flux<CustomerCandidate> findCustomersByPhone(String phone);

    Flux<CustomerCandidate> findCustomersByEmail(String email);

    /**
     * @return the id of the new customer
     */
    Mono<String> createCustomer(Contact contact);

    /**
     * @return the id of the new service address
     */
    Mono<String> createAddress(String customerId, ServiceAddress address);

    /**
     * @return the id of the new lead
     */
    Mono<String> createLead(Lead lead);
}
