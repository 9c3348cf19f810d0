package com.hcpbridge.leadwebhook.domain.service;

import com.hcpbridge.leadwebhook.domain.model.AddressAction;
import com.hcpbridge.leadwebhook.domain.model.AddressDecision;
import com.hcpbridge.leadwebhook.domain.model.CustomerAddress;
import com.hcpbridge.leadwebhook.domain.model.MatchClassification;
import com.hcpbridge.leadwebhook.domain.model.ServiceAddress;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AddressResolverTest {

    private AddressResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new AddressResolver(new LeadConfig("pro_1", "Website", "415", "CA", "US",
                "Plumbing Demand Maintenance", 0.8));
    }

    @Test
    void shouldReuseAddressThatDiffersOnlyInAbbreviation() {
        CustomerAddress home = new CustomerAddress("adr_home",
                new ServiceAddress("123 Main St", null, "San Francisco", "CA", "94102", "US"));

        AddressDecision decision = resolver.resolve("123 Main Street, San Francisco, CA 94102",
                MatchClassification.EXACT, List.of(home));

        assertThat(decision.action()).isEqualTo(AddressAction.REUSE);
        assertThat(decision.matchedAddressId()).isEqualTo("adr_home");
        assertThat(decision.similarityScore()).isEqualTo(1.0);
    }

    @Test
    void shouldReuseAddressWrittenWithCityAbbreviation() {
        CustomerAddress stored = address("adr_oak", "456 Oak Avenue, San Francisco, CA 94115");

        AddressDecision decision = resolver.resolve("456 Oak Ave, SF, CA 94115", MatchClassification.EXACT,
                List.of(stored));

        assertThat(decision.isReuse()).isTrue();
        assertThat(decision.matchedAddressId()).isEqualTo("adr_oak");
    }

    @Test
    void shouldReuseAddressExactlyAtThreshold() {
        CustomerAddress stored = address("adr_1", "1 2 3 4 5");

        AddressDecision decision = resolver.resolve("1 2 3 4", MatchClassification.PARTIAL, List.of(stored));

        assertThat(decision.isReuse()).isTrue();
        assertThat(decision.similarityScore()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void shouldCreateNewAddressBelowThreshold() {
        CustomerAddress stored = address("adr_1", "1 2 3 4 5");

        AddressDecision decision = resolver.resolve("1 2 3", MatchClassification.EXACT, List.of(stored));

        assertThat(decision.action()).isEqualTo(AddressAction.CREATE_NEW);
        assertThat(decision.matchedAddressId()).isNull();
        assertThat(decision.similarityScore()).isCloseTo(0.6, within(1e-9));
    }

    @Test
    void shouldPickMostSimilarAddress() {
        CustomerAddress office = address("adr_office", "500 Market Street, San Francisco, CA 94105");
        CustomerAddress home = address("adr_home", "123 Main Street, San Francisco, CA 94102");

        AddressDecision decision = resolver.resolve("123 Main St, SF, CA 94102", MatchClassification.EXACT,
                List.of(office, home));

        assertThat(decision.matchedAddressId()).isEqualTo("adr_home");
    }

    @Test
    void shouldAlwaysCreateNewAddressWithoutMatchedCustomer() {
        CustomerAddress stored = address("adr_1", "123 Main Street");

        AddressDecision decision = resolver.resolve("123 Main Street", MatchClassification.NONE, List.of(stored));

        assertThat(decision.action()).isEqualTo(AddressAction.CREATE_NEW);
    }

    @Test
    void shouldCreateNewAddressWhenCustomerHasNone() {
        assertThat(resolver.resolve("123 Main Street", MatchClassification.EXACT, List.of()).isReuse()).isFalse();
    }

    @Test
    void shouldComputeSymmetricSimilarity() {
        String a = "12 N Elm Ave Apt 4";
        String b = "12 North Elm Avenue, Suite 4";

        assertThat(AddressResolver.similarity(a, b)).isEqualTo(AddressResolver.similarity(b, a));
        assertThat(AddressResolver.similarity(a, b)).isCloseTo(5.0 / 7.0, within(1e-9));
    }

    @Test
    void shouldTreatTwoEmptyAddressesAsIdentical() {
        assertThat(AddressResolver.similarity("", " , ")).isEqualTo(1.0);
        assertThat(AddressResolver.similarity("", "1 Main St")).isZero();
    }

    @Test
    void shouldExpandAbbreviationsIntoTokens() {
        assertThat(AddressResolver.tokens("9 SF Blvd")).containsExactlyInAnyOrder("9", "san", "francisco", "boulevard");
    }

    private static CustomerAddress address(String id, String street) {
        return new CustomerAddress(id, new ServiceAddress(street, null, null, null, null, null));
    }
}
