package com.hcpbridge.leadwebhook.domain.service;

import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.CustomerCandidate;
import com.hcpbridge.leadwebhook.domain.model.MatchClassification;
import com.hcpbridge.leadwebhook.domain.model.MatchResult;
import com.hcpbridge.leadwebhook.domain.model.MatchedField;
import com.hcpbridge.leadwebhook.domain.port.CustomerPlatformGateway;
import com.hcpbridge.leadwebhook.domain.util.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Looks a contact up by phone and by email and classifies the best candidate as an exact, partial or no match.
 */
@Service
public class CustomerMatcher {

    private static final Logger logger = LoggerFactory.getLogger(CustomerMatcher.class);
    private final CustomerPlatformGateway gateway;

    public CustomerMatcher(CustomerPlatformGateway gateway) {
        this.gateway = gateway;
    }

    public Mono<MatchResult> match(Contact contact) {
        return gateway.findCustomersByPhone(contact.phone()).collectList()
                .flatMap(byPhone -> gateway.findCustomersByEmail(contact.email()).collectList()
                        .map(byEmail -> {
                            logger.info("Customer lookup found {} by phone, {} by email", byPhone.size(), byEmail.size());
                            return classify(contact, byPhone, byEmail);
                        }));
    }

    /**
     * Ranks the union of both lookups. The earliest candidate wins a tie, so phone results take precedence
     * over email results.
     */
    public MatchResult classify(Contact contact, List<CustomerCandidate> byPhone, List<CustomerCandidate> byEmail) {
        Map<String, CustomerCandidate> union = new LinkedHashMap<>();
        for (CustomerCandidate candidate : concat(byPhone, byEmail)) {
            if (candidate.customerId() != null) {
                union.putIfAbsent(candidate.customerId(), candidate);
            }
        }
        List<CustomerCandidate> candidates = List.copyOf(union.values());

        CustomerCandidate best = null;
        Set<MatchedField> bestMatchedOn = EnumSet.noneOf(MatchedField.class);
        for (CustomerCandidate candidate : candidates) {
            Set<MatchedField> matchedOn = matchedOn(contact, candidate);
            if (matchedOn.size() > bestMatchedOn.size()) {
                best = candidate;
                bestMatchedOn = matchedOn;
            }
        }

        if (best == null) {
            return MatchResult.none(candidates);
        }
        String chosenId = best.customerId();
        List<String> notChosen = candidates.stream()
                .map(CustomerCandidate::customerId)
                .filter(id -> !id.equals(chosenId))
                .toList();
        return new MatchResult(MatchClassification.of(bestMatchedOn), chosenId, bestMatchedOn, candidates, notChosen);
    }

    static Set<MatchedField> matchedOn(Contact contact, CustomerCandidate candidate) {
        Set<MatchedField> matchedOn = EnumSet.noneOf(MatchedField.class);
        PhoneNumbers.storedToNationalNumber(candidate.phone())
                .filter(contact.phone()::equals)
                .ifPresent(p -> matchedOn.add(MatchedField.PHONE));
        if (candidate.email() != null && candidate.email().trim().toLowerCase(Locale.ROOT).equals(contact.email())) {
            matchedOn.add(MatchedField.EMAIL);
        }
        return matchedOn;
    }

    private static List<CustomerCandidate> concat(List<CustomerCandidate> first, List<CustomerCandidate> second) {
        List<CustomerCandidate> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }
}
