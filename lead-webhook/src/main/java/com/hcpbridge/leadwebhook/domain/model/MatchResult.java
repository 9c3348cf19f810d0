package com.hcpbridge.leadwebhook.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of matching a contact against existing customers.
 *
 * @param matchedCustomerId      the chosen candidate, {@code null} when nothing matched
 * @param matchedOn              the fields the chosen candidate shares with the contact
 * @param allCandidates          every customer returned by the phone and email lookups, phone results first
 * @param notChosenCustomers     ids of every other candidate, empty when nothing matched
 */
public record MatchResult(
        MatchClassification classification,
        String matchedCustomerId,
        Set<MatchedField> matchedOn,
        List<CustomerCandidate> allCandidates,
        List<String> notChosenCustomers
) {
    public MatchResult {
        matchedOn = matchedOn.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(matchedOn));
        allCandidates = List.copyOf(allCandidates);
        notChosenCustomers = List.copyOf(notChosenCustomers);
    }

    public static MatchResult none(List<CustomerCandidate> allCandidates) {
        return new MatchResult(MatchClassification.NONE, null, Set.of(), allCandidates, List.of());
    }

    public Optional<CustomerCandidate> matchedCandidate() {
        return allCandidates.stream()
                .filter(c -> c.customerId().equals(matchedCustomerId))
                .findFirst();
    }

    /**
     * The field the chosen candidate does not share, for a partial match.
     */
    public Optional<MatchedField> unmatchedField() {
        if (classification != MatchClassification.PARTIAL) {
            return Optional.empty();
        }
        return EnumSet.complementOf(EnumSet.copyOf(matchedOn)).stream().findFirst();
    }
}
