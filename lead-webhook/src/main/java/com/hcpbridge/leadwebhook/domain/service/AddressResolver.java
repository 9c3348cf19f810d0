package com.hcpbridge.leadwebhook.domain.service;

import com.hcpbridge.leadwebhook.domain.model.AddressDecision;
import com.hcpbridge.leadwebhook.domain.model.CustomerAddress;
import com.hcpbridge.leadwebhook.domain.model.MatchClassification;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a submitted address is one the customer already has on file.
 * Similarity is the Jaccard index of the two addresses' token sets after abbreviations are expanded.
 */
@Service
public class AddressResolver {

    private static final Logger logger = LoggerFactory.getLogger(AddressResolver.class);

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("st", "street"),
            Map.entry("str", "street"),
            Map.entry("ave", "avenue"),
            Map.entry("av", "avenue"),
            Map.entry("blvd", "boulevard"),
            Map.entry("rd", "road"),
            Map.entry("dr", "drive"),
            Map.entry("ln", "lane"),
            Map.entry("ct", "court"),
            Map.entry("pl", "place"),
            Map.entry("ter", "terrace"),
            Map.entry("cir", "circle"),
            Map.entry("hwy", "highway"),
            Map.entry("pkwy", "parkway"),
            Map.entry("sq", "square"),
            Map.entry("apt", "apartment"),
            Map.entry("ste", "suite"),
            Map.entry("n", "north"),
            Map.entry("s", "south"),
            Map.entry("e", "east"),
            Map.entry("w", "west"),
            Map.entry("ne", "northeast"),
            Map.entry("nw", "northwest"),
            Map.entry("se", "southeast"),
            Map.entry("sw", "southwest"),
            Map.entry("sf", "san francisco"));

    private final double threshold;

    public AddressResolver(LeadConfig leadConfig) {
        this.threshold = leadConfig.addressSimilarityThreshold();
    }

    public AddressDecision resolve(String address, MatchClassification classification, List<CustomerAddress> existing) {
        if (classification == MatchClassification.NONE || existing.isEmpty()) {
            return AddressDecision.createNew(0.0);
        }

        CustomerAddress best = null;
        double bestScore = 0.0;
        for (CustomerAddress candidate : existing) {
            double score = similarity(address, candidate.address().oneLine());
            logger.debug("Address similarity {} for address {}", score, candidate.addressId());
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }

        if (bestScore >= threshold) {
            logger.info("Reusing address {} ({} similar)", best.addressId(), bestScore);
            return AddressDecision.reuse(best.addressId(), bestScore);
        }
        logger.info("No existing address reaches {} similarity (best {}), creating new", threshold, bestScore);
        return AddressDecision.createNew(bestScore);
    }

    public static double similarity(String first, String second) {
        Set<String> a = tokens(first);
        Set<String> b = tokens(second);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    static Set<String> tokens(String address) {
        if (address == null) {
            return Set.of();
        }
        return Arrays.stream(address.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim().split(" "))
                .filter(token -> !token.isEmpty())
                .map(token -> ABBREVIATIONS.getOrDefault(token, token))
                .flatMap(token -> Arrays.stream(token.split(" ")))
                .collect(Collectors.toSet());
    }
}
