package com.hcpbridge.leadwebhook.domain.service;

import com.hcpbridge.leadwebhook.domain.model.FormField;
import com.hcpbridge.leadwebhook.domain.model.FormSubmission;
import com.hcpbridge.leadwebhook.domain.model.LineItem;
import com.hcpbridge.leadwebhook.domain.model.MatchClassification;
import com.hcpbridge.leadwebhook.domain.model.MatchResult;
import com.hcpbridge.leadwebhook.domain.model.MatchedField;
import com.hcpbridge.leadwebhook.domain.model.ServiceSelection;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.hcpbridge.leadwebhook.domain.model.FormFieldKey.REQUEST_DETAILS;
import static com.hcpbridge.leadwebhook.domain.model.FormFieldKey.SERVICE_DETAILS;
import static com.hcpbridge.leadwebhook.domain.model.FormFieldKey.SERVICE_NEEDED;

/**
 * Maps the submitted service choices onto a job type and line items, and writes the private audit note.
 */
@Service
public class LeadAssembler {

    private static final Logger logger = LoggerFactory.getLogger(LeadAssembler.class);
    private final LeadConfig leadConfig;

    public LeadAssembler(LeadConfig leadConfig) {
        this.leadConfig = leadConfig;
    }

    public ServiceSelection selectServices(FormSubmission submission) {
        List<String> warnings = new ArrayList<>();

        Optional<String> serviceNeeded = submission.value(SERVICE_NEEDED);
        String jobType = serviceNeeded.flatMap(ServiceCatalog::jobTypeFor).orElse(leadConfig.defaultJobType());
        if (serviceNeeded.isPresent() && ServiceCatalog.jobTypeFor(serviceNeeded.get()).isEmpty()) {
            logger.warn("No job type mapping for service needed: {}", serviceNeeded.get());
            warnings.add("unmapped service value \"" + serviceNeeded.get() + "\" (Service Needed); used job type "
                    + jobType);
        }

        String requestDetails = submission.value(REQUEST_DETAILS).orElse(null);
        List<LineItem> lineItems = new ArrayList<>();
        for (String detail : submission.values(SERVICE_DETAILS)) {
            Optional<String> mapped = ServiceCatalog.lineItemFor(detail);
            if (mapped.isEmpty()) {
                logger.warn("No line item mapping for service detail: {}", detail);
                warnings.add("unmapped service value \"" + detail + "\" (Service Details); used generic line item");
            }
            String description = mapped.orElseGet(() -> ServiceCatalog.genericLineItem(detail));
            lineItems.add(LineItem.quoteOnly(description, lineItems.isEmpty() ? requestDetails : null));
        }

        logger.debug("Selected job type {} with line items {}", jobType,
                lineItems.stream().map(LineItem::description).toList());
        return new ServiceSelection(jobType, lineItems, warnings);
    }

    /**
     * Every submitted field as a {@code "<FieldName>: <Value>"} line, followed by the match summary and warnings.
     * The same input always yields the same text.
     */
    public String buildPrivateNote(FormSubmission submission, MatchResult match, List<String> warnings) {
        List<String> lines = new ArrayList<>();
        lines.add("=== Website Form Submission ===");
        lines.add("");
        for (FormField field : submission.fields()) {
            if (!field.isBlank()) {
                lines.add(field.name() + ": " + field.value());
            }
        }

        lines.add("");
        lines.add("=== Customer Match Info ===");
        lines.add(matchSummary(match));

        if (!warnings.isEmpty()) {
            lines.add("");
            lines.add("Warnings:");
            warnings.forEach(w -> lines.add("- " + w));
        }
        return String.join("\n", lines);
    }

    private static String matchSummary(MatchResult match) {
        if (match.classification() == MatchClassification.NONE) {
            return "New customer (no existing record found)";
        }
        String fields = match.matchedOn().stream()
                .sorted()
                .map(MatchedField::label)
                .collect(Collectors.joining(" and "));
        return (match.classification() == MatchClassification.EXACT ? "Exact" : "Partial")
                + " match on " + fields + " with customer " + match.matchedCustomerId();
    }
}
