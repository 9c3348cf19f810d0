package com.hcpbridge.leadwebhook.application.usecase;

import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.FormSubmission;
import com.hcpbridge.leadwebhook.domain.model.Lead;
import com.hcpbridge.leadwebhook.domain.model.MatchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * What one submission has accumulated so far. Each stage returns a new context.
 *
 * @param createdArtifacts platform records this request created, e.g. {@code "customer cus_123"}
 */
record PipelineContext(
        FormSubmission submission,
        Contact contact,
        MatchResult match,
        String customerId,
        boolean customerCreated,
        String addressId,
        Lead lead,
        List<String> warnings,
        List<String> createdArtifacts
) {
    PipelineContext {
        warnings = List.copyOf(warnings);
        createdArtifacts = List.copyOf(createdArtifacts);
    }

    static PipelineContext start(FormSubmission submission) {
        return new PipelineContext(submission, null, null, null, false, null, null, List.of(), List.of());
    }

    PipelineContext withContact(Contact contact) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                warnings, createdArtifacts);
    }

    PipelineContext withMatch(MatchResult match) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                warnings, createdArtifacts);
    }

    PipelineContext withExistingCustomer(String customerId) {
        return new PipelineContext(submission, contact, match, customerId, false, addressId, lead,
                warnings, createdArtifacts);
    }

    PipelineContext withNewCustomer(String customerId) {
        return new PipelineContext(submission, contact, match, customerId, true, addressId, lead,
                warnings, append(createdArtifacts, "customer " + customerId));
    }

    PipelineContext withExistingAddress(String addressId) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                warnings, createdArtifacts);
    }

    PipelineContext withNewAddress(String addressId) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                warnings, append(createdArtifacts, "address " + addressId));
    }

    PipelineContext withLead(Lead lead) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                lead.warnings(), createdArtifacts);
    }

    PipelineContext withWarning(String warning) {
        return new PipelineContext(submission, contact, match, customerId, customerCreated, addressId, lead,
                append(warnings, warning), createdArtifacts);
    }

    private static List<String> append(List<String> list, String item) {
        List<String> copy = new ArrayList<>(list);
        copy.add(item);
        return copy;
    }
}
