package com.hcpbridge.leadwebhook.application.usecase;

import com.hcpbridge.leadwebhook.domain.exception.LeadValidationException;
import com.hcpbridge.leadwebhook.domain.exception.UpstreamException;
import com.hcpbridge.leadwebhook.domain.model.AddressDecision;
import com.hcpbridge.leadwebhook.domain.model.Contact;
import com.hcpbridge.leadwebhook.domain.model.CustomerAddress;
import com.hcpbridge.leadwebhook.domain.model.CustomerCandidate;
import com.hcpbridge.leadwebhook.domain.model.DeclaredCustomerType;
import com.hcpbridge.leadwebhook.domain.model.FormFieldKey;
import com.hcpbridge.leadwebhook.domain.model.FormSubmission;
import com.hcpbridge.leadwebhook.domain.model.Lead;
import com.hcpbridge.leadwebhook.domain.model.LeadCreationResult;
import com.hcpbridge.leadwebhook.domain.model.MatchClassification;
import com.hcpbridge.leadwebhook.domain.model.MatchResult;
import com.hcpbridge.leadwebhook.domain.model.MatchedField;
import com.hcpbridge.leadwebhook.domain.model.PipelineStage;
import com.hcpbridge.leadwebhook.domain.model.ServiceSelection;
import com.hcpbridge.leadwebhook.domain.port.CustomerPlatformGateway;
import com.hcpbridge.leadwebhook.domain.service.AddressResolver;
import com.hcpbridge.leadwebhook.domain.service.ContactNormalizer;
import com.hcpbridge.leadwebhook.domain.service.CustomerMatcher;
import com.hcpbridge.leadwebhook.domain.service.LeadAssembler;
import com.hcpbridge.leadwebhook.infrastructure.config.LeadConfig;
import com.hcpbridge.leadwebhook.infrastructure.metrics.MetricsPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one form submission through normalization, customer matching, address resolution, lead assembly and
 * creation on the platform. The returned {@code Mono} never errors: every failure becomes a failed
 * {@link LeadCreationResult} naming the stage and whatever was already created upstream.
 * Nothing created before a failure is rolled back.
 */
@Service
public class CreateLeadUseCase {

    private static final Logger logger = LoggerFactory.getLogger(CreateLeadUseCase.class);
    private final ContactNormalizer contactNormalizer;
    private final CustomerMatcher customerMatcher;
    private final AddressResolver addressResolver;
    private final LeadAssembler leadAssembler;
    private final CustomerPlatformGateway gateway;
    private final LeadConfig leadConfig;
    private final MetricsPublisher metricsPublisher;

    public CreateLeadUseCase(ContactNormalizer contactNormalizer, CustomerMatcher customerMatcher,
                             AddressResolver addressResolver, LeadAssembler leadAssembler,
                             CustomerPlatformGateway gateway, LeadConfig leadConfig,
                             MetricsPublisher metricsPublisher) {
        this.contactNormalizer = contactNormalizer;
        this.customerMatcher = customerMatcher;
        this.addressResolver = addressResolver;
        this.leadAssembler = leadAssembler;
        this.gateway = gateway;
        this.leadConfig = leadConfig;
        this.metricsPublisher = metricsPublisher;
    }

    public Mono<LeadCreationResult> execute(FormSubmission submission, String correlationId) {
        PipelineContext initial = PipelineContext.start(submission);
        return Mono.fromCallable(() -> contactNormalizer.normalize(submission))
                .onErrorMap(e -> new StageFailure(PipelineStage.NORMALIZING, "normalizeContact", initial, e))
                .map(initial::withContact)
                .doOnNext(ctx -> logger.info("Processing submission, correlationId: {}, email: {}, phone: {}",
                        correlationId, ctx.contact().email(), ctx.contact().phone()))
                .flatMap(this::matchCustomer)
                .flatMap(this::chooseCustomer)
                .flatMap(this::resolveAddress)
                .flatMap(this::assemble)
                .flatMap(this::createLead)
                .doOnNext(result -> {
                    metricsPublisher.incrementLeadProcessing(result.matchType().label());
                    metricsPublisher.incrementLeadWarnings(result.warnings().size());
                    logger.info("Lead created, correlationId: {}, customerId: {}, leadId: {}, matchType: {}, warnings: {}",
                            correlationId, result.customerId(), result.leadId(), result.matchType(),
                            result.warnings().size());
                })
                .onErrorResume(StageFailure.class, failure -> Mono.just(toFailedResult(failure, correlationId)));
    }

    private Mono<PipelineContext> matchCustomer(PipelineContext ctx) {
        return step(PipelineStage.MATCHING, "findCustomers", ctx, customerMatcher.match(ctx.contact()))
                .map(match -> {
                    PipelineContext next = ctx.withMatch(match);
                    if (!match.notChosenCustomers().isEmpty()) {
                        next = next.withWarning("Customer lookups returned " + match.allCandidates().size()
                                + " customers; using " + match.matchedCustomerId() + ", not chosen: "
                                + String.join(", ", match.notChosenCustomers()));
                    }
                    return next;
                });
    }

    private Mono<PipelineContext> chooseCustomer(PipelineContext ctx) {
        MatchResult match = ctx.match();
        switch (match.classification()) {
            case EXACT:
                logger.info("Exact match, using existing customer {}", match.matchedCustomerId());
                return Mono.just(ctx.withExistingCustomer(match.matchedCustomerId()));
            case PARTIAL:
                return choosePartial(ctx, match);
            default:
                return createCustomer(ctx);
        }
    }

    private Mono<PipelineContext> choosePartial(PipelineContext ctx, MatchResult match) {
        DeclaredCustomerType declared = DeclaredCustomerType.from(
                ctx.submission().value(FormFieldKey.CUSTOMER_TYPE).orElse(null));
        String matched = match.matchedOn().stream().findFirst().map(MatchedField::label).orElse("");
        String unmatched = match.unmatchedField().map(MatchedField::label).orElse("");

        if (declared.claimsExisting()) {
            logger.info("Partial match on {}, submitter declared existing; using customer {}",
                    matched, match.matchedCustomerId());
            return Mono.just(ctx.withExistingCustomer(match.matchedCustomerId())
                    .withWarning("Partial match with customer " + match.matchedCustomerId() + ": " + matched
                            + " matched but " + unmatched + " did not. Please verify this is the correct customer."));
        }

        logger.warn("Partial match on {} with customer {}, submitter declared {}; creating new customer",
                matched, match.matchedCustomerId(), declared);
        return createCustomer(ctx)
                .map(next -> next.withWarning("Existing customer " + match.matchedCustomerId() + " shares the submitted "
                        + matched + " but not the " + unmatched + ". Created new customer " + next.customerId()
                        + "; please review and merge if duplicate."));
    }

    private Mono<PipelineContext> createCustomer(PipelineContext ctx) {
        return step(PipelineStage.MATCHING, "createCustomer", ctx, gateway.createCustomer(ctx.contact()))
                .doOnNext(id -> logger.info("Created customer {}", id))
                .map(ctx::withNewCustomer);
    }

    private Mono<PipelineContext> resolveAddress(PipelineContext ctx) {
        Contact contact = ctx.contact();
        if (!contact.hasAddress()) {
            return Mono.just(ctx.withWarning("No service address submitted; lead created without an address."));
        }
        if (ctx.customerCreated()) {
            return createAddress(ctx);
        }

        List<CustomerAddress> existing = ctx.match().matchedCandidate()
                .map(CustomerCandidate::addresses)
                .orElse(List.of());
        AddressDecision decision = addressResolver.resolve(contact.rawAddress(), ctx.match().classification(), existing);
        if (decision.isReuse()) {
            return Mono.just(ctx.withExistingAddress(decision.matchedAddressId()));
        }
        PipelineContext next = ctx;
        if (!existing.isEmpty()) {
            next = ctx.withWarning(String.format("Submitted address \"%s\" did not match any of customer %s's %d "
                            + "service addresses (best similarity %.2f); created a new service address.",
                    contact.rawAddress(), ctx.customerId(), existing.size(), decision.similarityScore()));
        }
        return createAddress(next);
    }

    private Mono<PipelineContext> createAddress(PipelineContext ctx) {
        return step(PipelineStage.RESOLVING_ADDRESS, "createAddress", ctx,
                gateway.createAddress(ctx.customerId(), ctx.contact().serviceAddress()))
                .doOnNext(id -> logger.info("Created address {} for customer {}", id, ctx.customerId()))
                .map(ctx::withNewAddress);
    }

    private Mono<PipelineContext> assemble(PipelineContext ctx) {
        return step(PipelineStage.ASSEMBLING, "assembleLead", ctx, Mono.fromCallable(() -> {
            ServiceSelection selection = leadAssembler.selectServices(ctx.submission());
            List<String> warnings = new ArrayList<>(ctx.warnings());
            warnings.addAll(selection.warnings());
            String note = leadAssembler.buildPrivateNote(ctx.submission(), ctx.match(), warnings);
            Lead lead = new Lead(ctx.customerId(), ctx.addressId(), leadConfig.employeeId(), leadConfig.leadSource(),
                    selection.jobType(), selection.lineItems(), note, warnings);
            return ctx.withLead(lead);
        }));
    }

    private Mono<LeadCreationResult> createLead(PipelineContext ctx) {
        Lead lead = ctx.lead();
        return step(PipelineStage.CREATING, "createLead", ctx, gateway.createLead(lead))
                .map(leadId -> LeadCreationResult.done(ctx.customerId(), leadId, ctx.match().classification(),
                        lead.warnings()));
    }

    private static <T> Mono<T> step(PipelineStage stage, String step, PipelineContext ctx, Mono<T> call) {
        return call
                .switchIfEmpty(Mono.error(() -> new UpstreamException(0, step + " returned no result")))
                .onErrorMap(e -> !(e instanceof StageFailure), e -> new StageFailure(stage, step, ctx, e));
    }

    private LeadCreationResult toFailedResult(StageFailure failure, String correlationId) {
        PipelineContext ctx = failure.context;
        Throwable cause = failure.getCause();
        MatchClassification matchType = ctx.match() == null ? null : ctx.match().classification();

        if (cause instanceof LeadValidationException) {
            metricsPublisher.incrementLeadProcessing("validation_error");
            logger.warn("Validation error, correlationId: {}, error: {}", correlationId, cause.getMessage());
            return LeadCreationResult.failed(failure.stage, cause.getMessage(), null, null, List.of(), List.of());
        }

        StringBuilder error = new StringBuilder(failure.step).append(" failed");
        if (cause instanceof UpstreamException upstream && upstream.getStatusCode() > 0) {
            error.append(" (HTTP ").append(upstream.getStatusCode()).append(')');
        }
        error.append(": ").append(cause.getMessage());
        if (!ctx.createdArtifacts().isEmpty()) {
            error.append(". Already created and not rolled back: ").append(String.join(", ", ctx.createdArtifacts()));
        }

        metricsPublisher.incrementLeadProcessing(cause instanceof UpstreamException ? "upstream_error" : "error");
        logger.error("Lead pipeline failed at {}, correlationId: {}, error: {}", failure.stage, correlationId, error);
        return LeadCreationResult.failed(failure.stage, error.toString(), ctx.customerId(), matchType,
                ctx.warnings(), ctx.createdArtifacts());
    }

    private static final class StageFailure extends RuntimeException {
        private final PipelineStage stage;
        private final String step;
        private final PipelineContext context;

        StageFailure(PipelineStage stage, String step, PipelineContext context, Throwable cause) {
            super(step + " failed during " + stage, cause);
            this.stage = stage;
            this.step = step;
            this.context = context;
        }
    }
}
