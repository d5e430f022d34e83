package com.basketgov.proposal;

import com.basketgov.contract.Operation;
import com.basketgov.execution.ExecutionLogEntry;
import com.basketgov.execution.ExecutionResult;
import com.basketgov.policy.ValidatorReport;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A request to mutate substrate, subject to review. Instances are immutable;
 * transitions return a new value and are only performed by
 * {@link ProposalService}.
 */
@JsonPropertyOrder({"id", "basket_id", "workspace_id", "proposal_kind", "origin", "status", "is_executed"})
public record Proposal(
    @JsonProperty("id") String id,
    @JsonProperty("basket_id") String basketId,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("proposal_kind") ProposalKind proposalKind,
    @JsonProperty("origin") ProposalOrigin origin,
    @JsonProperty("status") ProposalStatus status,
    @JsonProperty("ops") List<Operation> ops,
    @JsonProperty("validator_report") ValidatorReport validatorReport,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("blast_radius") BlastRadius blastRadius,
    @JsonProperty("is_executed") boolean isExecuted,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("provenance") List<String> provenance,
    @JsonProperty("entry_point") EntryPoint entryPoint,
    @JsonProperty("reviewed_by") String reviewedBy,
    @JsonProperty("reviewed_at") Instant reviewedAt,
    @JsonProperty("review_notes") String reviewNotes,
    @JsonProperty("executed_at") Instant executedAt,
    @JsonProperty("commit_id") String commitId,
    @JsonProperty("execution_log") List<ExecutionLogEntry> executionLog
) {

    public static final String AUTO_APPROVED_NOTE = "auto-approved";

    public Proposal {
        ops = List.copyOf(ops);
        provenance = provenance == null ? List.of() : List.copyOf(provenance);
        executionLog = executionLog == null ? List.of() : List.copyOf(executionLog);
    }

    Proposal approved(String reviewer, Instant at, String notes, ExecutionResult result) {
        return new Proposal(id, basketId, workspaceId, proposalKind, origin, ProposalStatus.APPROVED, ops,
            validatorReport, confidence, blastRadius, true, createdAt, provenance, entryPoint,
            reviewer, at, notes, at, result.commitId(), result.executionLog());
    }

    Proposal rejected(String reviewer, Instant at, String reason) {
        return new Proposal(id, basketId, workspaceId, proposalKind, origin, ProposalStatus.REJECTED, ops,
            validatorReport, confidence, blastRadius, false, createdAt, provenance, entryPoint,
            reviewer, at, reason, null, null, List.of());
    }

    @JsonProperty("auto_approved")
    public boolean autoApproved() {
        return status == ProposalStatus.APPROVED && isExecuted
            && reviewNotes != null && reviewNotes.toLowerCase().contains(AUTO_APPROVED_NOTE);
    }

    /**
     * Human-readable op type list, e.g. {@code "2x CreateBlock, 1x ReviseBlock"}.
     */
    @JsonProperty("ops_summary")
    public String opsSummary() {
        Map<String, Long> counts = ops.stream()
            .collect(Collectors.groupingBy(op -> op.type().getValue(), LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
            .map(e -> e.getValue() + "x " + e.getKey())
            .collect(Collectors.joining(", "));
    }
}
