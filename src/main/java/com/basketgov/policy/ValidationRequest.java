package com.basketgov.policy;

import com.basketgov.contract.Operation;

import java.util.List;

public record ValidationRequest(
    String basketId,
    String workspaceId,
    String proposalKind,
    List<Operation> operations
) {
}
