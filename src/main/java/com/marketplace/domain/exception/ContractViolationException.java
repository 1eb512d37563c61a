package com.marketplace.domain.exception;

import lombok.Getter;

import java.util.List;

/**
 * Payload rejected by its topic contract. Retrying will never make it valid, so the
 * runtime reports it to the caller instead of retrying or dead-lettering it.
 */
@Getter
public class ContractViolationException extends QueueRuntimeException {

    private final String contractKey;
    private final List<String> violations;

    public ContractViolationException(String contractKey, List<String> violations) {
        super("Payload violates contract " + contractKey + ": " + String.join("; ", violations));
        this.contractKey = contractKey;
        this.violations = List.copyOf(violations);
    }

    public ContractViolationException(String contractKey, List<String> violations, Throwable cause) {
        super("Payload violates contract " + contractKey + ": " + String.join("; ", violations), cause);
        this.contractKey = contractKey;
        this.violations = List.copyOf(violations);
    }
}
