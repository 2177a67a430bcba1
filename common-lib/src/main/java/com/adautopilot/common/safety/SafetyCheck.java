package com.adautopilot.common.safety;

import com.adautopilot.common.model.GuardedOperation;
import com.adautopilot.common.model.GuardrailVerdict;
import com.adautopilot.common.policy.GuardrailContext;
import com.adautopilot.common.policy.ProposedChange;

import java.util.EnumSet;
import java.util.Set;

/**
 * One link of the safety chain: the operations it applies to and the check itself.
 */
public record SafetyCheck(String name, Set<GuardedOperation> appliesTo, Check check) {

    @FunctionalInterface
    public interface Check {
        GuardrailVerdict evaluate(ProposedChange change, GuardrailContext context);
    }

    public static SafetyCheck always(String name, Check check) {
        return new SafetyCheck(name, EnumSet.allOf(GuardedOperation.class), check);
    }

    public static SafetyCheck only(String name, Set<GuardedOperation> operations, Check check) {
        return new SafetyCheck(name, EnumSet.copyOf(operations), check);
    }

    public boolean appliesTo(GuardedOperation operation) {
        return appliesTo.contains(operation);
    }
}
