package work.lcod.pipeline.parameter;

import java.util.List;

public record Reconciliation(
    boolean updateRequired,
    boolean allValid,
    ReconcileDecision decision,
    List<ParameterDefinition> injected
) {
    public Reconciliation {
        injected = injected == null ? List.of() : List.copyOf(injected);
    }

    public boolean halted() {
        return decision == ReconcileDecision.HALT;
    }
}
