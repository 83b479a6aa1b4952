package work.lcod.pipeline.parameter;

import java.util.List;
import java.util.Map;
import work.lcod.pipeline.diagnostics.DiagnosticSink;
import work.lcod.pipeline.runtime.ResolvedEnvironment;

/**
 * Makes sure every required parameter has a value for the current run, assigning one from
 * {@code on_empty.assign} when the declaration allows it. The environment is mutated in place.
 */
public final class RequiredParameterEnforcer {
    private final DiagnosticSink sink;

    public RequiredParameterEnforcer(DiagnosticSink sink) {
        this.sink = sink == null ? DiagnosticSink.NONE : sink;
    }

    public boolean enforce(List<Map<String, Object>> required, ResolvedEnvironment environment) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        sink.info("Checking that all required pipeline parameters was defined for current build.");
        var allSet = true;
        for (var item : required) {
            allSet = enforce(ParameterDeclaration.from(item), environment) && allSet;
        }
        return allSet;
    }

    boolean enforce(ParameterDeclaration declaration, ResolvedEnvironment environment) {
        if (declaration.hasValidName() && environment.isDefined(declaration.name())) {
            return true;
        }
        var policy = declaration.onEmpty().orElse(OnEmptyPolicy.DEFAULT);
        var assignMessage = "";
        if (declaration.hasValidName() && policy.hasAssignment()) {
            var assignment = policy.assignsFromVariable()
                ? environment.get(policy.referencedVariable())
                : policy.assign();
            if (assignment != null && !assignment.isBlank()) {
                environment.put(declaration.name(), assignment);
                sink.info(String.format("'%s' pipeline parameter was assigned from '%s'.", declaration.name(), policy.assign()));
                return true;
            }
            assignMessage = String.format("(can't be assigned with '%s' variable) ", policy.assign());
        }
        var message = String.format("'%s' pipeline parameter is required, but undefined %sfor current job run. Please specify then re-build again.",
            declaration.printableName(), assignMessage);
        if (policy.fail()) {
            sink.error(message);
            return false;
        }
        if (policy.warn()) {
            sink.warning(message);
        }
        return true;
    }
}
