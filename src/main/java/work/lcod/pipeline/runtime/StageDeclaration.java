package work.lcod.pipeline.runtime;

import java.util.List;

public record StageDeclaration(int index, String name, boolean parallel, List<ActionDeclaration> actions) {
    public StageDeclaration {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Status key prefix: stage index and name with whitespace removed.
     */
    public String keyPrefix() {
        return index + "-" + name.replaceAll("\\s", "");
    }

    public String actionKey(int actionIndex) {
        return keyPrefix() + "[" + actionIndex + "]";
    }

    public String actionDisplayName(int actionIndex) {
        return name + " [" + actionIndex + "]";
    }
}
