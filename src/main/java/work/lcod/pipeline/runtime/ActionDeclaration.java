package work.lcod.pipeline.runtime;

/**
 * One action of a stage after conversion. {@code action} is null when the item carries no usable
 * reference; message fields are null when absent.
 */
public record ActionDeclaration(
    int index,
    String action,
    NodeSelector node,
    String beforeMessage,
    String afterMessage,
    String successMessage,
    String failMessage,
    boolean ignoreFail,
    boolean stopOnFail
) {
    public ActionDeclaration {
        node = node == null ? NodeSelector.ANY : node;
    }
}
