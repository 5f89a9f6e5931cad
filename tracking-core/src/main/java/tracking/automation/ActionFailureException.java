package tracking.automation;

import tracking.model.ActionKind;

/**
 * A single automation action failed or timed out.
 *
 * <p>Caught by the dispatcher, which carries on with the remaining actions of the rule and
 * schedules the whole invocation for retry.
 */
public class ActionFailureException extends RuntimeException {

    private final ActionKind kind;

    public ActionFailureException(ActionKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionFailureException(ActionKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ActionKind kind() {
        return kind;
    }
}
