package tracking.spi;

import tracking.automation.TransitionContext;
import tracking.model.AutomationAction;
import tracking.model.CanonicalStatus;

/**
 * Delivers {@link AutomationAction.Notify} actions (e-mail, WhatsApp, SMS gateways).
 *
 * <p>Runs on a dispatcher worker under the configured action timeout. Throwing marks the
 * action as failed; the invocation will be retried.
 */
@FunctionalInterface
public interface NotificationSender {

    void send(AutomationAction.Notify action, String shipmentId, CanonicalStatus newStatus,
        TransitionContext context) throws Exception;
}
