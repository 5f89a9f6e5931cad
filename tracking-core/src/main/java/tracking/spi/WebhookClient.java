package tracking.spi;

import tracking.automation.TransitionContext;
import tracking.model.AutomationAction;
import tracking.model.CanonicalStatus;

/**
 * Delivers {@link AutomationAction.Webhook} actions.
 *
 * @see tracking.automation.HttpWebhookClient
 */
@FunctionalInterface
public interface WebhookClient {

    void post(AutomationAction.Webhook action, String shipmentId, CanonicalStatus newStatus,
        TransitionContext context) throws Exception;
}
