/**
 * Automation: rules, the actions they run, and the asynchronous dispatch of claimed
 * invocations.
 *
 * <p>A committed status transition claims one {@link tracking.model.AutomationInvocation}
 * per matching rule. {@link tracking.automation.AutomationDispatcher} executes claims from a
 * hot queue (fed right after commit) and a cold queue (fed by
 * {@link tracking.automation.InvocationPoller}).
 */
package tracking.automation;
