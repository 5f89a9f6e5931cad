/**
 * Retry and in-flight bookkeeping shared by the automation dispatcher, the unresolved
 * event replayer and the archival sink.
 */
package tracking.dispatch;
