/**
 * Event intake: exactly-once storage of normalized events, replay of payloads that
 * arrived before their shipment, and the review queue.
 */
package tracking.ingest;
