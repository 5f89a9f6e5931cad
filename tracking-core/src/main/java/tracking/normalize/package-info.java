/**
 * Carrier payload normalization: per-source extraction, shipment resolution,
 * classification and dedup key derivation.
 *
 * @see tracking.normalize.EventNormalizer
 * @see tracking.normalize.PayloadExtractor
 */
package tracking.normalize;
