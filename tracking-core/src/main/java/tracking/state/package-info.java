/**
 * Shipment status derivation: the pure fold ({@link tracking.state.StatusStateMachine}) and
 * the component that stores its result under a version check
 * ({@link tracking.state.StatusEngine}).
 */
package tracking.state;
