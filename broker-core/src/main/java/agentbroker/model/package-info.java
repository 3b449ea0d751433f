/**
 * Delivery-state model shared by the broker and its stores.
 *
 * @see agentbroker.model.DeliveryState
 * @see agentbroker.model.StoredMessage
 * @see agentbroker.model.FailureOutcome
 */
package agentbroker.model;
