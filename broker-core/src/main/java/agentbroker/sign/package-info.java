/**
 * Message signing implementations.
 *
 * @see agentbroker.sign.HmacMessageSigner
 */
package agentbroker.sign;
