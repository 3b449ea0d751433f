/**
 * Flat JSON codec used by token signing.
 */
package agentbroker.util;
