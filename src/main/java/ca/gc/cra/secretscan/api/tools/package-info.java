/**
 * Operator utilities that run without AWS access.
 */
package ca.gc.cra.secretscan.api.tools;
