/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and shorten calendar text before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.logging;
