/**
 * <strong>Purpose:</strong> Ports the sync engine depends on: calendar store, current account, metrics and clock.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters in {@code ca.gc.cra.calsync.infrastructure}
 * implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> A run uses its ports from a single thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.application.port;
