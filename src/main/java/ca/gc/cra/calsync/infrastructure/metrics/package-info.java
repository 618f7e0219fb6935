/**
 * OpenTelemetry-backed {@link ca.gc.cra.calsync.application.port.MetricsPort} implementation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.infrastructure.metrics;
