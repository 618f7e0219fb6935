/**
 * Time adapters implementing {@link ca.gc.cra.calsync.application.port.ClockPort}.
 */
package ca.gc.cra.calsync.infrastructure.time;
