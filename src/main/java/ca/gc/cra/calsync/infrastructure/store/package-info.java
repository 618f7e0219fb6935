/**
 * Adapters implementing {@link ca.gc.cra.calsync.application.port.CalendarStore}.
 */
package ca.gc.cra.calsync.infrastructure.store;
