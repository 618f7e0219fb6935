/**
 * Adapters deciding which attendee of an event is the account the sync runs as.
 */
package ca.gc.cra.calsync.infrastructure.account;
