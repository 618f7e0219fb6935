/**
 * Sync engine stages: event source, filter pipeline, reconciler, mutation applier and the orchestrating use case.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.application.sync;
