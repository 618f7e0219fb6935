/**
 * Core domain model for CALSYNC fetch → filter → identify → reconcile → apply runs.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package ca.gc.cra.calsync.domain;
