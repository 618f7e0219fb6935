/**
 * Values exchanged between the stages of a sync run: window, filters, candidates, the reconciliation plan and the
 * final summary.
 * <p>All types are immutable records or enums and live for a single run only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.domain.sync;
