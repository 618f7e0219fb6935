package ca.gc.cra.calsync.domain.sync;

/**
 * How far a run proceeds through the pipeline.
 *
 * @since 0.1.0
 */
public enum SyncMode {
  /** Stop after identities are derived; the destination is never accessed. */
  LIST,
  /** Reconcile against the destination but apply nothing. */
  DRY_RUN,
  /** Reconcile and apply. */
  SYNC
}
