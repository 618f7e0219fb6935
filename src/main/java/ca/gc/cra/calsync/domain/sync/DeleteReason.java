package ca.gc.cra.calsync.domain.sync;

/**
 * Why a tracked event was scheduled for deletion.
 *
 * @since 0.1.0
 */
public enum DeleteReason {
  /** No candidate carries the identity any more. */
  ORPHANED,
  /** Another tracked event with the same identity was encountered first. */
  DUPLICATE,
  /** Force recreate was requested. */
  RECREATE
}
