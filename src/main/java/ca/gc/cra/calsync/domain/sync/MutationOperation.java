package ca.gc.cra.calsync.domain.sync;

/**
 * Kind of destination mutation.
 *
 * @since 0.1.0
 */
public enum MutationOperation {
  CREATE,
  UPDATE,
  DELETE
}
