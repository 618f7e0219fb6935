/**
 * <strong>Purpose:</strong> Store-independent calendar model plus the pure functions of the sync engine: identity
 * derivation, fingerprinting and the {@code SOURCE_ID} tag codec.
 * <p><strong>Concurrency:</strong> Immutable values and stateless helpers; safe to share across threads.
 * <p><strong>Security:</strong> Titles and notes are user content; log them through
 * {@code ca.gc.cra.calsync.logging.Logs#truncate}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.domain.calendar;
