/**
 * In-process calendar store.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.infrastructure.store.memory;
