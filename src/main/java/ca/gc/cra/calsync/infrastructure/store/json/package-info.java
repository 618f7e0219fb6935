/**
 * File-backed calendar store holding every calendar in one JSON document, read and written with the jackson-core
 * streaming API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.calsync.infrastructure.store.json;
