/**
 * Document content processing.
 *
 * <p>
 * Cleans exported document HTML, uploads its local images once per run, rewrites image sources to
 * the destination URLs, and uploads entity attachments on a bounded pool.
 * </p>
 */
package io.github.yok.itgluemigrate.document;
