/**
 * Utility package.
 *
 * <p>
 * Stateless helpers shared across packages: fatal error reporting, text file decoding, and
 * display name formatting.
 * </p>
 */
package io.github.yok.itgluemigrate.util;
