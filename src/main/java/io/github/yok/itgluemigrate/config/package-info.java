/**
 * Configuration model package.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml}: destination API
 * connection settings and migration run defaults. Command-line options override them.
 * </p>
 */
package io.github.yok.itgluemigrate.config;
