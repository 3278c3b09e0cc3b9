/**
 * Attachment discovery under {@code attachments/} and {@code documents/} of an export.
 */
package io.github.yok.itgluemigrate.attachment;
