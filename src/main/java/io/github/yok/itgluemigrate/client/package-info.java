/**
 * BifrostDocs API client.
 */
package io.github.yok.itgluemigrate.client;
