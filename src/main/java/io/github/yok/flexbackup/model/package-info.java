/**
 * Persisted backup state and immutable export descriptions.
 */
package io.github.yok.flexbackup.model;
