/**
 * Utilities for error reporting and log formatting.
 */
package io.github.yok.flexbackup.util;
