/**
 * Configuration model package for FlexBackup.
 *
 * <p>
 * Defines classes that represent values loaded from {@code application.yml} (or equivalent
 * sources), such as connection settings and backup settings, and resolves the backup directory
 * from them.
 * </p>
 */
package io.github.yok.flexbackup.config;
