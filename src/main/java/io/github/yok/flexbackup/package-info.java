/**
 * Root package of FlexBackup.
 *
 * <p>
 * Provides a CLI that backs up a MySQL-protocol store into a directory of JSON Lines files, one
 * file per entity, plus a small state document that makes repeated runs incremental.
 * </p>
 *
 * <p>
 * Main responsibilities are separated into the following subpackages:
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.flexbackup.config}: configuration models and directory resolution</li>
 * <li>{@code io.github.yok.flexbackup.core}: export workflow, atomic writes and state</li>
 * <li>{@code io.github.yok.flexbackup.model}: state document and entity descriptions</li>
 * <li>{@code io.github.yok.flexbackup.store}: store access abstraction and its JDBC
 * implementation</li>
 * </ul>
 */
package io.github.yok.flexbackup;
