/**
 * Backup export workflow.
 *
 * <p>
 * {@link io.github.yok.flexbackup.core.BackupExporter} drives a run; table and stream exporters
 * produce the JSON Lines files and {@link io.github.yok.flexbackup.core.AtomicFileWriter}
 * guarantees that readers never see a half-written file.
 * </p>
 */
package io.github.yok.flexbackup.core;
