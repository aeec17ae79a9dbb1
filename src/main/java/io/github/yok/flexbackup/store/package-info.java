/**
 * Read access to the store being backed up.
 *
 * <p>
 * {@link io.github.yok.flexbackup.store.BackupStore} is the only seam between the export workflow
 * and JDBC, so the workflow can be tested against in-memory rows.
 * </p>
 */
package io.github.yok.flexbackup.store;
