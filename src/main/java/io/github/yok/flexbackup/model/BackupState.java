package io.github.yok.flexbackup.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

/**
 * Persisted progress of the backup directory ({@code backup_state.json}).
 *
 * <p>
 * {@code lastRevision} and {@code lastWatermark} only ever reflect runs that completed; a failed
 * run never writes this document. {@code counts} is informational.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"lastRevision", "lastWatermark", "timestamp", "counts"})
public class BackupState {

    // Store revision marker of the last completed export; empty means never exported
    @JsonAlias("last_dolt_commit")
    private String lastRevision = "";

    // Highest incremental-stream key exported so far; 0 means never exported
    @JsonAlias("last_event_id")
    private long lastWatermark;

    // Time of the last completed export (UTC)
    private Instant timestamp;

    // Last known row count per entity, in export catalog order
    private Map<String, Long> counts = new LinkedHashMap<>();

    /**
     * Returns a zero-valued state with a zero count registered for every entity name.
     *
     * @param entityNames entity names in catalog order
     * @return fresh state
     */
    public static BackupState empty(Iterable<String> entityNames) {
        BackupState state = new BackupState();
        for (String name : entityNames) {
            state.counts.put(name, 0L);
        }
        return state;
    }

    /**
     * Sets the revision marker; {@code null} is stored as empty.
     *
     * @param lastRevision revision marker
     */
    public void setLastRevision(String lastRevision) {
        this.lastRevision = StringUtils.defaultString(lastRevision);
    }

    /**
     * Replaces the count map, keeping insertion order.
     *
     * @param counts counts per entity; {@code null} clears the map
     */
    public void setCounts(Map<String, Long> counts) {
        this.counts = (counts == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(counts);
    }

    /**
     * Returns whether no export has ever completed for this directory.
     *
     * @return {@code true} when the revision marker is empty
     */
    @JsonIgnore
    public boolean isNeverExported() {
        return lastRevision.isEmpty();
    }

    /**
     * Returns the stored count for the entity.
     *
     * @param entity entity name
     * @return count, or 0 if unknown
     */
    public long getCount(String entity) {
        return counts.getOrDefault(entity, 0L);
    }

    /**
     * Overwrites the count of a full-snapshot entity.
     *
     * @param entity entity name
     * @param count row count of the latest snapshot
     */
    public void putCount(String entity, long count) {
        counts.put(entity, count);
    }

    /**
     * Adds newly exported rows to the count of an incremental entity.
     *
     * @param entity entity name
     * @param added rows appended in this run
     */
    public void addCount(String entity, long added) {
        counts.merge(entity, added, Long::sum);
    }

    /**
     * Returns a deep copy.
     *
     * @return copy of this state
     */
    public BackupState copy() {
        BackupState copy = new BackupState();
        copy.lastRevision = lastRevision;
        copy.lastWatermark = lastWatermark;
        copy.timestamp = timestamp;
        copy.counts = new LinkedHashMap<>(counts);
        return copy;
    }
}
