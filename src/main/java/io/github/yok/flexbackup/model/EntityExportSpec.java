package io.github.yok.flexbackup.model;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Describes how one full-snapshot entity is exported.
 *
 * <p>
 * {@code primaryQuery} reads the live table. {@code shadowQuery}, when present, reads the legacy
 * table holding more rows of the same entity; both must project the same columns. Rows of the two
 * queries are interleaved by {@code orderKeys}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class EntityExportSpec {

    // Entity name used in counts and error messages (e.g. "issues")
    @NonNull
    String name;

    // Output file name inside the backup directory (e.g. "issues.jsonl")
    @NonNull
    String fileName;

    @NonNull
    String primaryQuery;

    // null when the entity has no shadow table
    String shadowQuery;

    @Singular
    List<String> orderKeys;

    /**
     * Returns whether a shadow query is defined.
     *
     * @return {@code true} if the entity has a shadow table
     */
    public boolean hasShadow() {
        return shadowQuery != null;
    }
}
