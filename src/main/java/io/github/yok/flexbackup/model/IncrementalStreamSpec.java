package io.github.yok.flexbackup.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Describes the append-only stream exported by watermark.
 *
 * <p>
 * Both queries take the current watermark as their single bind parameter and must select only rows
 * whose {@code keyColumn} is greater than it. {@code keyColumn} holds a monotonically increasing
 * integer.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class IncrementalStreamSpec {

    @NonNull
    String name;

    @NonNull
    String fileName;

    @NonNull
    String primaryQuery;

    // null when the stream has no shadow table
    String shadowQuery;

    @NonNull
    String keyColumn;

    /**
     * Returns whether a shadow query is defined.
     *
     * @return {@code true} if the stream has a shadow table
     */
    public boolean hasShadow() {
        return shadowQuery != null;
    }
}
