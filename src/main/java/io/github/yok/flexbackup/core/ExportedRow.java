package io.github.yok.flexbackup.core;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One exported row: column label → normalized value, in result-set column order.
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class ExportedRow {

    private final Map<String, Object> values;

    ExportedRow(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the value of a column.
     *
     * @param column column label
     * @return normalized value, or {@code null} if absent or SQL NULL
     */
    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the ordered column → value view serialized as the JSON line.
     *
     * @return unmodifiable ordered map
     */
    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }
}
