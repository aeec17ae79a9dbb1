package io.github.yok.flexbackup.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import io.github.yok.flexbackup.model.BackupState;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads and writes {@code backup_state.json} in the backup directory.
 *
 * <p>
 * A missing file is the normal first-run condition and yields a zero state. The file is always
 * written through {@link AtomicFileWriter}, as 2-space indented JSON.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BackupStateStore {

    /**
     * File name of the state document.
     */
    public static final String STATE_FILE_NAME = "backup_state.json";

    private final AtomicFileWriter writer;

    private final List<String> entityNames;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Creates a store.
     *
     * @param writer atomic writer
     * @param entityNames entity names in catalog order; every loaded state carries a count for each
     */
    public BackupStateStore(AtomicFileWriter writer, List<String> entityNames) {
        this.writer = writer;
        this.entityNames = ImmutableList.copyOf(entityNames);
    }

    /**
     * Loads the state of a backup directory.
     *
     * @param dir backup directory
     * @return stored state, or a zero state when the file does not exist
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public BackupState load(Path dir) throws IOException {
        Path path = dir.resolve(STATE_FILE_NAME);
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            log.debug("No backup state at {}; starting from zero state", path);
            return BackupState.empty(entityNames);
        } catch (IOException e) {
            throw new IOException("failed to read backup state: " + e.getMessage(), e);
        }

        BackupState state;
        try {
            state = mapper.readValue(data, BackupState.class);
        } catch (IOException e) {
            throw new IOException("failed to parse backup state: " + e.getMessage(), e);
        }
        state.setCounts(withCatalogOrder(state.getCounts()));
        return state;
    }

    /**
     * Writes the state atomically. Must be the last step of a successful run.
     *
     * @param dir backup directory
     * @param state state to persist
     * @throws IOException if serialization or the atomic write fails
     */
    public void save(Path dir, BackupState state) throws IOException {
        byte[] json = mapper.writeValueAsBytes(state);
        writer.write(dir.resolve(STATE_FILE_NAME), Bytes.concat(json, new byte[] {'\n'}));
    }

    private Map<String, Long> withCatalogOrder(Map<String, Long> stored) {
        Map<String, Long> ordered = new LinkedHashMap<>();
        for (String name : entityNames) {
            ordered.put(name, stored.getOrDefault(name, 0L));
        }
        stored.forEach(ordered::putIfAbsent);
        return ordered;
    }
}
