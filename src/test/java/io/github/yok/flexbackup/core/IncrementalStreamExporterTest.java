package io.github.yok.flexbackup.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexbackup.config.IncrementalWriteMode;
import io.github.yok.flexbackup.model.BackupState;
import io.github.yok.flexbackup.model.IncrementalStreamSpec;
import io.github.yok.flexbackup.store.ExportContext;
import io.github.yok.flexbackup.store.FakeBackupStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLDataException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IncrementalStreamExporterTest {

    private static final String PRIMARY = "SELECT id, kind FROM events WHERE id > ? ORDER BY id";
    private static final String SHADOW =
            "SELECT id, kind FROM wisp_events WHERE id > ? ORDER BY id";

    private static final IncrementalStreamSpec SPEC = IncrementalStreamSpec.builder()
            .name("events").fileName("events.jsonl").primaryQuery(PRIMARY).shadowQuery(SHADOW)
            .keyColumn("id").build();

    @TempDir
    Path tempDir;

    private final ExportContext ctx = ExportContext.background();

    private final List<List<Object>> primaryRows = new ArrayList<>();
    private final List<List<Object>> shadowRows = new ArrayList<>();

    private FakeBackupStore store;
    private TableExporter tableExporter;
    private AtomicFileWriter writer;

    @BeforeEach
    void setup() {
        store = new FakeBackupStore();
        store.rows(PRIMARY, ImmutableList.of("id", "kind"), args -> after(primaryRows, args));
        store.rows(SHADOW, ImmutableList.of("id", "kind"), args -> after(shadowRows, args));
        writer = new AtomicFileWriter();
        tableExporter = new TableExporter(store, new RowNormalizer(), writer);
    }

    @Test
    void export_正常ケース_初回と2回目_2回目は追記され既存行がバイト単位で保持されること() throws Exception {
        IncrementalStreamExporter exporter = exporter(IncrementalWriteMode.APPEND);
        BackupState state = new BackupState();
        addEvents(primaryRows, 1, 2, 3);

        assertEquals(3, exporter.export(ctx, SPEC, false, tempDir, state));
        assertEquals(3L, state.getLastWatermark());
        Path file = tempDir.resolve("events.jsonl");
        byte[] first = Files.readAllBytes(file);
        assertEquals(3, Files.readAllLines(file).size());

        addEvents(primaryRows, 4, 5);
        assertEquals(2, exporter.export(ctx, SPEC, false, tempDir, state));

        assertEquals(5L, state.getLastWatermark());
        byte[] second = Files.readAllBytes(file);
        assertArrayEquals(first, Arrays.copyOf(second, first.length));
        List<String> lines = Files.readAllLines(file);
        assertEquals(5, lines.size());
        assertEquals("{\"id\":5,\"kind\":\"e5\"}", lines.get(4));
    }

    @Test
    void export_正常ケース_新規行なし_ファイルもウォーターマークも変更されないこと() throws Exception {
        IncrementalStreamExporter exporter = exporter(IncrementalWriteMode.APPEND);
        BackupState state = new BackupState();
        state.setLastWatermark(7L);

        int rows = exporter.export(ctx, SPEC, true, tempDir, state);

        assertEquals(0, rows);
        assertEquals(7L, state.getLastWatermark());
        assertFalse(Files.exists(tempDir.resolve("events.jsonl")));
    }

    @Test
    void export_正常ケース_初回で0件である_ファイルが作成されないこと() throws Exception {
        BackupState state = new BackupState();

        assertEquals(0, exporter(IncrementalWriteMode.APPEND).export(ctx, SPEC, false, tempDir,
                state));

        assertEquals(0L, state.getLastWatermark());
        assertFalse(Files.exists(tempDir.resolve("events.jsonl")));
    }

    @Test
    void export_正常ケース_ウォーターマークが0である_既存ファイルが置き換えられること() throws Exception {
        Path file = tempDir.resolve("events.jsonl");
        Files.writeString(file, "{\"id\":1,\"kind\":\"stale\"}\n");
        addEvents(primaryRows, 1);

        exporter(IncrementalWriteMode.APPEND).export(ctx, SPEC, false, tempDir,
                new BackupState());

        assertEquals("{\"id\":1,\"kind\":\"e1\"}\n", Files.readString(file));
    }

    @Test
    void export_正常ケース_ATOMIC_REWRITEモード_既存内容の後に新規行が書かれること() throws Exception {
        IncrementalStreamExporter exporter = exporter(IncrementalWriteMode.ATOMIC_REWRITE);
        BackupState state = new BackupState();
        addEvents(primaryRows, 1, 2);
        exporter.export(ctx, SPEC, false, tempDir, state);
        addEvents(primaryRows, 3);

        exporter.export(ctx, SPEC, false, tempDir, state);

        assertEquals("{\"id\":1,\"kind\":\"e1\"}\n{\"id\":2,\"kind\":\"e2\"}\n"
                + "{\"id\":3,\"kind\":\"e3\"}\n",
                Files.readString(tempDir.resolve("events.jsonl")));
        assertEquals(3L, state.getLastWatermark());
    }

    @Test
    void export_正常ケース_シャドウあり_キー順に統合されウォーターマークが最大キーになること() throws Exception {
        addEvents(primaryRows, 1, 4);
        addEvents(shadowRows, 2, 9);
        BackupState state = new BackupState();

        int rows = exporter(IncrementalWriteMode.APPEND).export(ctx, SPEC, true, tempDir, state);

        assertEquals(4, rows);
        assertEquals(9L, state.getLastWatermark());
        List<String> ids = Files.readAllLines(tempDir.resolve("events.jsonl")).stream()
                .map(line -> line.substring(6, line.indexOf(','))).collect(Collectors.toList());
        assertEquals(ImmutableList.of("1", "2", "4", "9"), ids);
    }

    @Test
    void export_正常ケース_ウォーターマークがバインドされる_以前の行が再出力されないこと() throws Exception {
        addEvents(primaryRows, 1, 2, 3);
        BackupState state = new BackupState();
        state.setLastWatermark(2L);
        Files.writeString(tempDir.resolve("events.jsonl"), "x\n");

        int rows = exporter(IncrementalWriteMode.APPEND).export(ctx, SPEC, false, tempDir, state);

        assertEquals(1, rows);
        assertEquals("x\n{\"id\":3,\"kind\":\"e3\"}\n",
                Files.readString(tempDir.resolve("events.jsonl")));
    }

    @Test
    void export_異常ケース_キーが整数でない_SQLDataExceptionが送出され状態が変わらないこと() {
        primaryRows.add(Arrays.asList("abc", "bad"));
        BackupState state = new BackupState();

        SQLDataException ex = assertThrows(SQLDataException.class,
                () -> exporter(IncrementalWriteMode.APPEND).export(ctx, SPEC, false, tempDir,
                        state));

        assertTrue(ex.getMessage().contains("'id'"));
        assertEquals(0L, state.getLastWatermark());
        assertFalse(Files.exists(tempDir.resolve("events.jsonl")));
    }

    private IncrementalStreamExporter exporter(IncrementalWriteMode mode) {
        return new IncrementalStreamExporter(tableExporter, writer, mode);
    }

    private static void addEvents(List<List<Object>> target, long... ids) {
        for (long id : ids) {
            target.add(Arrays.asList(id, "e" + id));
        }
    }

    private static List<List<Object>> after(List<List<Object>> rows, Object[] args) {
        long watermark = ((Number) args[0]).longValue();
        return rows.stream()
                .filter(r -> !(r.get(0) instanceof Number)
                        || ((Number) r.get(0)).longValue() > watermark)
                .collect(Collectors.toList());
    }
}
