package io.github.yok.flexbackup.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexbackup.core.AtomicWriteException.Stage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFileWriterTest {

    @TempDir
    Path tempDir;

    private final AtomicFileWriter writer = new AtomicFileWriter();

    // -------------------------------------------------------------------------
    // write
    // -------------------------------------------------------------------------

    @Test
    void write_正常ケース_ファイルが存在しない_親ディレクトリごと作成されること() throws Exception {
        Path target = tempDir.resolve("nested/dir/out.jsonl");

        writer.write(target, bytes("{\"id\":1}\n"));

        assertEquals("{\"id\":1}\n", Files.readString(target));
        assertTrue(tempFiles(target.getParent()).isEmpty());
    }

    @Test
    void write_正常ケース_既存ファイルがある_内容が置き換わり一時ファイルが残らないこと() throws Exception {
        Path target = tempDir.resolve("out.jsonl");
        Files.writeString(target, "old content that is longer than the new one\n");

        writer.write(target, bytes("new\n"));

        assertEquals("new\n", Files.readString(target));
        assertTrue(tempFiles(tempDir).isEmpty());
    }

    @Test
    void write_正常ケース_空ペイロードを指定する_空ファイルが作成されること() throws Exception {
        Path target = tempDir.resolve("empty.jsonl");

        writer.write(target, new byte[0]);

        assertTrue(Files.exists(target));
        assertEquals(0L, Files.size(target));
    }

    @Test
    void write_異常ケース_ターゲットが空でないディレクトリである_RENAME段階で失敗し一時ファイルが残らないこと()
            throws Exception {
        Path target = tempDir.resolve("occupied");
        Files.createDirectory(target);
        Files.writeString(target.resolve("keep.txt"), "keep");

        AtomicWriteException ex =
                assertThrows(AtomicWriteException.class, () -> writer.write(target, bytes("x")));

        assertEquals(Stage.RENAME, ex.getStage());
        assertEquals(target, ex.getTarget());
        assertTrue(ex.getMessage().startsWith("failed to rename temp file for "));
        assertEquals("keep", Files.readString(target.resolve("keep.txt")));
        assertTrue(tempFiles(tempDir).isEmpty());
    }

    @Test
    void write_異常ケース_親パスが通常ファイルである_CREATE_DIRECTORY段階で失敗すること() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file");
        Path target = blocker.resolve("out.jsonl");

        AtomicWriteException ex =
                assertThrows(AtomicWriteException.class, () -> writer.write(target, bytes("x")));

        assertEquals(Stage.CREATE_DIRECTORY, ex.getStage());
        assertEquals("file", Files.readString(blocker));
    }

    // -------------------------------------------------------------------------
    // append
    // -------------------------------------------------------------------------

    @Test
    void append_正常ケース_既存ファイルがある_末尾に追記されること() throws Exception {
        Path target = tempDir.resolve("events.jsonl");
        Files.writeString(target, "{\"id\":1}\n");

        writer.append(target, bytes("{\"id\":2}\n"));

        assertEquals("{\"id\":1}\n{\"id\":2}\n", Files.readString(target));
    }

    @Test
    void append_正常ケース_ファイルが存在しない_新規作成されること() throws Exception {
        Path target = tempDir.resolve("events.jsonl");

        writer.append(target, bytes("{\"id\":1}\n"));

        assertArrayEquals(bytes("{\"id\":1}\n"), Files.readAllBytes(target));
        assertTrue(tempFiles(tempDir).isEmpty());
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static List<Path> tempFiles(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(
                    p -> p.getFileName().toString().startsWith(AtomicFileWriter.TEMP_PREFIX))
                    .collect(Collectors.toList());
        }
    }
}
