package com.chih.JQWeb.core.support;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TemplateDirectoryWatcher 测试")
class TemplateDirectoryWatcherTest {

    @TempDir
    Path tempDir;

    private final BlockingQueue<Set<Path>> batches = new LinkedBlockingQueue<>();

    private TemplateDirectoryWatcher watcher;

    private TemplateDirectoryWatcher start(Path directory) {
        watcher = new TemplateDirectoryWatcher(
                path -> TemplateParser.isSupportedFile(path.getFileName().toString()),
                batches::add, 300, null, null);
        assertThat(watcher.watch(directory)).isTrue();
        watcher.start();
        return watcher;
    }

    @AfterEach
    void tearDown() {
        if (watcher != null) {
            watcher.close();
        }
    }

    @Test
    @DisplayName("同一文件的连续写入合并为一次，非模板文件被忽略")
    void testBatchesAndFilters() throws Exception {
        start(tempDir);
        Path template = tempDir.resolve("page.xml");

        Files.writeString(template, "<t t-name=\"page\">1</t>");
        Files.writeString(template, "<t t-name=\"page\">2</t>");
        Files.writeString(tempDir.resolve("notes.txt"), "x");
        Files.writeString(tempDir.resolve(".hidden.xml"), "<t/>");
        Files.writeString(tempDir.resolve("page.xml~"), "<t/>");

        Set<Path> batch = batches.poll(10, TimeUnit.SECONDS);
        assertThat(batch).containsExactly(template.toAbsolutePath().normalize());
        assertThat(batches.poll(1, TimeUnit.SECONDS)).isNull();
    }

    @Test
    @DisplayName("删除模板文件同样回调")
    void testDeletion() throws Exception {
        Path template = Files.writeString(tempDir.resolve("gone.xml"), "<t t-name=\"gone\"/>");
        start(tempDir);

        Files.delete(template);

        Set<Path> batch = batches.poll(10, TimeUnit.SECONDS);
        assertThat(batch).containsExactly(template.toAbsolutePath().normalize());
        assertThat(Files.exists(template)).isFalse();
    }

    @Test
    @DisplayName("新建的子目录自动加入监听")
    void testNewSubdirectoryIsWatched() throws Exception {
        start(tempDir);
        Path sub = Files.createDirectory(tempDir.resolve("widgets"));

        long deadline = System.currentTimeMillis() + 10_000;
        while (!watcher.getDirectories().contains(sub.toAbsolutePath().normalize())
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(watcher.getDirectories()).contains(sub.toAbsolutePath().normalize());

        Path template = Files.writeString(sub.resolve("card.xml"), "<t t-name=\"card\"/>");

        Set<Path> batch = batches.poll(10, TimeUnit.SECONDS);
        assertThat(batch).contains(template.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("只接受尚未监听的目录")
    void testWatchRejectsFilesAndDuplicates() throws Exception {
        Path file = Files.writeString(tempDir.resolve("a.xml"), "<t/>");
        start(tempDir);

        assertThat(watcher.watch(tempDir)).isFalse();
        assertThat(watcher.watch(file)).isFalse();
        assertThat(watcher.getDirectories()).isEqualTo(Set.copyOf(List.of(tempDir.toAbsolutePath().normalize())));
        assertThat(watcher.isRunning()).isTrue();
    }
}
