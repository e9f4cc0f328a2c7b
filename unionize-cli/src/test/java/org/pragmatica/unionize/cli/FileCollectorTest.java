package org.pragmatica.unionize.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FileCollectorTest {
    @TempDir
    Path tempDir;

    @Test
    void collectPythonFiles_walksDirectoriesInSortedOrder() throws IOException {
        var b = touch("pkg/b.py");
        var a = touch("pkg/a.py");
        var nested = touch("pkg/sub/c.py");
        touch("pkg/notes.txt");

        var files = FileCollector.collectPythonFiles(List.of(tempDir), this::unexpected);

        assertThat(files).containsExactly(a, b, nested);
    }

    @Test
    void collectPythonFiles_skipsHiddenAndEnvironmentDirectories() throws IOException {
        var kept = touch("src/main.py");
        touch(".git/hooks/hook.py");
        touch("venv/lib/module.py");
        touch("src/__pycache__/main.py");
        touch("lib/site-packages/dep.py");

        var files = FileCollector.collectPythonFiles(List.of(tempDir), this::unexpected);

        assertThat(files).containsExactly(kept);
    }

    @Test
    void collectPythonFiles_acceptsExplicitFilesAsGiven() throws IOException {
        var script = touch("bin/tool");
        var hidden = touch(".hidden/setup.py");

        var files = FileCollector.collectPythonFiles(List.of(script, hidden), this::unexpected);

        assertThat(files).containsExactly(script, hidden);
    }

    @Test
    void collectPythonFiles_reportsMissingPaths() throws IOException {
        var existing = touch("a.py");
        var errors = new ArrayList<String>();

        var files = FileCollector.collectPythonFiles(List.of(tempDir.resolve("missing"), existing), errors::add);

        assertThat(files).containsExactly(existing);
        assertThat(errors).singleElement()
                          .asString()
                          .startsWith("No such file or directory: ");
    }

    private Path touch(String relative) throws IOException {
        var file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "");
    }

    private void unexpected(String error) {
        throw new AssertionError(error);
    }
}
