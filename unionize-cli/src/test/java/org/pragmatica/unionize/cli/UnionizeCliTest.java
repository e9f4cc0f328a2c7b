package org.pragmatica.unionize.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class UnionizeCliTest {
    private static final String WRAPPED = "from typing import Optional\n\nx: Optional[int] = None\n";
    private static final String UNWRAPPED = "x: int | None = None\n";

    @TempDir
    Path tempDir;

    @Test
    void rewritesFilesInPlace() throws IOException {
        var file = write("pkg/module.py", WRAPPED);

        var exitCode = execute(tempDir.toString());

        assertThat(exitCode).isEqualTo(UnionizeCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo(UNWRAPPED);
    }

    @Test
    void checkModeReportsWithoutWriting() throws IOException {
        var file = write("module.py", WRAPPED);

        var exitCode = execute("--check", file.toString());

        assertThat(exitCode).isEqualTo(UnionizeCli.EXIT_WOULD_CHANGE);
        assertThat(Files.readString(file)).isEqualTo(WRAPPED);
    }

    @Test
    void checkModeSucceedsWhenNothingWouldChange() throws IOException {
        var file = write("module.py", UNWRAPPED);

        assertThat(execute("--check", file.toString())).isEqualTo(UnionizeCli.EXIT_OK);
    }

    @Test
    void invalidFileFailsRunButOthersAreStillRewritten() throws IOException {
        var broken = write("a_broken.py", "def f(:\n");
        var good = write("b_good.py", WRAPPED);

        var exitCode = execute(tempDir.toString());

        assertThat(exitCode).isEqualTo(UnionizeCli.EXIT_FAILURE);
        assertThat(Files.readString(broken)).isEqualTo("def f(:\n");
        assertThat(Files.readString(good)).isEqualTo(UNWRAPPED);
    }

    @Test
    void deeplyNestedFilesAreRewrittenOrSkipped() throws IOException {
        var deep = write("a_deep.py", "x: " + "Optional[List[".repeat(80) + "int" + "]]".repeat(80) + "\n");
        var tooDeep = write("b_too_deep.py", "x: " + "Optional[List[".repeat(101) + "int" + "]]".repeat(101) + "\n");
        var good = write("c_good.py", WRAPPED);

        var exitCode = execute(tempDir.toString());

        assertThat(exitCode).isEqualTo(UnionizeCli.EXIT_FAILURE);
        assertThat(Files.readString(deep)).isEqualTo("x: " + "List[".repeat(80) + "int" + "] | None".repeat(80) + "\n");
        assertThat(Files.readString(tooDeep)).startsWith("x: Optional[List[");
        assertThat(Files.readString(good)).isEqualTo(UNWRAPPED);
    }

    @Test
    void missingPathFailsRun() {
        assertThat(execute(tempDir.resolve("absent.py")
                                  .toString())).isEqualTo(UnionizeCli.EXIT_FAILURE);
    }

    @Test
    void keepImportsLeavesImportStatements() throws IOException {
        var file = write("module.py", WRAPPED);

        execute("--keep-imports", file.toString());

        assertThat(Files.readString(file)).isEqualTo("from typing import Optional\n\nx: int | None = None\n");
    }

    @Test
    void additionalModulesAreRecognized() throws IOException {
        var file = write("module.py", "from compat import Union\n\nx: Union[int, str]\n");

        execute("-m", "compat", file.toString());

        assertThat(Files.readString(file)).isEqualTo("x: int | str\n");
    }

    @Test
    void nonPositivePassLimitIsRejected() throws IOException {
        var file = write("module.py", WRAPPED);

        assertThat(execute("--max-passes", "0", file.toString())).isEqualTo(UnionizeCli.EXIT_FAILURE);
        assertThat(Files.readString(file)).isEqualTo(WRAPPED);
    }

    @Test
    void config_reflectsOptions() {
        var cli = new UnionizeCli();
        new CommandLine(cli).parseArgs("--keep-imports", "--max-passes", "5", "-m", "compat", "x.py");

        var config = cli.config();

        assertThat(config.pruneImports()).isFalse();
        assertThat(config.maxPasses()).isEqualTo(5);
        assertThat(config.isWrapperModule("compat")).isTrue();
        assertThat(config.isWrapperModule("typing")).isTrue();
    }

    private int execute(String... args) {
        return new CommandLine(new UnionizeCli()).execute(args);
    }

    private Path write(String relative, String content) throws IOException {
        var file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
