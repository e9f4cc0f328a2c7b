package org.pragmatica.unionize.rewrite;

import org.junit.jupiter.api.Test;
import org.pragmatica.unionize.parser.PythonParser;
import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.rewrite.RewritePass.Outcome;
import org.pragmatica.unionize.shared.RewriteException;

import static org.assertj.core.api.Assertions.assertThat;

class UnionPatternVisitorTest {
    private final PythonParser parser = PythonParser.pythonParser();
    private final SubTransformer subTransformer = SubTransformer.subTransformer(parser);

    @Test
    void pass_recordsOneEditPerOutermostSite() throws RewriteException {
        var outcome = pass("x: Optional[int]\ny: Union[a, Optional[b]]\n");

        assertThat(outcome.edits()).isEqualTo(2);
        assertThat(outcome.text()).isEqualTo("x: int | None\ny: a | b | None\n");
        assertThat(outcome.retention()
                          .kinds()).isEmpty();
    }

    @Test
    void pass_countsImportEditsAlongsideSites() throws RewriteException {
        var outcome = pass("from typing import Optional, cast\nx: Optional[int]\n");

        assertThat(outcome.edits()).isEqualTo(2);
        assertThat(outcome.text()).isEqualTo("from typing import cast\nx: int | None\n");
    }

    @Test
    void pass_retainsKindOfSkippedSite() throws RewriteException {
        var outcome = pass("from typing import Optional\nx: Optional['A']\n");

        assertThat(outcome.edits()).isZero();
        assertThat(outcome.retention()
                          .isRetained(WrapperKind.NULLABLE)).isTrue();
    }

    @Test
    void pass_skipsStarredAndEmptyArguments() throws RewriteException {
        assertThat(pass("x = Union[*Ts]\n").edits()).isZero();
        assertThat(pass("x = Union[()]\n").edits()).isZero();
        assertThat(pass("x = Optional[int, str]\n").edits()).isZero();
        assertThat(pass("x = Optional[1:2]\n").edits()).isZero();
    }

    @Test
    void pass_leavesAssignmentTargetsAlone() throws RewriteException {
        assertThat(pass("Optional[int] = 1\n").edits()).isZero();
    }

    @Test
    void pass_recordsModuleThroughWhichSiteWasRewritten() throws RewriteException {
        var outcome = pass("import typing\nx: typing.Union[a, b]\n");

        assertThat(outcome.retention()
                          .wasRewrittenThrough("typing")).isTrue();
        assertThat(outcome.retention()
                          .isModuleRetained("typing")).isFalse();
        assertThat(outcome.text()).isEqualTo("x: a | b\n");
    }

    @Test
    void pass_parenthesizesOperandsOfTighterOperators() throws RewriteException {
        assertThat(pass("x = -Optional[int]\n").text()).isEqualTo("x = -(int | None)\n");
        assertThat(pass("x = a + Optional[b]\n").text()).isEqualTo("x = a + (b | None)\n");
        assertThat(pass("x = Optional[int](v)\n").text()).isEqualTo("x = (int | None)(v)\n");
        assertThat(pass("x = a | Optional[b]\n").text()).isEqualTo("x = a | b | None\n");
        assertThat(pass("x = -Union[int]\n").text()).isEqualTo("x = -int\n");
    }

    private Outcome pass(String source) throws RewriteException {
        return RewritePass.filePass(parser.parse(source, "t.py"),
                                    SourceText.sourceText(source),
                                    "t.py",
                                    RewriteConfig.defaultConfig(),
                                    subTransformer);
    }
}
