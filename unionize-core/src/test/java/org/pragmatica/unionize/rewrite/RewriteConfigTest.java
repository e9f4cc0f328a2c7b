package org.pragmatica.unionize.rewrite;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RewriteConfigTest {
    @Test
    void defaultConfig_coversTypingModules() {
        var config = RewriteConfig.defaultConfig();

        assertThat(config.wrapperModules()).containsExactlyInAnyOrder("typing", "typing_extensions");
        assertThat(config.pruneImports()).isTrue();
        assertThat(config.maxPasses()).isEqualTo(RewriteConfig.DEFAULT_MAX_PASSES);
    }

    @Test
    void withers_leaveOriginalUntouched() {
        var config = RewriteConfig.defaultConfig()
                                  .withWrapperModule("compat")
                                  .withPruneImports(false)
                                  .withMaxPasses(3);

        assertThat(config.isWrapperModule("compat")).isTrue();
        assertThat(config.pruneImports()).isFalse();
        assertThat(config.maxPasses()).isEqualTo(3);
        assertThat(RewriteConfig.defaultConfig()
                                .isWrapperModule("compat")).isFalse();
    }

    @Test
    void maxPasses_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> RewriteConfig.defaultConfig()
                                                                        .withMaxPasses(0));
    }
}
