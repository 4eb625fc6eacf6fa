package com.solseq.core.generator;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GeneratorConfig}.
 */
class GeneratorConfigTest {

    @Test
    void defaults_usesDefaultPaletteAndTitle() {
        GeneratorConfig config = GeneratorConfig.defaults();

        assertThat(config.lightTheme()).isFalse();
        assertThat(config.title()).isEqualTo("Smart Contract Interaction Sequence Diagram");
        assertThat(config.palette()).isSameAs(ColorPalette.DEFAULT);
    }

    @Test
    void palette_lightTheme_returnsLightPreset() {
        assertThat(new GeneratorConfig(true, "x").palette()).isSameAs(ColorPalette.LIGHT);
    }

    @Test
    void constructor_blankTitle_fallsBackToDefault() {
        assertThat(new GeneratorConfig(false, null).title()).isEqualTo(GeneratorConfig.DEFAULT_TITLE);
        assertThat(new GeneratorConfig(false, "  ").title()).isEqualTo(GeneratorConfig.DEFAULT_TITLE);
    }

    @Test
    void presets_useDifferentColors() {
        ColorPalette dark = ColorPalette.DEFAULT;
        ColorPalette light = ColorPalette.LIGHT;

        assertThat(light.primaryColor()).isNotEqualTo(dark.primaryColor());
        assertThat(light.lineColor()).isNotEqualTo(dark.lineColor());
        assertThat(light.userSection()).isNotEqualTo(dark.userSection());
    }
}
