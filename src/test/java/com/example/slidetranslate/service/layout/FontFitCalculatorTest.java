package com.example.slidetranslate.service.layout;

import org.apache.poi.util.Units;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FontFitCalculatorTest {

    @Test
    void textThatFitsIsNotScaled() {
        // 2 lines x 20pt x 1.2 = 48pt in a 60pt box
        assertThat(FontFitCalculator.computeScale(2, 20, Units.toEMU(60))).isEqualTo(1.0);
    }

    @Test
    void overflowScalesBySquareRootWithSafetyMargin() {
        // 10 lines x 20pt x 1.2 = 240pt in a 60pt box
        double scale = FontFitCalculator.computeScale(10, 20, Units.toEMU(60));

        assertThat(scale).isCloseTo(Math.sqrt(0.25) * 0.95, within(1e-9));
    }

    @Test
    void missingGeometryMeansNoScaling() {
        assertThat(FontFitCalculator.computeScale(10, 20, 0)).isEqualTo(1.0);
        assertThat(FontFitCalculator.computeScale(10, 20, -5)).isEqualTo(1.0);
    }

    @Test
    void scaledSizeUsesNominalSizeAndFloor() {
        assertThat(FontFitCalculator.scaledSize(null, 0.5)).isEqualTo(9.0);
        assertThat(FontFitCalculator.scaledSize(24.0, 0.5)).isEqualTo(12.0);
        assertThat(FontFitCalculator.scaledSize(10.0, 0.1)).isEqualTo(6.0);
    }
}
