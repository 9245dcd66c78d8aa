package com.example.logoswap.service.detection;

import com.example.logoswap.TestImages;
import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Rect;
import com.example.logoswap.service.ReplacementConfig;
import com.example.logoswap.service.detection.CornerFallbackDetector.WindowSize;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CornerFallbackDetectorTest {

    private final CornerFallbackDetector detector = new CornerFallbackDetector();
    private final LogoTemplate oldLogo = TestImages.oldLogo();
    private final List<WindowSize> sizes =
            CornerFallbackDetector.sizesFor(oldLogo, ReplacementConfig.DEFAULT_CORNER_SCALES);

    @Test
    void derivesWindowSizesFromTemplate() {
        assertThat(sizes).containsExactly(
                new WindowSize(80, 60),
                new WindowSize(40, 30),
                new WindowSize(60, 45),
                new WindowSize(100, 75));
    }

    @Test
    void findsLogoFlushInBottomRightCorner() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(300, 200, 21L), 1.0, 220, 140);

        Optional<MatchResult> match = detector.scanCorners(image, oldLogo, sizes, 0.6);

        assertThat(match).isPresent();
        assertThat(match.get().rect()).isEqualTo(new Rect(220, 140, 80, 60));
        assertThat(match.get().similarity()).isGreaterThan(0.99);
    }

    @Test
    void findsReducedLogoInTopLeftCorner() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(300, 200, 22L), 0.75, 0, 0);

        Optional<MatchResult> match = detector.scanCorners(image, oldLogo, sizes, 0.6);

        assertThat(match).isPresent();
        assertThat(match.get().rect()).isEqualTo(new Rect(0, 0, 60, 45));
        assertThat(match.get().scale()).isEqualTo(0.75);
    }

    @Test
    void ignoresLogoAwayFromCorners() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(300, 200, 23L), 1.0, 110, 70);

        assertThat(detector.scanCorners(image, oldLogo, sizes, 0.6)).isEmpty();
    }

    @Test
    void returnsEmptyOnNoise() {
        RasterBuffer image = TestImages.noise(480, 360, 11L);

        assertThat(detector.scanCorners(image, oldLogo, sizes, ReplacementConfig.DEFAULT_CORNER_THRESHOLD)).isEmpty();
    }

    @Test
    void skipsWindowsLargerThanTheImage() {
        RasterBuffer image = TestImages.noise(30, 20, 24L);

        assertThat(detector.scanCorners(image, oldLogo, sizes, -1.0)).isEmpty();
    }

    @Test
    void requiresSimilarityAboveThreshold() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(300, 200, 25L), 1.0, 0, 140);

        assertThat(detector.scanCorners(image, oldLogo, sizes, 1.0)).isEmpty();
    }
}
