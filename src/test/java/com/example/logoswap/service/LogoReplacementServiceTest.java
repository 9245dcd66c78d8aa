package com.example.logoswap.service;

import com.example.logoswap.TestImages;
import com.example.logoswap.image.LogoTemplate;
import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.image.RasterOps;
import com.example.logoswap.model.MatchResult;
import com.example.logoswap.model.Placement;
import com.example.logoswap.model.Rect;
import com.example.logoswap.model.ReplacementOutcome;
import com.example.logoswap.service.detection.CornerFallbackDetector;
import com.example.logoswap.service.detection.MultiScaleTemplateMatcher;
import com.example.logoswap.service.inpaint.BackgroundInpainter;
import com.example.logoswap.service.placement.PlacementScorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

class LogoReplacementServiceTest {

    private final LogoTemplate oldLogo = TestImages.oldLogo();
    private final LogoTemplate newLogo = TestImages.newLogo();

    private RecordingListener listener;
    private LogoReplacementService service;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        service = new LogoReplacementService(
                new MultiScaleTemplateMatcher(),
                new CornerFallbackDetector(),
                new BackgroundInpainter(),
                new PlacementScorer(),
                listener);
    }

    @Test
    void replacesDetectedLogo() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 41L), 1.0, 200, 150);
        RasterBuffer original = image.copy();

        ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(outcome.replaced()).isTrue();
        assertThat(outcome.occurrences()).hasSize(1);
        assertThat(outcome.occurrences().get(0).rect()).isEqualTo(new Rect(200, 150, 80, 60));
        assertThat(image).isEqualTo(original);
        assertThat(listener.transitions).containsExactly(
                ReplacementState.SEARCHING,
                ReplacementState.FOUND,
                ReplacementState.ERASING,
                ReplacementState.PLACING,
                ReplacementState.COMPOSITING,
                ReplacementState.DONE);
    }

    @Test
    void erasesOldLogoWithFlatFill() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 42L), 1.0, 200, 150);

        RasterBuffer modified = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults()).modified();

        int[] fill = modified.pixel(200, 150);
        for (int y = 150; y < 210; y++) {
            for (int x = 200; x < 280; x++) {
                assertThat(modified.pixel(x, y)).containsExactly(fill);
            }
        }
    }

    @Test
    void compositesNewLogoAtChosenSiteWithPreservedAspectRatio() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 43L), 1.0, 200, 150);

        RasterBuffer modified = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults()).modified();

        assertThat(listener.logoWidth).isEqualTo(60);
        assertThat(listener.logoHeight).isEqualTo(30);
        Placement placement = listener.placement;
        assertThat(placement.isFallback()).isFalse();
        RasterBuffer placed = modified.crop(placement.x(), placement.y(), 60, 30);
        assertThat(placed).isEqualTo(RasterOps.toRgb(newLogo.raster()));
        assertThat(new Rect(placement.x(), placement.y(), 60, 30).intersects(new Rect(200, 150, 80, 60))).isFalse();
    }

    @Test
    void capsNewLogoWidthAtConfiguredPixels() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(1800, 600, 44L), 1.0, 900, 300);

        ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(outcome.replaced()).isTrue();
        assertThat(listener.logoWidth).isEqualTo(200);
        assertThat(listener.logoHeight).isEqualTo(100);
    }

    @Test
    void reportsNotFoundForImageWithoutLogo() {
        RasterBuffer image = TestImages.noise(480, 360, 45L);

        ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(outcome.replaced()).isFalse();
        assertThat(outcome.occurrences()).isEmpty();
        assertThat(outcome.modified()).isEqualTo(image);
        assertThat(listener.cornerFallbackRan).isTrue();
        assertThat(listener.transitions).containsExactly(ReplacementState.SEARCHING, ReplacementState.NOT_FOUND);
    }

    @Test
    void doesNotFindOldLogoAgainInItsOwnOutput() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 46L), 1.0, 200, 150);

        ReplacementOutcome first = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());
        ReplacementOutcome second = service.replaceLogo(first.modified(), oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(first.replaced()).isTrue();
        assertThat(second.replaced()).isFalse();
    }

    @Test
    void fallsBackToCornerScanWhenSearchIsNotAccepted() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 47L), 1.0, 400, 300);
        ReplacementConfig config = ReplacementConfig.defaults().withAcceptanceThreshold(1.5);

        ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, config);

        assertThat(listener.cornerFallbackRan).isTrue();
        assertThat(outcome.replaced()).isTrue();
        assertThat(outcome.occurrences()).extracting(MatchResult::rect).containsExactly(new Rect(400, 300, 80, 60));
    }

    @Test
    void cornerThresholdGatesFallbackHit() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 50L), 1.0, 400, 300);
        ReplacementConfig config = ReplacementConfig.defaults()
                .withAcceptanceThreshold(1.5)
                .withCornerThreshold(1.5);

        ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, config);

        assertThat(listener.cornerFallbackRan).isTrue();
        assertThat(outcome.replaced()).isFalse();
        assertThat(listener.transitions).containsExactly(ReplacementState.SEARCHING, ReplacementState.NOT_FOUND);
    }

    @Test
    void reportsNotFoundOnUniformBackgrounds() {
        for (int gray : new int[]{0, 37, 128, 200, 255}) {
            RasterBuffer image = RasterBuffer.filled(480, 360, gray, gray, gray);

            ReplacementOutcome outcome = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());

            assertThat(outcome.replaced()).as("gray %d", gray).isFalse();
            assertThat(outcome.modified()).isEqualTo(image);
        }
    }

    @Test
    void doesNotFindOldLogoAgainOnUniformBackground() {
        RasterBuffer image = TestImages.withOldLogo(RasterBuffer.filled(480, 360, 200, 200, 200), 1.0, 200, 150);

        ReplacementOutcome first = service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());
        ReplacementOutcome second = service.replaceLogo(first.modified(), oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(first.replaced()).isTrue();
        assertThat(first.occurrences()).extracting(MatchResult::rect).containsExactly(new Rect(200, 150, 80, 60));
        assertThat(first.modified().pixel(240, 180)).containsExactly(200, 200, 200);
        assertThat(second.replaced()).isFalse();
    }

    @Test
    void skipsCornerScanWhenSearchIsAccepted() {
        RasterBuffer image = TestImages.withOldLogo(TestImages.noise(480, 360, 48L), 1.0, 200, 150);

        service.replaceLogo(image, oldLogo, newLogo, ReplacementConfig.defaults());

        assertThat(listener.cornerFallbackRan).isFalse();
    }

    @Test
    void rejectsMissingArguments() {
        RasterBuffer image = TestImages.noise(100, 100, 49L);

        assertThatNullPointerException()
                .isThrownBy(() -> service.replaceLogo(null, oldLogo, newLogo, ReplacementConfig.defaults()));
        assertThatNullPointerException()
                .isThrownBy(() -> service.replaceLogo(image, oldLogo, null, ReplacementConfig.defaults()));
        assertThatNullPointerException()
                .isThrownBy(() -> service.replaceLogo(image, oldLogo, newLogo, null));
    }

    private static final class RecordingListener implements ReplacementListener {
        private final List<ReplacementState> transitions = new ArrayList<>();
        private boolean cornerFallbackRan;
        private Placement placement;
        private int logoWidth;
        private int logoHeight;

        @Override
        public void onStateChange(ReplacementState from, ReplacementState to) {
            transitions.add(to);
        }

        @Override
        public void onCornerFallback(Optional<MatchResult> cornerMatch) {
            cornerFallbackRan = true;
        }

        @Override
        public void onLogoPlaced(MatchResult occurrence, Placement placement, int logoWidth, int logoHeight) {
            this.placement = placement;
            this.logoWidth = logoWidth;
            this.logoHeight = logoHeight;
        }
    }
}
