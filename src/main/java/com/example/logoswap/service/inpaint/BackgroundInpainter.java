package com.example.logoswap.service.inpaint;

import com.example.logoswap.image.RasterBuffer;
import com.example.logoswap.model.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Erases a rectangular region by filling it with the average color of a thin band sampled just
 * outside the region. No texture is synthesized, which is adequate for logos that sit on
 * near-uniform footers and corners.
 */
@Component
public class BackgroundInpainter {

    private static final Logger log = LoggerFactory.getLogger(BackgroundInpainter.class);

    public static final int DEFAULT_MARGIN_PX = 10;

    public RasterBuffer erase(RasterBuffer image, Rect region) {
        return erase(image, region, DEFAULT_MARGIN_PX);
    }

    /**
     * @return a copy of {@code image} with {@code region} (clipped to the image) filled; the input is not modified
     */
    public RasterBuffer erase(RasterBuffer image, Rect region, int marginPx) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(region, "region");
        if (marginPx < 0) {
            throw new IllegalArgumentException("Inpaint margin must not be negative");
        }

        int[] color = backgroundColor(image, region, marginPx);
        RasterBuffer result = image.copy();
        result.fill(region.x(), region.y(), region.width(), region.height(), color);
        log.debug("Filled region {} with color {}", region, Arrays.toString(color));
        return result;
    }

    int[] backgroundColor(RasterBuffer image, Rect region, int marginPx) {
        List<Band> bands = sampleBands(image, region, marginPx);
        int channels = image.channels();
        long[] sums = new long[channels];
        long count = 0;
        for (Band band : bands) {
            for (int y = band.top(); y < band.bottom(); y++) {
                for (int x = band.left(); x < band.right(); x++) {
                    for (int c = 0; c < channels; c++) {
                        sums[c] += image.sample(x, y, c);
                    }
                    count++;
                }
            }
        }
        int[] color = new int[channels];
        if (count == 0) {
            Arrays.fill(color, 255);
            return color;
        }
        for (int c = 0; c < channels; c++) {
            color[c] = (int) Math.round(sums[c] / (double) count);
        }
        return color;
    }

    private List<Band> sampleBands(RasterBuffer image, Rect region, int marginPx) {
        int width = image.width();
        int height = image.height();
        // extent of the region along each side, clipped to the image
        int spanLeft = Math.max(0, region.x());
        int spanRight = Math.min(width, region.right());
        int spanTop = Math.max(0, region.y());
        int spanBottom = Math.min(height, region.bottom());

        List<Band> bands = new ArrayList<>(4);
        addBand(bands, Math.max(0, region.x() - marginPx), Math.min(width, region.x()), spanTop, spanBottom);
        addBand(bands, Math.max(0, region.right()), Math.min(width, region.right() + marginPx), spanTop, spanBottom);
        addBand(bands, spanLeft, spanRight, Math.max(0, region.y() - marginPx), Math.min(height, region.y()));
        addBand(bands, spanLeft, spanRight, Math.max(0, region.bottom()), Math.min(height, region.bottom() + marginPx));
        return bands;
    }

    private static void addBand(List<Band> bands, int left, int right, int top, int bottom) {
        if (left < right && top < bottom) {
            bands.add(new Band(left, right, top, bottom));
        }
    }

    private record Band(int left, int right, int top, int bottom) {
    }
}
