package com.example.logoswap.image;

import java.util.Objects;

/**
 * A logo graphic kept as an RGBA raster. Instances are immutable and may be shared between
 * threads; {@link #raster()} hands out copies.
 */
public final class LogoTemplate {

    private final String name;
    private final RasterBuffer rgba;

    private LogoTemplate(String name, RasterBuffer rgba) {
        this.name = name;
        this.rgba = rgba;
    }

    /**
     * Wraps a raster as a template. Gray and RGB rasters are promoted to RGBA with full opacity.
     */
    public static LogoTemplate of(String name, RasterBuffer raster) {
        Objects.requireNonNull(raster, "raster");
        return new LogoTemplate(name == null ? "logo" : name, RasterOps.toRgba(raster));
    }

    public String name() {
        return name;
    }

    public int width() {
        return rgba.width();
    }

    public int height() {
        return rgba.height();
    }

    public double aspectRatio() {
        return rgba.width() / (double) rgba.height();
    }

    public RasterBuffer raster() {
        return rgba.copy();
    }

    /**
     * Resized RGBA copy of the template.
     */
    public RasterBuffer resized(int targetWidth, int targetHeight) {
        return RasterOps.resize(rgba, targetWidth, targetHeight);
    }

    @Override
    public String toString() {
        return "LogoTemplate[" + name + ", " + width() + "x" + height() + "]";
    }
}
