package com.example.logoswap.config;

import com.example.logoswap.service.ReplacementConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "logo")
public class LogoProperties {

    private boolean enabled = true;
    private String oldLogoPath = "";
    private String newLogoPath = "";

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double acceptanceThreshold = ReplacementConfig.DEFAULT_ACCEPTANCE_THRESHOLD;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double cornerThreshold = ReplacementConfig.DEFAULT_CORNER_THRESHOLD;

    @NotEmpty
    private List<Double> scales = new ArrayList<>(ReplacementConfig.DEFAULT_SCALES);

    @NotEmpty
    private List<Double> cornerScales = new ArrayList<>(ReplacementConfig.DEFAULT_CORNER_SCALES);

    @Min(0)
    private int marginPx = ReplacementConfig.DEFAULT_MARGIN_PX;

    @Min(0)
    private int inpaintMarginPx = ReplacementConfig.DEFAULT_INPAINT_MARGIN_PX;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double maxLogoWidthFraction = ReplacementConfig.DEFAULT_MAX_LOGO_WIDTH_FRACTION;

    @Min(1)
    private int maxLogoWidthPx = ReplacementConfig.DEFAULT_MAX_LOGO_WIDTH_PX;

    public ReplacementConfig toReplacementConfig() {
        return new ReplacementConfig(acceptanceThreshold, cornerThreshold, scales, cornerScales,
                marginPx, inpaintMarginPx, maxLogoWidthFraction, maxLogoWidthPx);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOldLogoPath() {
        return oldLogoPath;
    }

    public void setOldLogoPath(String oldLogoPath) {
        this.oldLogoPath = oldLogoPath;
    }

    public String getNewLogoPath() {
        return newLogoPath;
    }

    public void setNewLogoPath(String newLogoPath) {
        this.newLogoPath = newLogoPath;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public void setAcceptanceThreshold(double acceptanceThreshold) {
        this.acceptanceThreshold = acceptanceThreshold;
    }

    public double getCornerThreshold() {
        return cornerThreshold;
    }

    public void setCornerThreshold(double cornerThreshold) {
        this.cornerThreshold = cornerThreshold;
    }

    public List<Double> getScales() {
        return scales;
    }

    public void setScales(List<Double> scales) {
        this.scales = scales;
    }

    public List<Double> getCornerScales() {
        return cornerScales;
    }

    public void setCornerScales(List<Double> cornerScales) {
        this.cornerScales = cornerScales;
    }

    public int getMarginPx() {
        return marginPx;
    }

    public void setMarginPx(int marginPx) {
        this.marginPx = marginPx;
    }

    public int getInpaintMarginPx() {
        return inpaintMarginPx;
    }

    public void setInpaintMarginPx(int inpaintMarginPx) {
        this.inpaintMarginPx = inpaintMarginPx;
    }

    public double getMaxLogoWidthFraction() {
        return maxLogoWidthFraction;
    }

    public void setMaxLogoWidthFraction(double maxLogoWidthFraction) {
        this.maxLogoWidthFraction = maxLogoWidthFraction;
    }

    public int getMaxLogoWidthPx() {
        return maxLogoWidthPx;
    }

    public void setMaxLogoWidthPx(int maxLogoWidthPx) {
        this.maxLogoWidthPx = maxLogoWidthPx;
    }
}
