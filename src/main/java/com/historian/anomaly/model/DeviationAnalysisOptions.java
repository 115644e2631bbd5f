package com.historian.anomaly.model;

import com.historian.anomaly.exception.InvalidConfigurationException;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-method thresholds for statistical deviation analysis")
public class DeviationAnalysisOptions {

    @Builder.Default
    @Schema(description = "Z-score threshold", example = "2.5")
    private double zscoreThreshold = 2.5;

    @Builder.Default
    @Schema(description = "Modified z-score threshold (Iglewicz-Hoaglin recommend 3.5)", example = "3.5")
    private double modifiedZscoreThreshold = 3.5;

    @Builder.Default
    @Schema(description = "Minimum Grubbs statistic G, applied on top of the critical value", example = "1.0")
    private double grubbsThreshold = 1.0;

    @Builder.Default
    @Schema(description = "Two-sided significance level of the Grubbs test", example = "0.05")
    private double grubbsSignificance = 0.05;

    @Builder.Default
    @Schema(description = "IQR fence multiplier k", example = "1.5")
    private double iqrMultiplier = 1.5;

    public void validate() {
        InvalidConfigurationException.requirePositive("zscoreThreshold", zscoreThreshold);
        InvalidConfigurationException.requirePositive("modifiedZscoreThreshold", modifiedZscoreThreshold);
        InvalidConfigurationException.requirePositive("grubbsThreshold", grubbsThreshold);
        InvalidConfigurationException.requirePositive("iqrMultiplier", iqrMultiplier);
        if (!(grubbsSignificance > 0 && grubbsSignificance < 0.5)) {
            throw new InvalidConfigurationException("grubbsSignificance",
                    "grubbsSignificance must be in (0, 0.5), got " + grubbsSignificance);
        }
    }
}
