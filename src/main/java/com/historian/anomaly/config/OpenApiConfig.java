package com.historian.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI historianAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Historian Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Statistical anomaly detection for process historian time series.\n\n" +
                                "**Request shape:** `{ \"points\": [...], \"options\": {...} }`; omitted options " +
                                "fall back to the defaults under `/api/v1/config/detection`.\n\n" +
                                "**Point detectors:**\n" +
                                "- `zscore` - distance from the mean in standard deviations\n" +
                                "- `modified-zscore` - median/MAD based, robust to the outliers themselves\n" +
                                "- `grubbs` - single most extreme value against the t-derived critical value\n" +
                                "- `dixon` - gap ratio at either extreme (3 to 30 samples)\n" +
                                "- `iqr` - Tukey fences at k times the interquartile range\n\n" +
                                "**Window detectors:** pattern change (level shifts between adjacent windows) and " +
                                "trend change (slope and volatility shifts).\n\n" +
                                "**Flagging** (`POST /api/v1/analysis/flag`) runs every enabled detector that has " +
                                "enough data and reports severity counts (low / medium / high).")
                        .contact(new Contact().name("Historian Analytics Team")));
    }
}
