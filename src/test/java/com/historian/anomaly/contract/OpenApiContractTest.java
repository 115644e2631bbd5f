package com.historian.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so that endpoint paths and
 * response schemas do not drift unnoticed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> paths = json.read("$.paths");

        // Detection endpoints
        assertThat(paths).containsKey("/api/v1/analysis/anomalies");
        assertThat(paths).containsKey("/api/v1/analysis/advanced");
        assertThat(paths).containsKey("/api/v1/analysis/pattern-changes");
        assertThat(paths).containsKey("/api/v1/analysis/trend-changes");
        assertThat(paths).containsKey("/api/v1/analysis/deviation-analysis");
        assertThat(paths).containsKey("/api/v1/analysis/flag");

        // Statistics endpoints
        assertThat(paths).containsKey("/api/v1/analysis/statistics");
        assertThat(paths).containsKey("/api/v1/analysis/trend-line");
        assertThat(paths).containsKey("/api/v1/analysis/moving-average");
        assertThat(paths).containsKey("/api/v1/analysis/percentage-change");
        assertThat(paths).containsKey("/api/v1/analysis/data-quality");

        // Config endpoint
        assertThat(paths).containsKey("/api/v1/config/detection");
    }

    @Test
    void openApiSpec_containsResponseSchemas() {
        DocumentContext json = JsonPath.parse(restTemplate.getForObject("/v3/api-docs", String.class));
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKeys(
                "TimeSeriesPoint", "AnomalyRecord", "AnomalyReport", "AnomalySummary",
                "MethodResult", "StatisticalSummary", "BasicStatistics", "TrendLine", "DataQualityReport");

        Map<String, Object> recordProperties = json.read("$.components.schemas.AnomalyRecord.properties");
        assertThat(recordProperties).containsKeys(
                "timestamp", "value", "expectedValue", "deviation", "severity", "description");
    }
}
