package com.sensor.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sensorAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Sensor Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Explainable batch anomaly detection for timestamped sensor readings.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Submit a batch via `POST /anomalies/detect`\n" +
                                "2. Normalize readings (drop excluded states/domains, coerce values to numbers)\n" +
                                "3. Group by entity and compute statistics (entities below `minDataPoints` are skipped)\n" +
                                "4. Run all detection methods per entity in parallel\n" +
                                "5. Deduplicate by entity, type and clock hour, then rank by severity and recency\n\n" +
                                "**Detection Methods:**\n" +
                                "- `z-score`: values more than `zScoreThreshold` standard deviations from the mean\n" +
                                "- `iqr`: values outside the Tukey fences `q1 - k*iqr`, `q3 + k*iqr`\n" +
                                "- `missing-data`: gaps longer than 3x the average reporting interval\n" +
                                "- `pattern`: 10 or more identical consecutive values (stuck sensor)")
                        .contact(new Contact().name("Sensor Analytics Team")));
    }
}
