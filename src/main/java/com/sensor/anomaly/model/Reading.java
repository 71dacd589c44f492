package com.sensor.anomaly.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "One raw observation of one sensor, as delivered by the time-series source")
public class Reading {

    @Schema(description = "Observation time, ISO-8601 string or epoch milliseconds; "
            + "unparseable values drop the reading", example = "2025-02-18T14:30:00Z")
    private Object timestamp;

    @JsonProperty("entity_id")
    @JsonAlias("entityId")
    @Schema(description = "Sensor identifier, domain prefix before the first dot", example = "sensor.living_room_temperature")
    private String entityId;

    @Schema(description = "Measured value, numeric or a numeric string", example = "21.5")
    private Object value;

    @Schema(description = "Raw state string reported by the sensor", example = "21.5")
    private String state;
}
