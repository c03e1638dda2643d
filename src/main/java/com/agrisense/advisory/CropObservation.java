package com.agrisense.advisory;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Farmer-supplied observations for one crop, as collected by the input form.
 * Every section except {@code crop} is optional.
 *
 * Symptom labels are case-insensitive, with spaces or underscores read as
 * hyphens. Recognized symptoms: leaf-spots, powdery-white, stem-lesions,
 * mosaic, wilting, yellowing ("leaf yellowing" and a few other common
 * spellings are accepted). Recognized pests: aphids, whiteflies, caterpillars.
 */
public record CropObservation(
    @JsonProperty("crop") Crop crop,
    @JsonProperty("soil") Soil soil,
    @JsonProperty("lab") Lab lab,
    @JsonProperty("symptoms") List<String> symptoms,
    @JsonProperty("weather") Weather weather,
    @JsonProperty("pests") List<String> pests
) {

    /** Stage is one of vegetative, flowering, fruiting. */
    public record Crop(
        @JsonProperty("name") String name,
        @JsonProperty("stage") String stage
    ) {}

    public record Soil(
        @JsonProperty("type") String type,
        @JsonProperty("moisture") String moisture,
        @JsonProperty("ph") Double ph
    ) {}

    /** Lab NPK readings in ppm. */
    public record Lab(
        @JsonProperty("n") Double n,
        @JsonProperty("p") Double p,
        @JsonProperty("k") Double k,
        @JsonProperty("ph") Double ph
    ) {}

    public record Weather(
        @JsonProperty("temperature") Double temperature,
        @JsonProperty("humidity") Double humidity,
        @JsonProperty("recent_rain_days") Integer recentRainDays
    ) {}
}
