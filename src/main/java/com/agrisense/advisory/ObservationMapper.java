package com.agrisense.advisory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Flattens a {@link CropObservation} into the facts the bundled knowledge base
 * reasons over: {@code crop}, {@code soil}, {@code lab}, {@code weather}, one
 * {@code symptom} per reported symptom and one {@code pest} per reported pest.
 * Absent values are left out of the fact rather than asserted as null.
 */
class ObservationMapper {

    static final String CROP = "crop";
    static final String SOIL = "soil";
    static final String LAB = "lab";
    static final String SYMPTOM = "symptom";
    static final String WEATHER = "weather";
    static final String PEST = "pest";

    // the knowledge base matches leaf-spots, powdery-white, stem-lesions, mosaic, wilting and yellowing
    private static final Map<String, String> SYMPTOM_SYNONYMS = Map.of(
        "leaf-yellowing", "yellowing",
        "yellow-leaves", "yellowing",
        "leaf-spot", "leaf-spots",
        "powdery-mildew", "powdery-white",
        "stem-lesion", "stem-lesions",
        "mosaic-pattern", "mosaic",
        "wilt", "wilting");

    record Observation(String kind, Map<String, Object> attributes) {}

    List<Observation> toObservations(CropObservation input) {
        if (input == null) {
            throw new IllegalArgumentException("observation is required");
        }
        if (input.crop() == null || input.crop().name() == null || input.crop().name().isBlank()) {
            throw new IllegalArgumentException("crop.name is required");
        }
        String cropName = cropName(input);

        List<Observation> observations = new ArrayList<>();
        Map<String, Object> crop = new LinkedHashMap<>();
        crop.put("name", cropName);
        putIfPresent(crop, "stage", normalizeLabel(input.crop().stage()));
        observations.add(new Observation(CROP, crop));

        if (input.soil() != null) {
            Map<String, Object> soil = new LinkedHashMap<>();
            putIfPresent(soil, "type", normalizeLabel(input.soil().type()));
            putIfPresent(soil, "moisture", normalizeLabel(input.soil().moisture()));
            putIfPresent(soil, "ph", input.soil().ph());
            addIfNotEmpty(observations, SOIL, soil);
        }
        if (input.lab() != null) {
            Map<String, Object> lab = new LinkedHashMap<>();
            putIfPresent(lab, "n", input.lab().n());
            putIfPresent(lab, "p", input.lab().p());
            putIfPresent(lab, "k", input.lab().k());
            putIfPresent(lab, "ph", input.lab().ph());
            addIfNotEmpty(observations, LAB, lab);
        }
        if (input.weather() != null) {
            Map<String, Object> weather = new LinkedHashMap<>();
            putIfPresent(weather, "temperature", input.weather().temperature());
            putIfPresent(weather, "humidity", input.weather().humidity());
            putIfPresent(weather, "recent_rain_days", input.weather().recentRainDays());
            addIfNotEmpty(observations, WEATHER, weather);
        }
        for (String symptom : distinctLabels(input.symptoms(), SYMPTOM_SYNONYMS)) {
            observations.add(new Observation(SYMPTOM, Map.of("crop", cropName, "symptom", symptom)));
        }
        for (String pest : distinctLabels(input.pests(), Map.of())) {
            observations.add(new Observation(PEST, Map.of("crop", cropName, "pest", pest)));
        }
        return observations;
    }

    static String cropName(CropObservation input) {
        return input.crop().name().trim().toLowerCase();
    }

    private static LinkedHashSet<String> distinctLabels(List<String> labels, Map<String, String> synonyms) {
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        if (labels != null) {
            for (String label : labels) {
                String normalized = normalizeLabel(label);
                if (normalized != null) {
                    distinct.add(synonyms.getOrDefault(normalized, normalized));
                }
            }
        }
        return distinct;
    }

    // "Leaf Spots" and "leaf_spots" both become "leaf-spots"
    private static String normalizeLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return raw.trim().toLowerCase().replaceAll("[\\s_]+", "-");
    }

    private static void putIfPresent(Map<String, Object> attributes, String name, Object value) {
        if (value != null) {
            attributes.put(name, value);
        }
    }

    private static void addIfNotEmpty(List<Observation> observations, String kind, Map<String, Object> attributes) {
        if (!attributes.isEmpty()) {
            observations.add(new Observation(kind, attributes));
        }
    }
}
