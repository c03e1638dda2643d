package com.agrisense.advisory;

import com.agrisense.engine.Conclusion;
import com.agrisense.session.SessionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the bundled knowledge base end to end through the advisory service.
 */
@SpringBootTest
class AdvisoryServiceTest {

    @Autowired AdvisoryService advisory;
    @Autowired SessionService sessions;

    @Test
    @DisplayName("flowering tomato with low NPK and powdery leaf spots")
    void floweringTomato() {
        CropObservation input = new CropObservation(
            new CropObservation.Crop("Tomato", "flowering"),
            new CropObservation.Soil("loam", "moist", 6.3),
            new CropObservation.Lab(30.0, 40.0, 45.0, null),
            List.of("leaf spots", "powdery_white"),
            new CropObservation.Weather(null, 85.0, null),
            List.of());

        int openBefore = sessions.activeSessions();
        AdvisoryReport report = advisory.advise(input);

        assertEquals("tomato", report.crop());
        assertEquals(8, report.cycles());

        assertEquals(1, report.diagnoses().size());
        assertEquals("Powdery Mildew", report.diagnoses().get(0).attributes().get("disease"));

        List<Object> categories = report.recommendations().stream()
            .map(c -> c.attributes().get("category"))
            .toList();
        assertEquals(List.of("treatment", "fertilizer", "fertilizer", "fertilizer", "stage-advice"), categories);
        assertEquals(List.of("nitrogen", "phosphorus", "potassium"), report.recommendations().subList(1, 4).stream()
            .map(c -> c.attributes().get("nutrient"))
            .toList());
        Conclusion stageAdvice = report.recommendations().get(4);
        assertEquals("flowering", stageAdvice.attributes().get("stage"));

        assertEquals(openBefore, sessions.activeSessions());
    }

    @Test
    @DisplayName("crop without any other data gets the insufficient-data advice")
    void insufficientData() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("maize", null), null, null, null, null, null));

        assertTrue(report.diagnoses().isEmpty());
        assertEquals(1, report.recommendations().size());
        assertEquals("general", report.recommendations().get(0).attributes().get("category"));
        assertEquals(1, report.cycles());
    }

    @Test
    @DisplayName("two vector pests produce one vector warning")
    void vectorPestsAreNotDuplicated() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("chili", "vegetative"), null, null, null, null,
            List.of("aphids", "whiteflies")));

        assertEquals(1, report.diagnoses().size());
        assertEquals(1, report.recommendations().size());
        assertEquals(2, report.cycles());
    }

    @Test
    @DisplayName("adequate lab values get the maintenance advice")
    void adequateNutrients() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("wheat", "vegetative"), null,
            new CropObservation.Lab(120.0, 90.0, 200.0, null), null, null, null));

        assertTrue(report.diagnoses().isEmpty());
        assertEquals(1, report.recommendations().size());
        assertEquals("fertilizer", report.recommendations().get(0).attributes().get("category"));
        assertNull(report.recommendations().get(0).attributes().get("nutrient"));
    }

    @Test
    @DisplayName("lab without all three NPK readings gets no adequate-levels advice")
    void partialLabIsNotAdequate() {
        for (CropObservation.Lab lab : List.of(
                new CropObservation.Lab(null, null, null, 6.3),
                new CropObservation.Lab(200.0, null, null, null))) {
            AdvisoryReport report = advisory.advise(new CropObservation(
                new CropObservation.Crop("tomato", "flowering"), null, lab, null, null, null));

            assertTrue(report.diagnoses().isEmpty());
            assertEquals(List.of("general"), categories(report.recommendations()), "lab " + lab);
        }
    }

    @Test
    @DisplayName("leaf spots and stem lesions in humid weather suggest blight")
    void blightInHumidWeather() {
        AdvisoryReport report = advisory.advise(blightInput(80.0));

        assertEquals(1, report.diagnoses().size());
        assertEquals("Blight-like infection (possible bacterial/fungal)",
            report.diagnoses().get(0).attributes().get("disease"));
        assertEquals(List.of("treatment"), categories(report.recommendations()));
    }

    @Test
    @DisplayName("humidity of exactly 75 does not suggest blight")
    void blightHumidityBoundary() {
        AdvisoryReport report = advisory.advise(blightInput(75.0));

        assertTrue(report.diagnoses().isEmpty());
        assertEquals(List.of("general"), categories(report.recommendations()));
    }

    @Test
    @DisplayName("mosaic pattern suggests a viral infection")
    void viralMosaic() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("chili", null), null, null, List.of("Mosaic"), null, null));

        assertEquals(1, report.diagnoses().size());
        assertEquals("Viral Mosaic", report.diagnoses().get(0).attributes().get("disease"));
        assertEquals("chili", report.diagnoses().get(0).attributes().get("crop"));
        assertEquals(List.of("treatment"), categories(report.recommendations()));
    }

    @Test
    @DisplayName("leaf yellowing with low lab nitrogen suggests nitrogen deficiency")
    void nitrogenDeficiencySymptom() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("tomato", null), null,
            new CropObservation.Lab(30.0, 80.0, 90.0, null),
            List.of("Leaf Yellowing"), null, null));

        assertEquals(1, report.diagnoses().size());
        assertEquals("Nutrient deficiency - Nitrogen", report.diagnoses().get(0).attributes().get("disease"));
        assertEquals(List.of("treatment", "fertilizer"), categories(report.recommendations()));
        assertEquals("nitrogen", report.recommendations().get(1).attributes().get("nutrient"));
    }

    @ParameterizedTest(name = "soil ph {0} -> {1}")
    @CsvSource({
        "5.4, soil-ph, acidic",
        "5.5, general, Insufficient",
        "7.8, general, Insufficient",
        "7.9, soil-ph, alkaline"
    })
    void soilPhAdvice(double ph, String category, String keyword) {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("maize", null),
            new CropObservation.Soil(null, null, ph), null, null, null, null));

        assertEquals(List.of(category), categories(report.recommendations()));
        String advice = (String) report.recommendations().get(0).attributes().get("advice");
        assertTrue(advice.contains(keyword), advice);
    }

    @Test
    @DisplayName("vegetative crop with low nitrogen gets stage advice")
    void vegetativeStageNitrogen() {
        AdvisoryReport report = advisory.advise(new CropObservation(
            new CropObservation.Crop("maize", "vegetative"), null,
            new CropObservation.Lab(30.0, 80.0, 90.0, null), null, null, null));

        assertTrue(report.diagnoses().isEmpty());
        assertEquals(List.of("fertilizer", "stage-advice"), categories(report.recommendations()));
        Map<String, Object> stageAdvice = report.recommendations().get(1).attributes();
        assertEquals("vegetative", stageAdvice.get("stage"));
        assertEquals("maize", stageAdvice.get("crop"));
    }

    private static CropObservation blightInput(double humidity) {
        return new CropObservation(
            new CropObservation.Crop("potato", null), null, null,
            List.of("leaf_spots", "stem lesions"),
            new CropObservation.Weather(18.0, humidity, 3), null);
    }

    private static List<Object> categories(List<Conclusion> recommendations) {
        return recommendations.stream().map(c -> c.attributes().get("category")).toList();
    }

    @Test
    @DisplayName("missing crop name is rejected before a session is opened")
    void missingCrop() {
        int openBefore = sessions.activeSessions();
        assertThrows(IllegalArgumentException.class, () -> advisory.advise(new CropObservation(
            new CropObservation.Crop(" ", null), null, null, List.of("mosaic"), null, null)));
        assertThrows(IllegalArgumentException.class, () -> advisory.advise(null));
        assertEquals(openBefore, sessions.activeSessions());
    }
}
