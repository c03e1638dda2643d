package com.agrisense.api;

import com.agrisense.advisory.AdvisoryReport;
import com.agrisense.advisory.AdvisoryService;
import com.agrisense.advisory.CropObservation;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * One-shot advisory endpoint for the input form.
 *
 * POST /v1/advisories
 *
 * Expected request body:
 * {
 *   "crop": { "name": "tomato", "stage": "flowering" },
 *   "soil": { "type": "loam", "moisture": "adequate", "ph": 6.3 },
 *   "lab": { "n": 30, "p": 40, "k": 45, "ph": 6.3 },
 *   "symptoms": ["leaf-spots", "powdery-white"],
 *   "weather": { "temperature": 22.0, "humidity": 85, "recent_rain_days": 5 },
 *   "pests": ["aphids"]
 * }
 */
@RestController
@RequestMapping("/v1/advisories")
public class AdvisoryController {

    private final AdvisoryService advisoryService;

    public AdvisoryController(AdvisoryService advisoryService) {
        this.advisoryService = advisoryService;
    }

    @PostMapping
    public AdvisoryReport advise(@RequestBody CropObservation observation) {
        return advisoryService.advise(observation);
    }
}
