package com.agrisense.advisory;

import com.agrisense.engine.Conclusion;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AdvisoryReport(
    @JsonProperty("crop") String crop,
    @JsonProperty("diagnoses") List<Conclusion> diagnoses,
    @JsonProperty("recommendations") List<Conclusion> recommendations,
    @JsonProperty("cycles") int cycles
) {}
