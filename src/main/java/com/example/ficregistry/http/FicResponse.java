package com.example.ficregistry.http;

import com.example.ficregistry.models.ValidationReport;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record FicResponse(
        @JsonProperty("person") Map<String, String> person,
        @JsonProperty("validation") ValidationReport validation,
        @JsonProperty("generated_at") String generatedAt
) {}
