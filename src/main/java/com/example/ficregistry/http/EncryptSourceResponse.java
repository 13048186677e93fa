package com.example.ficregistry.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EncryptSourceResponse(
        @JsonProperty("cells_encrypted") int cellsEncrypted
) {}
