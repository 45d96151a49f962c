package com.emtech.scan.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record ScanRequest(
        @Schema(description = "Original file name, used for display only", example = "whitepaper.pdf")
        String fileName,
        @Schema(description = "Base64 encoded PDF or image", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String contentBase64) {
}
