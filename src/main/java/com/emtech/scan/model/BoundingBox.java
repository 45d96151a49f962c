package com.emtech.scan.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned region of a recognized token inside a page bitmap. Coordinates follow the image
 * pixel grid with the origin located in the top-left corner.
 */
@Schema(description = "Axis-aligned rectangle describing where a token was recognized")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "42") int x,
        @Schema(description = "Y coordinate of the top-left corner", example = "128") int y,
        @Schema(description = "Width in pixels", example = "180") int width,
        @Schema(description = "Height in pixels", example = "60") int height) {

    public BoundingBox {
        if (width < 0) {
            throw new IllegalArgumentException("Bounding box width must not be negative");
        }
        if (height < 0) {
            throw new IllegalArgumentException("Bounding box height must not be negative");
        }
    }
}
