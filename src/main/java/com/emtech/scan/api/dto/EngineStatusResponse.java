package com.emtech.scan.api.dto;

public record EngineStatusResponse(String id, boolean primary, boolean available) {
}
