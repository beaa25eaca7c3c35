package org.app.api.dto;

/** Caller-safe gain DTO (no dependency on the split package). */
public record AttributeGainView(String attribute, double gain) {
}
