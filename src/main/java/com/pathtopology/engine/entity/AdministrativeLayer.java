package com.pathtopology.engine.entity;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

/**
 * Administrative polygon layers the auto-linker crosses segments against,
 * with the event kind and origin tag their boundary events carry.
 */
@Getter
@RequiredArgsConstructor
public enum AdministrativeLayer {
    CITY("CITYEDGE", EventOrigin.CITY_EDGE),
    DISTRICT("DISTRICTEDGE", EventOrigin.DISTRICT_EDGE),
    RESTRICTED_AREA("RESTRICTEDAREAEDGE", EventOrigin.RESTRICTED_AREA_EDGE);

    private final String eventKind;
    private final EventOrigin origin;

    public static AdministrativeLayer fromOrigin(EventOrigin origin) {
        return Arrays.stream(values())
            .filter(layer -> layer.origin == origin)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No layer for origin " + origin));
    }

    public static boolean isSystemKind(String kind) {
        return Arrays.stream(values()).anyMatch(layer -> layer.eventKind.equalsIgnoreCase(kind));
    }
}
