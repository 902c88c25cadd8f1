package com.pathtopology.engine.dto;

import com.pathtopology.engine.entity.AdministrativeLayer;

/**
 * Stretch of a segment lying inside one administrative polygon.
 *
 * @param eventId       boundary event recording the stretch
 * @param layer         administrative layer of the polygon
 * @param areaId        polygon id within its layer
 * @param startPosition where the stretch starts on the segment
 * @param endPosition   where it ends
 */
public record BoundaryCrossingRecord(
    Long eventId,
    AdministrativeLayer layer,
    String areaId,
    Double startPosition,
    Double endPosition
) {
}
