package com.pathtopology.engine.service.boundary;

import org.locationtech.jts.geom.Geometry;

/**
 * Polygon of an administrative layer, reduced to what the auto-linker needs.
 *
 * @param id       layer-specific identifier rendered as text (city code, district id...)
 * @param name     display name
 * @param geometry polygon or multi-polygon
 */
public record AdministrativeArea(String id, String name, Geometry geometry) {
}
