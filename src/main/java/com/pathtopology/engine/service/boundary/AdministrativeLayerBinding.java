package com.pathtopology.engine.service.boundary;

import com.pathtopology.engine.entity.AdministrativeLayer;
import org.locationtech.jts.geom.Geometry;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Everything the auto-linker needs to know about one administrative layer:
 * where its polygons come from and which table records the link between a
 * boundary event and its polygon.
 *
 * One implementation per layer; the auto-linker runs the same algorithm
 * over all of them.
 */
public interface AdministrativeLayerBinding {

    AdministrativeLayer layer();

    List<AdministrativeArea> findIntersecting(Geometry geometry);

    void link(Long eventId, String areaId);

    /**
     * Removes the admin-link rows of the given events.
     *
     * @return number of rows removed
     */
    int unlink(Collection<Long> eventIds);

    /**
     * Polygon id of each given event that has an admin-link row in this layer.
     */
    Map<Long, String> findAreaIds(Collection<Long> eventIds);
}
