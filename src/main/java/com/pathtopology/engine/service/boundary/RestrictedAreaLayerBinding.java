package com.pathtopology.engine.service.boundary;

import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.RestrictedAreaEdge;
import com.pathtopology.engine.repository.RestrictedAreaEdgeRepository;
import com.pathtopology.engine.repository.RestrictedAreaRepository;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class RestrictedAreaLayerBinding implements AdministrativeLayerBinding {

    private final RestrictedAreaRepository restrictedAreaRepository;
    private final RestrictedAreaEdgeRepository restrictedAreaEdgeRepository;

    @Override
    public AdministrativeLayer layer() {
        return AdministrativeLayer.RESTRICTED_AREA;
    }

    @Override
    public List<AdministrativeArea> findIntersecting(Geometry geometry) {
        return restrictedAreaRepository.findIntersecting(geometry).stream()
            .map(area -> new AdministrativeArea(String.valueOf(area.getId()), area.getName(), area.getGeometry()))
            .toList();
    }

    @Override
    public void link(Long eventId, String areaId) {
        restrictedAreaEdgeRepository.save(RestrictedAreaEdge.builder()
            .eventId(eventId)
            .restrictedAreaId(Long.valueOf(areaId))
            .build());
    }

    @Override
    public int unlink(Collection<Long> eventIds) {
        return restrictedAreaEdgeRepository.deleteByEventIds(eventIds);
    }

    @Override
    public Map<Long, String> findAreaIds(Collection<Long> eventIds) {
        return restrictedAreaEdgeRepository.findByEventIdIn(eventIds).stream()
            .collect(Collectors.toMap(
                RestrictedAreaEdge::getEventId,
                edge -> String.valueOf(edge.getRestrictedAreaId()),
                (first, second) -> first));
    }
}
