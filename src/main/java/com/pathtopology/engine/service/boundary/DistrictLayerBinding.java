package com.pathtopology.engine.service.boundary;

import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.DistrictEdge;
import com.pathtopology.engine.repository.DistrictEdgeRepository;
import com.pathtopology.engine.repository.DistrictRepository;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class DistrictLayerBinding implements AdministrativeLayerBinding {

    private final DistrictRepository districtRepository;
    private final DistrictEdgeRepository districtEdgeRepository;

    @Override
    public AdministrativeLayer layer() {
        return AdministrativeLayer.DISTRICT;
    }

    @Override
    public List<AdministrativeArea> findIntersecting(Geometry geometry) {
        return districtRepository.findIntersecting(geometry).stream()
            .map(district -> new AdministrativeArea(
                String.valueOf(district.getId()), district.getName(), district.getGeometry()))
            .toList();
    }

    @Override
    public void link(Long eventId, String areaId) {
        districtEdgeRepository.save(DistrictEdge.builder()
            .eventId(eventId)
            .districtId(Long.valueOf(areaId))
            .build());
    }

    @Override
    public int unlink(Collection<Long> eventIds) {
        return districtEdgeRepository.deleteByEventIds(eventIds);
    }

    @Override
    public Map<Long, String> findAreaIds(Collection<Long> eventIds) {
        return districtEdgeRepository.findByEventIdIn(eventIds).stream()
            .collect(Collectors.toMap(
                DistrictEdge::getEventId,
                edge -> String.valueOf(edge.getDistrictId()),
                (first, second) -> first));
    }
}
