package com.pathtopology.engine.service.boundary;

import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.entity.CityEdge;
import com.pathtopology.engine.repository.CityEdgeRepository;
import com.pathtopology.engine.repository.CityRepository;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class CityLayerBinding implements AdministrativeLayerBinding {

    private final CityRepository cityRepository;
    private final CityEdgeRepository cityEdgeRepository;

    @Override
    public AdministrativeLayer layer() {
        return AdministrativeLayer.CITY;
    }

    @Override
    public List<AdministrativeArea> findIntersecting(Geometry geometry) {
        return cityRepository.findIntersecting(geometry).stream()
            .map(city -> new AdministrativeArea(city.getCode(), city.getName(), city.getGeometry()))
            .toList();
    }

    @Override
    public void link(Long eventId, String areaId) {
        cityEdgeRepository.save(CityEdge.builder()
            .eventId(eventId)
            .cityCode(areaId)
            .build());
    }

    @Override
    public int unlink(Collection<Long> eventIds) {
        return cityEdgeRepository.deleteByEventIds(eventIds);
    }

    @Override
    public Map<Long, String> findAreaIds(Collection<Long> eventIds) {
        return cityEdgeRepository.findByEventIdIn(eventIds).stream()
            .collect(Collectors.toMap(CityEdge::getEventId, CityEdge::getCityCode, (first, second) -> first));
    }
}
