package com.pathtopology.engine.service;

import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.exception.ElevationUnavailableException;
import com.pathtopology.engine.geometry.GeometryEngine;
import com.pathtopology.engine.service.elevation.ElevationProfile;
import com.pathtopology.engine.service.elevation.ElevationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.LineString;
import org.springframework.stereotype.Service;

/**
 * Replaces a segment's geometry with its draped version and refreshes the
 * cached length and elevation indicators. Runs before the row is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElevationProfiler {

    private final ElevationService elevationService;
    private final GeometryEngine geometryEngine;

    public void profile(PathSegment segment) {
        LineString flat = geometryEngine.force2D(segment.getGeometry());
        ElevationProfile profile = elevationService.sampleElevation(flat);

        if (profile == null || profile.line3d() == null || profile.line3d().isEmpty()) {
            throw new ElevationUnavailableException("Elevation service returned no draped line");
        }

        LineString draped = profile.line3d();
        draped.setSRID(flat.getSRID());

        segment.setGeometry(draped);
        segment.setLength(geometryEngine.length3D(draped));
        segment.setMinElevation(profile.minElevation());
        segment.setMaxElevation(profile.maxElevation());
        segment.setAscent(profile.ascent());
        segment.setDescent(profile.descent());

        log.debug("Profiled segment {}: length={} ascent={} descent={}",
            segment.getId(), segment.getLength(), segment.getAscent(), segment.getDescent());
    }
}
