package com.pathtopology.engine.service.elevation;

import com.pathtopology.engine.exception.ElevationUnavailableException;
import org.locationtech.jts.geom.LineString;

/**
 * Drapes planar lines on the terrain model.
 */
public interface ElevationService {

    /**
     * @param line2D planar line in the engine SRID
     * @return the draped line and its indicators
     * @throws ElevationUnavailableException when the terrain cannot be sampled
     */
    ElevationProfile sampleElevation(LineString line2D);
}
