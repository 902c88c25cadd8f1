package com.pathtopology.engine.service.elevation;

import com.pathtopology.engine.exception.ElevationUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.densify.Densifier;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Elevation service backed by the remote terrain API.
 *
 * Heights are sampled along the line densified at the sampling step, so the
 * indicators follow the terrain between distant vertices. The draped line
 * keeps the input vertices only, each lifted to its sampled height, so its
 * planar footprint stays identical to the submitted line.
 */
@Service
@Slf4j
public class RemoteElevationService implements ElevationService {

    private final ElevationSampleClient sampleClient;
    private final GeometryFactory geometryFactory;
    private final double samplingStep;

    public RemoteElevationService(
        ElevationSampleClient sampleClient,
        GeometryFactory geometryFactory,
        @Value("${topology.elevation.sampling-step:25.0}") double samplingStep
    ) {
        if (samplingStep <= 0.0) {
            throw new IllegalArgumentException("Sampling step must be positive: " + samplingStep);
        }
        this.sampleClient = sampleClient;
        this.geometryFactory = geometryFactory;
        this.samplingStep = samplingStep;
    }

    @Override
    public ElevationProfile sampleElevation(LineString line2D) {
        LineString densified = (LineString) Densifier.densify(line2D, samplingStep);
        Coordinate[] samples = densified.getCoordinates();

        List<Double> heights = sampleClient.fetchHeights(samples);
        if (heights.stream().anyMatch(height -> height == null || height.isNaN())) {
            throw new ElevationUnavailableException("Terrain model has no data under part of the line");
        }

        ElevationProfile profile = drape(line2D.getCoordinates(), samples, heights);
        log.debug("Draped {} vertices from {} samples: min={} max={} ascent={} descent={}",
            line2D.getNumPoints(), samples.length, profile.minElevation(), profile.maxElevation(),
            profile.ascent(), profile.descent());
        return profile;
    }

    /**
     * @param vertices input vertices, all present in {@code samples} in the same order
     * @param samples  densified coordinates the heights were fetched for
     * @param heights  one height per sample
     */
    ElevationProfile drape(Coordinate[] vertices, Coordinate[] samples, List<Double> heights) {
        Coordinate[] draped = new Coordinate[vertices.length];
        int next = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double ascent = 0.0;
        double descent = 0.0;

        for (int i = 0; i < samples.length; i++) {
            double height = heights.get(i);
            // repeated input vertices collapse onto one sample
            while (next < vertices.length && samples[i].equals2D(vertices[next])) {
                draped[next] = new Coordinate(vertices[next].getX(), vertices[next].getY(), height);
                next++;
            }
            min = Math.min(min, height);
            max = Math.max(max, height);
            if (i > 0) {
                double delta = height - heights.get(i - 1);
                if (delta > 0) {
                    ascent += delta;
                } else {
                    descent -= delta;
                }
            }
        }
        if (next < vertices.length) {
            throw new IllegalStateException("Samples miss input vertex " + next + " of " + vertices.length);
        }

        return new ElevationProfile(
            geometryFactory.createLineString(draped),
            (int) Math.round(min),
            (int) Math.round(max),
            (int) Math.round(ascent),
            (int) Math.round(descent)
        );
    }
}
