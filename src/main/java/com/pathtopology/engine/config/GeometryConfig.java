package com.pathtopology.engine.config;

import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared JTS factory. Every geometry built by the engine (parsed WKT,
 * rebuilt event geometries, draped 3D lines) carries the project SRID.
 */
@Configuration
public class GeometryConfig {

    @Value("${topology.srid:2154}")
    private int srid;

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory(new PrecisionModel(), srid);
    }
}
