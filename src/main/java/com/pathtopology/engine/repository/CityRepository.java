package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.City;
import org.locationtech.jts.geom.Geometry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CityRepository extends JpaRepository<City, String> {

    @Query("""
        SELECT a FROM City a
        WHERE ST_Intersects(a.geometry, :geometry) = true
        """)
    List<City> findIntersecting(@Param("geometry") Geometry geometry);
}
