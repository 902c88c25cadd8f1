package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.RestrictedArea;
import org.locationtech.jts.geom.Geometry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RestrictedAreaRepository extends JpaRepository<RestrictedArea, Long> {

    @Query("""
        SELECT a FROM RestrictedArea a
        WHERE ST_Intersects(a.geometry, :geometry) = true
        """)
    List<RestrictedArea> findIntersecting(@Param("geometry") Geometry geometry);
}
