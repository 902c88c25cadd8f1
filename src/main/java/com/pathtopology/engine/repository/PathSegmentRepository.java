package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.PathSegment;
import org.locationtech.jts.geom.Geometry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for path segments.
 *
 * The spatial queries only pre-filter candidates with ST_Intersects, which
 * the GiST index on geom answers from bounding boxes first. The exact
 * overlap decision is taken in memory by the validator.
 */
@Repository
public interface PathSegmentRepository extends JpaRepository<PathSegment, Long> {

    /**
     * Segments touching or crossing a geometry that is not stored yet.
     */
    @Query("""
        SELECT s FROM PathSegment s
        WHERE ST_Intersects(s.geometry, :geometry) = true
        """)
    List<PathSegment> findIntersecting(@Param("geometry") Geometry geometry);

    /**
     * Segments touching or crossing a geometry, the segment being edited excluded.
     */
    @Query("""
        SELECT s FROM PathSegment s
        WHERE s.id <> :segmentId
        AND ST_Intersects(s.geometry, :geometry) = true
        """)
    List<PathSegment> findIntersectingOthers(
        @Param("segmentId") Long segmentId,
        @Param("geometry") Geometry geometry
    );
}
