package com.pathtopology.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.LineString;

import java.time.LocalDateTime;

/**
 * One edge of the path network.
 *
 * The geometry is always stored draped (3-D). It must be simple and must
 * never share a sub-line with another segment; both rules are enforced by
 * the overlap validator before the row is written, and simplicity is also
 * backed by a CHECK constraint (see db/spatial-indexes.sql).
 */
@Entity
@Table(name = "path_segments", indexes = {
    @Index(name = "idx_segment_updated_at", columnList = "updated_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PathSegment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "geom", columnDefinition = "geometry(LineStringZ,2154)", nullable = false)
    private LineString geometry;

    /**
     * Optional geometry as surveyed by the land registry. Stored as given,
     * neither validated nor draped.
     */
    @Column(name = "geom_cadastre", columnDefinition = "geometry(LineString,2154)")
    private LineString cadastralGeometry;

    /**
     * 3-D arc length of {@link #geometry}, in metres.
     */
    @Column(nullable = false)
    @Builder.Default
    private Double length = 0.0;

    @Column(name = "min_elevation")
    private Integer minElevation;

    @Column(name = "max_elevation")
    private Integer maxElevation;

    /**
     * Cumulative positive elevation gain, in metres.
     */
    @Column(name = "ascent")
    private Integer ascent;

    /**
     * Cumulative negative elevation gain as a positive magnitude, in metres.
     */
    @Column(name = "descent")
    private Integer descent;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
