package com.pathtopology.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.Geometry;

import java.time.LocalDateTime;

/**
 * A feature located on the path network by linear reference.
 *
 * The cached geometry is derived from the event's links, its lateral offset
 * and the geometry of the linked segments. It is rebuilt whenever one of
 * those segments changes, except for offset point events, whose stored
 * point is authoritative and whose links are moved instead.
 */
@Entity
@Table(name = "topology_events", indexes = {
    @Index(name = "idx_event_origin", columnList = "origin"),
    @Index(name = "idx_event_state", columnList = "state")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TopologyEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Business kind, e.g. CITYEDGE for boundary events or any user kind
     * such as SIGNAGE or TREK.
     */
    @Column(nullable = false, length = 64)
    private String kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private EventOrigin origin = EventOrigin.MANUAL;

    /**
     * Signed distance from the reference line, positive to the left.
     * Zero for events lying on the path itself.
     */
    @Column(name = "lateral_offset", nullable = false)
    @Builder.Default
    private Double lateralOffset = 0.0;

    @Column(nullable = false)
    @Builder.Default
    private Double length = 0.0;

    @Column(name = "geom", columnDefinition = "geometry")
    private Geometry geometry;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private EventState state = EventState.ACTIVE;

    @Column(name = "orphaned_at")
    private LocalDateTime orphanedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * New boundary event for the given layer. The geometry starts as the
     * whole segment line and is narrowed to the crossed stretch by the
     * resynchronizer once the link exists.
     */
    public static TopologyEvent boundary(AdministrativeLayer layer, Geometry segmentGeometry) {
        return TopologyEvent.builder()
            .kind(layer.getEventKind())
            .origin(layer.getOrigin())
            .geometry(segmentGeometry)
            .build();
    }

    public boolean hasLateralOffset() {
        return lateralOffset != null && lateralOffset != 0.0;
    }

    public boolean isActive() {
        return state == EventState.ACTIVE;
    }

    public void orphan(LocalDateTime when) {
        if (state == EventState.ORPHANED) {
            return;
        }
        state = EventState.ORPHANED;
        orphanedAt = when;
    }
}
