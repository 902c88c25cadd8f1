package com.pathtopology.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Linear reference of an event on one segment.
 *
 * Positions are fractions of the segment length, stored normalized so that
 * start &lt;= end. Equal positions locate a point event.
 */
@Entity
@Table(name = "segment_event_links", indexes = {
    @Index(name = "idx_link_segment", columnList = "segment_id"),
    @Index(name = "idx_link_event", columnList = "event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SegmentEventLink {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "segment_id", nullable = false)
    private Long segmentId;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "start_position", nullable = false)
    private Double startPosition;

    @Column(name = "end_position", nullable = false)
    private Double endPosition;

    /**
     * Rank of this link among the links of a multi-segment event.
     */
    @Column(name = "order_index", nullable = false)
    @Builder.Default
    private Integer orderIndex = 0;

    public static SegmentEventLink of(Long segmentId, Long eventId, double a, double b) {
        return of(segmentId, eventId, a, b, 0);
    }

    public static SegmentEventLink of(Long segmentId, Long eventId, double a, double b, int orderIndex) {
        return SegmentEventLink.builder()
            .segmentId(segmentId)
            .eventId(eventId)
            .startPosition(clamp(Math.min(a, b)))
            .endPosition(clamp(Math.max(a, b)))
            .orderIndex(orderIndex)
            .build();
    }

    public boolean isPoint() {
        return startPosition.doubleValue() == endPosition.doubleValue();
    }

    public void moveTo(double position) {
        startPosition = clamp(position);
        endPosition = startPosition;
    }

    private static double clamp(double position) {
        return Math.max(0.0, Math.min(1.0, position));
    }
}
