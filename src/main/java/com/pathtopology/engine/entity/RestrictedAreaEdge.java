package com.pathtopology.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "restricted_area_edges", indexes = {
    @Index(name = "idx_restricted_area_edge_event", columnList = "event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RestrictedAreaEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "restricted_area_id", nullable = false)
    private Long restrictedAreaId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "restricted_area_id", insertable = false, updatable = false)
    private RestrictedArea restrictedArea;
}
