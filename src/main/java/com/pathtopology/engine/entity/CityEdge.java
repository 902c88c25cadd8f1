package com.pathtopology.engine.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Links a city boundary event to the city it was derived from.
 */
@Entity
@Table(name = "city_edges", indexes = {
    @Index(name = "idx_city_edge_event", columnList = "event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CityEdge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false)
    private Long eventId;

    @Column(name = "city_code", nullable = false, length = 6)
    private String cityCode;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "city_code", insertable = false, updatable = false)
    private City city;
}
