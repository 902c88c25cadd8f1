package com.pathtopology.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Publicly listed route built on top of a topology event.
 *
 * The publishing workflow lives elsewhere; the engine only clears the flag
 * when a segment supporting the route disappears.
 */
@Entity
@Table(name = "published_routes")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PublishedRoute {

    @Id
    @Column(name = "event_id")
    private Long eventId;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    @Builder.Default
    private Boolean published = false;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
