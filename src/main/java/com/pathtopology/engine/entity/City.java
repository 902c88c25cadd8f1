package com.pathtopology.engine.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.locationtech.jts.geom.MultiPolygon;

/**
 * Municipality polygon, keyed by its official code. Maintained outside the
 * engine and only read here.
 */
@Entity
@Immutable
@Table(name = "cities")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class City {

    @Id
    @Column(length = 6)
    private String code;

    @Column(nullable = false)
    private String name;

    @Column(name = "geom", columnDefinition = "geometry(MultiPolygon,2154)", nullable = false)
    private MultiPolygon geometry;
}
