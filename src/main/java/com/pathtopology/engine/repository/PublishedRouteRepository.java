package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.PublishedRoute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface PublishedRouteRepository extends JpaRepository<PublishedRoute, Long> {

    /**
     * Clears the published flag of every route built on one of the events.
     *
     * @return number of routes touched
     */
    @Modifying
    @Query("""
        UPDATE PublishedRoute r
        SET r.published = false, r.updatedAt = :now
        WHERE r.eventId IN :eventIds
        """)
    int unpublishByEventIds(
        @Param("eventIds") Collection<Long> eventIds,
        @Param("now") LocalDateTime now
    );
}
