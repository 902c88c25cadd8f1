package com.pathtopology.engine.repository;

import com.pathtopology.engine.entity.RestrictedAreaEdge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RestrictedAreaEdgeRepository extends JpaRepository<RestrictedAreaEdge, Long> {

    List<RestrictedAreaEdge> findByEventIdIn(Collection<Long> eventIds);

    @Modifying
    @Query("DELETE FROM RestrictedAreaEdge e WHERE e.eventId IN :eventIds")
    int deleteByEventIds(@Param("eventIds") Collection<Long> eventIds);
}
