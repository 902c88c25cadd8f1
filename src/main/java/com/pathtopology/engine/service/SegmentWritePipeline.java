package com.pathtopology.engine.service;

import com.pathtopology.engine.dto.CascadeOutcome;
import com.pathtopology.engine.dto.SegmentChangedNotice;
import com.pathtopology.engine.entity.PathSegment;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.repository.PathSegmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * The three mutation entry points of the path network.
 *
 * Insert and geometry update run, in this order:
 * 1. OverlapValidator: reject or proceed
 * 2. ElevationProfiler: drape the line, refresh length and indicators
 * 3. persist and flush the segment row
 * 4. AutoLinker: regenerate boundary events
 * 5. GeometryResynchronizer: realign every event linked to the segment
 *
 * Delete runs the CascadeDeletionHandler, then removes the row.
 *
 * Each entry point is one transaction: any exception, including a
 * rejection or an elevation failure, rolls back every derived write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SegmentWritePipeline {

    private final OverlapValidator overlapValidator;
    private final ElevationProfiler elevationProfiler;
    private final PathSegmentRepository segmentRepository;
    private final AutoLinker autoLinker;
    private final GeometryResynchronizer resynchronizer;
    private final CascadeDeletionHandler cascadeDeletionHandler;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional
    public PathSegment onSegmentInserted(Geometry geometry, LineString cadastralGeometry) {
        LineString line = overlapValidator.validate(null, geometry);

        PathSegment segment = PathSegment.builder()
            .geometry(line)
            .cadastralGeometry(cadastralGeometry)
            .build();
        elevationProfiler.profile(segment);

        PathSegment saved = segmentRepository.saveAndFlush(segment);
        List<Long> boundaryEventIds = autoLinker.linkNewSegment(saved);
        resynchronizer.resynchronize(saved);

        log.info("Inserted segment {} (length={})", saved.getId(), saved.getLength());
        eventPublisher.publishEvent(SegmentChangedNotice.inserted(saved.getId(), boundaryEventIds));
        return saved;
    }

    @Transactional
    public PathSegment onSegmentGeometryUpdated(Long segmentId, Geometry geometry) {
        PathSegment segment = segmentRepository.findById(segmentId)
            .orElseThrow(() -> new SegmentNotFoundException(segmentId));

        LineString line = overlapValidator.validate(segmentId, geometry);
        segment.setGeometry(line);
        elevationProfiler.profile(segment);

        PathSegment saved = segmentRepository.saveAndFlush(segment);
        List<Long> boundaryEventIds = autoLinker.relinkSegment(saved);
        resynchronizer.resynchronize(saved);

        log.info("Updated geometry of segment {} (length={})", saved.getId(), saved.getLength());
        eventPublisher.publishEvent(SegmentChangedNotice.updated(saved.getId(), boundaryEventIds));
        return saved;
    }

    @Transactional
    public CascadeOutcome onSegmentDeleted(Long segmentId) {
        PathSegment segment = segmentRepository.findById(segmentId)
            .orElseThrow(() -> new SegmentNotFoundException(segmentId));

        CascadeOutcome outcome = cascadeDeletionHandler.beforeSegmentDeleted(segmentId);
        segmentRepository.delete(segment);

        log.info("Deleted segment {}", segmentId);
        eventPublisher.publishEvent(SegmentChangedNotice.deleted(segmentId, outcome.orphanedEventIds()));
        return outcome;
    }
}
