package com.pathtopology.engine.controller;

import com.pathtopology.engine.dto.BoundaryCrossingRecord;
import com.pathtopology.engine.dto.EventRecord;
import com.pathtopology.engine.dto.GeometryUpdateRequest;
import com.pathtopology.engine.dto.SegmentRecord;
import com.pathtopology.engine.dto.SegmentRequest;
import com.pathtopology.engine.entity.AdministrativeLayer;
import com.pathtopology.engine.service.PathSegmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Segment writes and segment-centric reads.
 *
 * Every write goes through the segment write pipeline; the response is the
 * segment as committed, with its draped geometry and elevation indicators.
 */
@RestController
@RequestMapping("/api/topology")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Path Segments", description = "Path network edits and the events derived from them")
public class PathSegmentController {

    private final PathSegmentService segmentService;

    @Operation(
            summary = "Insert a path segment",
            description = "Validates the line against every existing segment, drapes it on the terrain, " +
                    "then creates its boundary events."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Segment inserted"),
            @ApiResponse(
                    responseCode = "409",
                    description = "The line overlaps an existing segment",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = "{\"status\":\"REJECTED\",\"error\":\"SEGMENT_OVERLAP\",\"conflictingSegmentId\":12}"
                            )
                    )
            ),
            @ApiResponse(responseCode = "422", description = "The line is not simple"),
            @ApiResponse(responseCode = "503", description = "Elevation API unavailable")
    })
    @PostMapping("/segments")
    public ResponseEntity<SegmentRecord> createSegment(@Valid @RequestBody SegmentRequest request) {
        SegmentRecord created = segmentService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Get a path segment")
    @GetMapping("/segments/{id}")
    public ResponseEntity<SegmentRecord> getSegment(
        @Parameter(description = "Segment ID", example = "1") @PathVariable Long id
    ) {
        return ResponseEntity.ok(segmentService.getSegment(id));
    }

    @Operation(
            summary = "Replace the geometry of a segment",
            description = "Boundary events of the segment are regenerated with new ids; " +
                    "other linked events are moved onto the new line."
    )
    @PutMapping("/segments/{id}/geometry")
    public ResponseEntity<SegmentRecord> updateGeometry(
        @PathVariable Long id,
        @Valid @RequestBody GeometryUpdateRequest request
    ) {
        return ResponseEntity.ok(segmentService.updateGeometry(id, request));
    }

    @Operation(
            summary = "Delete a segment",
            description = "Events left without any link are orphaned and their published routes unpublished."
    )
    @DeleteMapping("/segments/{id}")
    public ResponseEntity<Void> deleteSegment(@PathVariable Long id) {
        segmentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List the events linked to a segment")
    @GetMapping("/segments/{id}/events")
    public ResponseEntity<List<EventRecord>> getSegmentEvents(@PathVariable Long id) {
        return ResponseEntity.ok(segmentService.getEvents(id));
    }

    @Operation(
            summary = "List the administrative areas a segment crosses",
            description = "Cities, districts and restricted areas, with the stretch of the segment inside each."
    )
    @GetMapping("/segments/{id}/boundaries")
    public ResponseEntity<Map<AdministrativeLayer, List<BoundaryCrossingRecord>>> getSegmentBoundaries(
        @PathVariable Long id
    ) {
        return ResponseEntity.ok(segmentService.getBoundaries(id));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "UP",
            "service", "Path Topology Engine",
            "timestamp", Instant.now()
        ));
    }
}
