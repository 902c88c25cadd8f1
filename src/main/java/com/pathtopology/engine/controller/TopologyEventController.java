package com.pathtopology.engine.controller;

import com.pathtopology.engine.dto.EventRecord;
import com.pathtopology.engine.dto.EventRequest;
import com.pathtopology.engine.service.TopologyEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/topology/events")
@RequiredArgsConstructor
@Tag(name = "Topology Events", description = "Linearly referenced events on the path network")
public class TopologyEventController {

    private final TopologyEventService eventService;

    @Operation(
            summary = "Create a manual event",
            description = "The geometry is built from the links. Equal start and end positions make a point event; " +
                    "a non-zero offset shifts it sideways, positive to the left of the segment direction."
    )
    @PostMapping
    public ResponseEntity<EventRecord> createEvent(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = EventRequest.class),
                            examples = @ExampleObject(
                                    value = "{\"kind\":\"BENCH\",\"offset\":2.0,\"links\":[{\"segmentId\":1,\"start\":0.5,\"end\":0.5}]}"
                            )
                    )
            )
            @Valid @RequestBody EventRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(eventService.createEvent(request));
    }

    @Operation(summary = "Get an event with its links")
    @GetMapping("/{id}")
    public ResponseEntity<EventRecord> getEvent(@PathVariable Long id) {
        return ResponseEntity.ok(eventService.getEvent(id));
    }
}
