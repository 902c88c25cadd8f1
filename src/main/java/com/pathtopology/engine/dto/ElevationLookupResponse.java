package com.pathtopology.engine.dto;

import java.util.List;

/**
 * Heights returned by the elevation API, one per requested point, in metres.
 * Also the value cached in Redis.
 */
public record ElevationLookupResponse(List<Double> heights) {
}
