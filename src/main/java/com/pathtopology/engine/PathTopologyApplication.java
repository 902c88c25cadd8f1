package com.pathtopology.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Path Topology Engine.
 *
 * The engine keeps linearly referenced events (boundary crossings, user
 * features such as benches or signage) consistent with the path network
 * they are located on.
 *
 * Flow for every segment write:
 * 1. Overlap validation (reject or proceed)
 * 2. Elevation draping of the new line
 * 3. Persistence of the segment row
 * 4. Regeneration of administrative boundary events
 * 5. Resynchronization of every other linked event
 *
 * Deletions run the cascade handler before the row is removed. Each write
 * and all of its derived writes share one transaction.
 */
@SpringBootApplication
public class PathTopologyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PathTopologyApplication.class, args);
    }
}
