package com.grokpm.backend.modules.admin.presentation;

import java.time.Clock;
import java.time.OffsetDateTime;

import com.grokpm.backend.modules.admin.application.SampleDataService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/seed")
public class SeedController {

    private final SampleDataService sampleDataService;
    private final Clock clock;

    public SeedController(SampleDataService sampleDataService, Clock clock) {
        this.sampleDataService = sampleDataService;
        this.clock = clock;
    }

    @Operation(
            summary = "Load sample data",
            description = "Runs the sample data script when the database holds no properties; otherwise does nothing."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "seeded=true when data was loaded, false when skipped")
    })
    @PostMapping
    public ResponseEntity<SeedResponse> seed() {
        boolean seeded = sampleDataService.seedIfEmpty();
        String message = seeded ? "SAMPLE_DATA_LOADED" : "SAMPLE_DATA_ALREADY_PRESENT";
        return ResponseEntity.ok(new SeedResponse(seeded, message, OffsetDateTime.now(clock)));
    }

    public record SeedResponse(boolean seeded, String message, OffsetDateTime executedAt) {
    }
}
