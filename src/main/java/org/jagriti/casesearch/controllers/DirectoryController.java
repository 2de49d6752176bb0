package org.jagriti.casesearch.controllers;

import org.jagriti.casesearch.domain.DistrictListing;
import org.jagriti.casesearch.domain.StateListing;
import org.jagriti.casesearch.services.DirectoryService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class DirectoryController {

    private final DirectoryService directoryService;

    @Operation(summary = "Get all states with their commission IDs")
    @GetMapping("/states")
    public ResponseEntity<StateListing> listStates() {
        log.debug("listStates");
        return ResponseEntity.ok(directoryService.listStates());
    }

    @Operation(summary = "Get district commissions for a state")
    @GetMapping("/commissions/{stateId}")
    public ResponseEntity<DistrictListing> listDistrictCommissions(
            @Parameter(example = "11290000") @PathVariable("stateId") final int stateId) {
        log.debug("listDistrictCommissions stateId={}", stateId);
        return ResponseEntity.ok(directoryService.listDistrictCommissions(stateId));
    }
}
