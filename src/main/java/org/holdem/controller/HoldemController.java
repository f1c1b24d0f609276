package org.holdem.controller;

import jakarta.validation.Valid;
import org.holdem.dto.holdem.*;
import org.holdem.service.holdem.table.HoldemTableService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/holdem")
public class HoldemController {

    private final HoldemTableService tableService;

    public HoldemController(HoldemTableService tableService) {
        this.tableService = tableService;
    }

    @PostMapping("/evaluate")
    public ResponseEntity<HandView> evaluate(@Valid @RequestBody EvaluateRequest req) {
        return ResponseEntity.ok(tableService.evaluate(req));
    }

    @PostMapping("/pots")
    public ResponseEntity<PotResponse> pots(@Valid @RequestBody PotRequest req) {
        return ResponseEntity.ok(tableService.pots(req));
    }

    @PostMapping("/street")
    public ResponseEntity<StreetResponse> street(@Valid @RequestBody StreetRequest req) {
        return ResponseEntity.ok(tableService.street(req));
    }
}
