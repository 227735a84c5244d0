package com.tony.fantasyGolf.controller;

import com.tony.fantasyGolf.model.dto.DataResult;
import com.tony.fantasyGolf.model.dto.PlayoffBracket;
import com.tony.fantasyGolf.model.dto.TourStandings;
import com.tony.fantasyGolf.service.DataFreshnessService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/seasons")
@RequiredArgsConstructor
public class StandingsController {

    private final DataFreshnessService dataFreshnessService;

    @GetMapping("/{seasonId}/standings")
    public ResponseEntity<DataResult<List<TourStandings>>> getStandings(
            @PathVariable Long seasonId,
            @RequestParam(defaultValue = "false") boolean refresh) {
        return ResponseEntity.ok(dataFreshnessService.standings(seasonId, refresh));
    }

    @GetMapping("/{seasonId}/playoffs")
    public ResponseEntity<DataResult<List<PlayoffBracket>>> getPlayoffs(
            @PathVariable Long seasonId,
            @RequestParam(defaultValue = "false") boolean refresh) {
        return ResponseEntity.ok(dataFreshnessService.playoffs(seasonId, refresh));
    }
}
