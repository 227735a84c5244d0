package com.tony.fantasyGolf.controller;

import com.tony.fantasyGolf.model.dto.DataResult;
import com.tony.fantasyGolf.model.dto.LeaderboardResult;
import com.tony.fantasyGolf.service.DataFreshnessService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tournaments")
@RequiredArgsConstructor
public class LeaderboardController {

    private final DataFreshnessService dataFreshnessService;

    // ?refresh=true ignore le cache
    @GetMapping("/{tournamentId}/leaderboard")
    public ResponseEntity<DataResult<LeaderboardResult>> getLeaderboard(
            @PathVariable Long tournamentId,
            @RequestParam(defaultValue = "false") boolean refresh) {
        return ResponseEntity.ok(dataFreshnessService.leaderboard(tournamentId, refresh));
    }
}
