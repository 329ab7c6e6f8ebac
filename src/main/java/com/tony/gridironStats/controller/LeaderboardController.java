package com.tony.gridironStats.controller;

import com.opencsv.exceptions.CsvException;
import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.service.LeaderboardService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/leaders")
@RequiredArgsConstructor
@Slf4j
public class LeaderboardController {

    private final LeaderboardService leaderboardService;

    // Les 6 classements d'un coup (page d'accueil)
    @GetMapping
    public ResponseEntity<Map<StatCategory, List<PlayerSeasonAggregate>>> getAllLeaders() {
        return ResponseEntity.ok(leaderboardService.getAllLeaders());
    }

    @GetMapping("/{category}")
    public ResponseEntity<?> getLeaders(@PathVariable String category,
                                        @RequestParam(required = false) Integer limit) {
        Optional<StatCategory> cat = StatCategory.fromGroupName(category);
        if (cat.isEmpty()) return unknownCategory(category);
        return ResponseEntity.ok(leaderboardService.getLeaders(cat.get(), limit));
    }

    @GetMapping("/{category}/players/{playerId}")
    public ResponseEntity<?> getPlayer(@PathVariable String category, @PathVariable String playerId) {
        Optional<StatCategory> cat = StatCategory.fromGroupName(category);
        if (cat.isEmpty()) return unknownCategory(category);
        return leaderboardService.getPlayer(cat.get(), playerId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{category}/export")
    public ResponseEntity<?> exportCsv(@PathVariable String category,
                                       @RequestParam(required = false) Integer limit) {
        Optional<StatCategory> cat = StatCategory.fromGroupName(category);
        if (cat.isEmpty()) return unknownCategory(category);

        StringWriter writer = new StringWriter();
        try {
            leaderboardService.exportCsv(cat.get(), limit, writer);
        } catch (CsvException e) {
            log.error("Erreur export CSV {}", category, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Export CSV impossible : " + e.getMessage()));
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + cat.get().getGroupName() + "_stats.csv\"")
                .contentType(new MediaType("text", "csv"))
                .body(writer.toString());
    }

    private ResponseEntity<?> unknownCategory(String category) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "Catégorie inconnue : " + category
                        + " (passing, rushing, receiving, fumbles, defensive, interceptions)"));
    }
}
