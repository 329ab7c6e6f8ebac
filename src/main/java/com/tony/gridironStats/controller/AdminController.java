package com.tony.gridironStats.controller;

import com.tony.gridironStats.exception.CompilationAbortedException;
import com.tony.gridironStats.exception.CompilationInProgressException;
import com.tony.gridironStats.exception.InvalidCompilationRequestException;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.dto.CompilationReport;
import com.tony.gridironStats.service.SeasonCompilerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final SeasonCompilerService compilerService;

    /**
     * Recompile toute la saison (reset + semaines 1..endWeek).
     * Exemple : POST /api/v1/admin/compile?season=2025&endWeek=7&seasonType=2
     */
    @PostMapping("/compile")
    public ResponseEntity<?> compileSeason(@RequestParam int season,
                                           @RequestParam int endWeek,
                                           @RequestParam(defaultValue = "2") int seasonType) {
        log.info("🚀 Compilation manuelle demandée : saison {}, semaines 1..{}, type {}", season, endWeek, seasonType);
        try {
            CompilationReport report = compilerService.compileSeason(season, endWeek, seasonType);
            return ResponseEntity.ok(report);
        } catch (InvalidCompilationRequestException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (CompilationInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        } catch (CompilationAbortedException e) {
            Map<String, Object> body = new HashMap<>();
            body.put("error", e.getMessage());
            body.put("partialReport", e.getPartialReport());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
    }

    @GetMapping("/compile/status")
    public ResponseEntity<Map<String, Boolean>> compilationStatus() {
        return ResponseEntity.ok(Map.of("running", compilerService.isRunning()));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> resetAll() {
        try {
            compilerService.resetAllIfIdle();
        } catch (CompilationInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of("message", "Les 6 tables de stats ont été vidées."));
    }

    @PostMapping("/reset/{category}")
    public ResponseEntity<Map<String, String>> resetCategory(@PathVariable String category) {
        Optional<StatCategory> cat = StatCategory.fromGroupName(category);
        if (cat.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Catégorie inconnue : " + category));
        }
        try {
            compilerService.resetCategoryIfIdle(cat.get());
        } catch (CompilationInProgressException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", e.getMessage()));
        }
        return ResponseEntity.ok(Map.of("message", "Table " + cat.get().getGroupName() + " vidée."));
    }
}
