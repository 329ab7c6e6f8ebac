package com.tony.gridironStats.job;

import com.tony.gridironStats.config.CompilationProperties;
import com.tony.gridironStats.exception.CompilationInProgressException;
import com.tony.gridironStats.model.dto.CompilationReport;
import com.tony.gridironStats.service.SeasonCompilerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class SeasonCompilationJob {

    private final SeasonCompilerService compilerService;
    private final CompilationProperties properties;

    /**
     * Recompilation complète de la saison configurée (compilation.season / end-week / season-type).
     * Désactivé par défaut ("-"). Exemple pour le mardi matin, après le Monday Night : compilation.cron=0 0 9 * * TUE
     */
    @Scheduled(cron = "${compilation.cron:-}")
    public void recompileSeason() {
        log.info("⏰ [CRON] Démarrage automatique : recompilation saison {} (semaines 1..{})",
                properties.getSeason(), properties.getEndWeek());
        try {
            CompilationReport report = compilerService.compileSeason(
                    properties.getSeason(), properties.getEndWeek(), properties.getSeasonType());
            log.info("✅ [CRON] {} matchs compilés, {} ignorés.", report.getGamesProcessed(), report.getGamesFailed());
        } catch (CompilationInProgressException e) {
            log.warn("⏭️ [CRON] {}", e.getMessage());
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de la recompilation", e);
        }
    }
}
