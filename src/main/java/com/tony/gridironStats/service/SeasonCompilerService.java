package com.tony.gridironStats.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.gridironStats.exception.CompilationAbortedException;
import com.tony.gridironStats.exception.CompilationInProgressException;
import com.tony.gridironStats.exception.InvalidCompilationRequestException;
import com.tony.gridironStats.exception.StatsPersistenceException;
import com.tony.gridironStats.feed.SourceFeed;
import com.tony.gridironStats.model.SeasonType;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.dto.CompilationReport;
import com.tony.gridironStats.model.dto.CompilationStatus;
import com.tony.gridironStats.model.dto.GameWarning;
import com.tony.gridironStats.model.game.GameStatLines;
import com.tony.gridironStats.service.ingest.BoxScoreExtractor;
import com.tony.gridironStats.service.merge.CategoryMergeEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Compile les stats joueurs d'une saison : semaines 1..endWeek, match par match.
 * <p>
 * Les tables sont TOUJOURS vidées avant l'import : relancer sans reset doublerait chaque match déjà compté.
 * Un match qui échoue côté ESPN est ignoré (warning), une erreur base arrête tout.
 * <p>
 * Pas de @Transactional ici : chaque lot (catégorie d'un match) a sa propre transaction dans CategoryMergeEngine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonCompilerService {

    private final SourceFeed sourceFeed;
    private final BoxScoreExtractor extractor;
    private final CategoryMergeEngine mergeEngine;
    private final SeasonAggregateGateway gateway;

    // Le job planifié et l'endpoint admin partagent ce service : une seule compilation à la fois
    private final ReentrantLock runLock = new ReentrantLock();

    public CompilationReport compileSeason(int season, int endWeek, int seasonTypeCode) {
        SeasonType seasonType = validate(season, endWeek, seasonTypeCode);

        if (!runLock.tryLock()) {
            throw new CompilationInProgressException("Une compilation est déjà en cours, réessayez plus tard.");
        }
        try {
            return run(season, endWeek, seasonType);
        } finally {
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Vide les six tables, sous le même verrou qu'une compilation.
     *
     * @throws CompilationInProgressException si une compilation tourne
     */
    public void resetAllIfIdle() {
        runIfIdle(gateway::resetAll);
    }

    public void resetCategoryIfIdle(StatCategory category) {
        runIfIdle(() -> gateway.resetCategory(category));
    }

    private void runIfIdle(Runnable reset) {
        if (!runLock.tryLock()) {
            throw new CompilationInProgressException("Compilation en cours, reset refusé.");
        }
        try {
            reset.run();
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Contrôles avant toute I/O.
     */
    SeasonType validate(int season, int endWeek, int seasonTypeCode) {
        SeasonType seasonType = SeasonType.fromCode(seasonTypeCode);
        seasonType.checkEndWeek(endWeek);
        if (season < 1) {
            throw new InvalidCompilationRequestException("season doit être une année valide, reçu : " + season);
        }
        return seasonType;
    }

    private CompilationReport run(int season, int endWeek, SeasonType seasonType) {
        RunState state = new RunState(season, endWeek, seasonType);
        log.info("🏈 Compilation des stats : saison {}, semaines 1..{}, {}", season, endWeek, seasonType.getLabel());

        try {
            // Reset une seule fois, avant la première semaine
            gateway.resetAll();

            for (int week = 1; week <= endWeek; week++) {
                processWeek(state, week);
            }
        } catch (StatsPersistenceException | DataAccessException | TransactionException e) {
            CompilationReport partial = state.toReport(CompilationStatus.ABORTED);
            log.error("❌ Compilation interrompue (erreur base) après {} matchs", partial.getGamesProcessed(), e);
            throw new CompilationAbortedException("Compilation interrompue : " + e.getMessage(), e, partial);
        }

        CompilationReport report = state.toReport(CompilationStatus.COMPLETED);
        log.info("✅ Compilation terminée : {} matchs, {} ignorés, lignes touchées {} ({} ms)",
                report.getGamesProcessed(), report.getGamesFailed(), report.getTouchedRows(), report.getDurationMs());
        return report;
    }

    private void processWeek(RunState state, int week) {
        List<String> gameIds;
        try {
            gameIds = sourceFeed.discoverGames(state.season, week, state.seasonType);
        } catch (RuntimeException e) {
            log.warn("⚠️ Semaine {} : calendrier indisponible ({}), semaine ignorée", week, e.getMessage());
            state.warnings.add(new GameWarning(null, week, e.getMessage()));
            return;
        }
        log.info("📅 Semaine {}/{} : {} matchs trouvés", week, state.endWeek, gameIds.size());

        for (String gameId : gameIds) {
            processGame(state, gameId, week);
        }
    }

    private void processGame(RunState state, String gameId, int week) {
        try {
            JsonNode payload = sourceFeed.fetchGamePayload(gameId);
            GameStatLines lines = extractor.extract(payload);

            Map<StatCategory, Integer> counts = new EnumMap<>(StatCategory.class);
            for (StatCategory category : StatCategory.values()) {
                int touched = mergeEngine.mergeBatch(category, lines.get(category));
                counts.put(category, touched);
                state.touchedRows.merge(category, touched, Integer::sum);
            }
            state.gamesProcessed++;
            log.info("   -> Match {} (semaine {}) : {}", gameId, week, counts);
        } catch (StatsPersistenceException | DataAccessException | TransactionException e) {
            throw e;
        } catch (RuntimeException e) {
            state.gamesFailed++;
            state.warnings.add(new GameWarning(gameId, week, e.getMessage()));
            log.warn("⚠️ Match {} (semaine {}) ignoré : {}", gameId, week, e.getMessage());
        }
    }

    private static class RunState {
        final int season;
        final int endWeek;
        final SeasonType seasonType;
        final LocalDateTime startedAt = LocalDateTime.now();
        final long start = System.currentTimeMillis();
        int gamesProcessed = 0;
        int gamesFailed = 0;
        final Map<StatCategory, Integer> touchedRows = new EnumMap<>(StatCategory.class);
        final List<GameWarning> warnings = new ArrayList<>();

        RunState(int season, int endWeek, SeasonType seasonType) {
            this.season = season;
            this.endWeek = endWeek;
            this.seasonType = seasonType;
            for (StatCategory category : StatCategory.values()) touchedRows.put(category, 0);
        }

        CompilationReport toReport(CompilationStatus status) {
            return CompilationReport.builder()
                    .season(season)
                    .seasonType(seasonType)
                    .endWeek(endWeek)
                    .status(status)
                    .gamesProcessed(gamesProcessed)
                    .gamesFailed(gamesFailed)
                    .touchedRows(new EnumMap<>(touchedRows))
                    .warnings(List.copyOf(warnings))
                    .startedAt(startedAt)
                    .finishedAt(LocalDateTime.now())
                    .durationMs(System.currentTimeMillis() - start)
                    .build();
        }
    }
}
