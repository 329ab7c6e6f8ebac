package com.tony.gridironStats.service.merge;

import com.tony.gridironStats.exception.StatsPersistenceException;
import com.tony.gridironStats.feed.SourceFeed;
import com.tony.gridironStats.model.PlayerSeasonAggregate;
import com.tony.gridironStats.model.RushingSeasonStats;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.PlayerIdentity;
import com.tony.gridironStats.model.game.RushingGameLine;
import com.tony.gridironStats.service.SeasonAggregateGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Sans transaction de test : chaque lot est validé ou annulé pour de vrai.
 */
@SpringBootTest
@ActiveProfiles("test")
class CategoryMergeEngineRollbackTest {

    @MockBean
    private SourceFeed sourceFeed;

    @Autowired
    private CategoryMergeEngine engine;

    @Autowired
    private SeasonAggregateGateway gateway;

    @BeforeEach
    void cleanTables() {
        gateway.resetAll();
    }

    private static RushingGameLine rush(String playerId, int yards) {
        return new RushingGameLine(new PlayerIdentity("12", "Kansas City Chiefs", playerId, "RB " + playerId, null),
                5, yards, 0, yards);
    }

    @Test
    @DisplayName("Erreur base au milieu d'un lot : le lot entier est annulé, les lots précédents restent")
    void mergeBatch_ShouldRollBackWholeBatchOnStorageFailure() {
        engine.mergeBatch(StatCategory.RUSHING, List.of(rush("p0", 10)));

        // player_id plus long que sa colonne : refusé par la base, jamais tronqué
        String rejectedId = "x".repeat(PlayerSeasonAggregate.Lengths.PLAYER_ID_LENGTH + 1);
        List<RushingGameLine> batch = List.of(rush("p0", 40), rush("p1", 25), rush(rejectedId, 3));

        assertThatThrownBy(() -> engine.mergeBatch(StatCategory.RUSHING, batch))
                .isInstanceOfSatisfying(StatsPersistenceException.class,
                        e -> assertThat(e.getCategory()).isEqualTo(StatCategory.RUSHING));

        RushingSeasonStats p0 = (RushingSeasonStats) gateway.getAggregate(StatCategory.RUSHING, "p0").orElseThrow();
        assertThat(p0.getRushingYards()).isEqualTo(10);
        assertThat(p0.getRushingAttempts()).isEqualTo(5);
        assertThat(gateway.getAggregate(StatCategory.RUSHING, "p1")).isEmpty();
        assertThat(gateway.count(StatCategory.RUSHING)).isEqualTo(1);
    }

    @Test
    @DisplayName("Après un lot annulé, le lot suivant s'applique normalement")
    void mergeBatch_ShouldAcceptNextBatchAfterRollback() {
        engine.mergeBatch(StatCategory.RUSHING, List.of(rush("p0", 10)));
        String rejectedId = "y".repeat(PlayerSeasonAggregate.Lengths.PLAYER_ID_LENGTH + 1);
        assertThatThrownBy(() -> engine.mergeBatch(StatCategory.RUSHING, List.of(rush("p0", 99), rush(rejectedId, 1))))
                .isInstanceOf(StatsPersistenceException.class);

        engine.mergeBatch(StatCategory.RUSHING, List.of(rush("p0", 15)));

        RushingSeasonStats p0 = (RushingSeasonStats) gateway.getAggregate(StatCategory.RUSHING, "p0").orElseThrow();
        assertThat(p0.getRushingYards()).isEqualTo(25);
        assertThat(p0.getLongestRun()).isEqualTo(15);
    }
}
