package com.tony.gridironStats;

import com.tony.gridironStats.feed.SourceFeed;
import com.tony.gridironStats.service.merge.CategoryMergeEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class GridironStatsApplicationTest {

    @Autowired
    private CategoryMergeEngine mergeEngine;

    @Autowired
    private SourceFeed sourceFeed;

    @Test
    void contextLoads() {
        // Le moteur refuse de démarrer s'il manque une règle de fusion
        assertThat(mergeEngine).isNotNull();
        assertThat(sourceFeed).isNotNull();
    }
}
