package com.tony.gridironStats.service.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.gridironStats.model.StatCategory;
import com.tony.gridironStats.model.game.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BoxScoreExtractorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final BoxScoreExtractor extractor = new BoxScoreExtractor();

    // Extrait réduit d'un résumé ESPN : deux équipes, groupes suivis + "kicking" non suivi
    private static final String SUMMARY = """
            {
              "boxscore": {
                "players": [
                  {
                    "team": { "id": "12", "displayName": "Kansas City Chiefs" },
                    "statistics": [
                      {
                        "name": "passing",
                        "athletes": [
                          {
                            "athlete": { "id": "3139477", "displayName": "Patrick Mahomes",
                                         "headshot": { "href": "https://a.espncdn.com/i/headshots/nfl/players/full/3139477.png" } },
                            "stats": ["23/35", "1,287", "7.2", "3", "1", "2-14", "104.5"]
                          }
                        ]
                      },
                      {
                        "name": "rushing",
                        "athletes": [
                          {
                            "athlete": { "id": "4361529", "displayName": "Isiah Pacheco" },
                            "stats": [18, 87, 4.8, 1, "31"]
                          }
                        ]
                      },
                      {
                        "name": "kicking",
                        "athletes": [
                          { "athlete": { "id": "15683", "displayName": "Harrison Butker" }, "stats": ["2/2", "100.0", "51"] }
                        ]
                      }
                    ]
                  },
                  {
                    "team": { "id": "33", "displayName": "Baltimore Ravens" },
                    "statistics": [
                      {
                        "name": "receiving",
                        "athletes": [
                          {
                            "athlete": { "id": "4035687", "displayName": "Zay Flowers" },
                            "stats": ["6", "72"]
                          }
                        ]
                      },
                      {
                        "name": "defensive",
                        "athletes": [
                          {
                            "athlete": { "id": "4362887", "displayName": "Kyle Hamilton" },
                            "stats": ["9", "7", "1.5", "2", "1", "2", "0"]
                          }
                        ]
                      }
                    ]
                  }
                ]
              }
            }
            """;

    @Test
    @DisplayName("Les positions du box-score alimentent les bons champs")
    void extract_ShouldMapPositionalTokens() throws Exception {
        GameStatLines lines = extractor.extract(mapper.readTree(SUMMARY));

        assertThat(lines.get(StatCategory.PASSING)).hasSize(1);
        PassingGameLine qb = (PassingGameLine) lines.get(StatCategory.PASSING).get(0);
        assertThat(qb.completionsAttempts()).isEqualTo("23/35"); // composite gardé tel quel
        assertThat(qb.passingYards()).isEqualTo(1287);
        assertThat(qb.passingTouchdowns()).isEqualTo(3);
        assertThat(qb.interceptions()).isEqualTo(1);
        assertThat(qb.sacks()).isNull(); // "2-14" est un composite, pas un entier
        assertThat(qb.identity()).isEqualTo(new PlayerIdentity("12", "Kansas City Chiefs", "3139477",
                "Patrick Mahomes", "https://a.espncdn.com/i/headshots/nfl/players/full/3139477.png"));

        RushingGameLine rb = (RushingGameLine) lines.get(StatCategory.RUSHING).get(0);
        assertThat(rb.rushingAttempts()).isEqualTo(18);
        assertThat(rb.rushingYards()).isEqualTo(87);
        assertThat(rb.rushingTouchdowns()).isEqualTo(1);
        assertThat(rb.longestRun()).isEqualTo(31);
        assertThat(rb.identity().headshotUrl()).isNull();

        DefensiveGameLine def = (DefensiveGameLine) lines.get(StatCategory.DEFENSIVE).get(0);
        assertThat(def.totalTackles()).isEqualTo(9);
        assertThat(def.sacks()).isEqualTo(1); // 1.5 tronqué
        assertThat(def.defensiveTouchdowns()).isZero();
        assertThat(def.identity().teamName()).isEqualTo("Baltimore Ravens");
    }

    @Test
    @DisplayName("Une ligne trop courte donne des champs null, pas une erreur")
    void extract_ShouldLeaveMissingPositionsNull() throws Exception {
        GameStatLines lines = extractor.extract(mapper.readTree(SUMMARY));

        ReceivingGameLine wr = (ReceivingGameLine) lines.get(StatCategory.RECEIVING).get(0);
        assertThat(wr.receptions()).isEqualTo(6);
        assertThat(wr.receivingYards()).isEqualTo(72);
        assertThat(wr.receivingTouchdowns()).isNull();
        assertThat(wr.longestReception()).isNull();
        assertThat(wr.targets()).isNull();
    }

    @Test
    @DisplayName("Les groupes non suivis sont ignorés, les catégories absentes restent vides")
    void extract_ShouldIgnoreUnknownGroups() throws Exception {
        GameStatLines lines = extractor.extract(mapper.readTree(SUMMARY));

        assertThat(lines.size()).isEqualTo(4);
        assertThat(lines.get(StatCategory.FUMBLES)).isEmpty();
        assertThat(lines.get(StatCategory.INTERCEPTIONS)).isEmpty();
    }

    @Test
    void extract_ShouldReturnEmptyLinesWithoutBoxscore() throws Exception {
        assertThat(extractor.extract(mapper.readTree("{\"header\": {}}")).isEmpty()).isTrue();
        assertThat(extractor.extract(null).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Un athlète sans id est extrait avec playerId null")
    void extract_ShouldKeepAthleteWithoutId() throws Exception {
        JsonNode summary = mapper.readTree("""
                {"boxscore": {"players": [{"team": {"id": "1"}, "statistics": [
                  {"name": "fumbles", "athletes": [{"athlete": {"displayName": "Inconnu"}, "stats": ["1", "0", "0"]}]}
                ]}]}}
                """);

        FumbleGameLine line = (FumbleGameLine) extractor.extract(summary).get(StatCategory.FUMBLES).get(0);
        assertThat(line.playerId()).isNull();
        assertThat(line.fumbles()).isEqualTo(1);
        assertThat(line.identity().teamName()).isNull();
    }
}
