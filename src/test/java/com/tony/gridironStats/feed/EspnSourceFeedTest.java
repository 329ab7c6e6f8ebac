package com.tony.gridironStats.feed;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.gridironStats.config.EspnProperties;
import com.tony.gridironStats.exception.SourceFetchException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EspnSourceFeedTest {

    @Mock
    private RestTemplate restTemplate;

    private EspnSourceFeed feed;

    @BeforeEach
    void setUp() {
        EspnProperties properties = new EspnProperties();
        properties.setRequestDelayMs(0);
        feed = new EspnSourceFeed(properties, restTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Les gameId sont lus dans la colonne teams, sans doublon et dans l'ordre de la page")
    void parseGameIds_ShouldExtractDistinctIdsInPageOrder() {
        Document doc = Jsoup.parse("""
                <table>
                  <tr>
                    <td class="events__col Table__TD"><a href="/nfl/team/_/name/kc">KC</a></td>
                    <td class="teams__col Table__TD"><a href="/nfl/game/_/gameId/401772510/chiefs-ravens">KC 27, BAL 20</a></td>
                  </tr>
                  <tr>
                    <td class="teams__col Table__TD">
                      <a href="/nfl/game/_/gameId/401772511">BUF 31, NYJ 10</a>
                      <a href="/nfl/game/_/gameId/401772511/bills-jets">Recap</a>
                    </td>
                  </tr>
                  <tr>
                    <td class="teams__col Table__TD"><a href="/nfl/tickets">Tickets</a></td>
                  </tr>
                </table>
                """);

        assertThat(feed.parseGameIds(doc)).containsExactly("401772510", "401772511");
    }

    @Test
    void parseGameIds_ShouldReturnEmptyListForByeWeekPage() {
        assertThat(feed.parseGameIds(Jsoup.parse("<html><body><p>No games</p></body></html>"))).isEmpty();
    }

    @Test
    void fetchGamePayload_ShouldParseJsonBody() {
        when(restTemplate.getForObject(anyString(), eq(String.class)))
                .thenReturn("{\"boxscore\": {\"players\": []}}");

        JsonNode payload = feed.fetchGamePayload("401772510");

        assertThat(payload.path("boxscore").path("players").isArray()).isTrue();
    }

    @Test
    @DisplayName("Erreurs HTTP et JSON illisible -> SourceFetchException")
    void fetchGamePayload_ShouldWrapSourceErrors() {
        when(restTemplate.getForObject(anyString(), eq(String.class)))
                .thenThrow(new ResourceAccessException("Read timed out"))
                .thenReturn("{not json")
                .thenReturn("");

        assertThatThrownBy(() -> feed.fetchGamePayload("1")).isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("Read timed out");
        assertThatThrownBy(() -> feed.fetchGamePayload("2")).isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("JSON illisible");
        assertThatThrownBy(() -> feed.fetchGamePayload("3")).isInstanceOf(SourceFetchException.class)
                .hasMessageContaining("vide");
    }

    @Test
    void fetchGamePayload_ShouldBuildSummaryUrlFromGameId() {
        when(restTemplate.getForObject(anyString(), eq(String.class))).thenAnswer(invocation -> {
            String url = invocation.getArgument(0);
            assertThat(url).endsWith("event=401772510");
            return "{}";
        });

        assertThat(feed.fetchGamePayload("401772510")).isNotNull();
    }
}
