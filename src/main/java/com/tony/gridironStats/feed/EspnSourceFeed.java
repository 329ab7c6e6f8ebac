package com.tony.gridironStats.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.gridironStats.config.EspnProperties;
import com.tony.gridironStats.exception.SourceFetchException;
import com.tony.gridironStats.model.SeasonType;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@Slf4j
public class EspnSourceFeed implements SourceFeed {

    private static final String GAME_ID_MARKER = "gameId/";

    private final EspnProperties properties;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    private long lastRequestTime = 0;

    public EspnSourceFeed(EspnProperties properties, RestTemplate espnRestTemplate, ObjectMapper objectMapper) {
        this.properties = properties;
        this.restTemplate = espnRestTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<String> discoverGames(int season, int week, SeasonType seasonType) {
        String url = properties.getScheduleUrl()
                .replace("{week}", String.valueOf(week))
                .replace("{season}", String.valueOf(season))
                .replace("{seasonType}", String.valueOf(seasonType.getCode()));

        try {
            respectRateLimit();
            log.debug("🌐 Calendrier ESPN : {}", url);
            Document doc = Jsoup.connect(url)
                    .userAgent(properties.getUserAgent())
                    .timeout(properties.getTimeoutMs())
                    .get();
            return parseGameIds(doc);
        } catch (IOException e) {
            throw new SourceFetchException("Calendrier indisponible (" + url + ") : " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Récupération du calendrier interrompue", e);
        }
    }

    /**
     * Les liens de match sont dans la colonne "teams" : .../game/_/gameId/401772510/...
     */
    List<String> parseGameIds(Document doc) {
        Set<String> ids = new LinkedHashSet<>(); // une ligne peut contenir plusieurs liens vers le même match
        for (Element link : doc.select("td.teams__col.Table__TD a[href]")) {
            String href = link.attr("href");
            int pos = href.indexOf(GAME_ID_MARKER);
            if (pos < 0) continue;
            String id = href.substring(pos + GAME_ID_MARKER.length()).split("/")[0];
            if (!id.isBlank()) ids.add(id);
        }
        return new ArrayList<>(ids);
    }

    @Override
    public JsonNode fetchGamePayload(String gameId) {
        String url = properties.getSummaryUrl().replace("{gameId}", gameId);
        try {
            respectRateLimit();
            String body = restTemplate.getForObject(url, String.class);
            if (body == null || body.isBlank()) {
                throw new SourceFetchException("Résumé vide pour le match " + gameId);
            }
            return objectMapper.readTree(body);
        } catch (RestClientException e) {
            throw new SourceFetchException("Résumé indisponible pour le match " + gameId + " : " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException("JSON illisible pour le match " + gameId + " : " + e.getOriginalMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException("Récupération du match " + gameId + " interrompue", e);
        }
    }

    private synchronized void respectRateLimit() throws InterruptedException {
        long now = System.currentTimeMillis();
        long elapsed = now - lastRequestTime;
        if (elapsed < properties.getRequestDelayMs()) {
            Thread.sleep(properties.getRequestDelayMs() - elapsed);
        }
        lastRequestTime = System.currentTimeMillis();
    }
}
