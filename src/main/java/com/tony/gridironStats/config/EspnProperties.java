package com.tony.gridironStats.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "espn")
@Validated
@Data
public class EspnProperties {
    // --- URLs (placeholders : {week}, {season}, {seasonType}, {gameId}) ---
    @NotBlank(message = "L'URL du calendrier ESPN est requise")
    private String scheduleUrl = "https://www.espn.com/nfl/schedule/_/week/{week}/year/{season}/seasontype/{seasonType}";
    @NotBlank(message = "L'URL du résumé de match ESPN est requise")
    private String summaryUrl = "https://site.web.api.espn.com/apis/site/v2/sports/football/nfl/summary?region=us&lang=en&contentorigin=espn&event={gameId}";

    // ESPN renvoie une page vide aux clients sans User-Agent de navigateur
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/115.0.0.0 Safari/537.36";

    @Min(1000)
    private int timeoutMs = 30000;

    // Délai minimum entre deux requêtes (évite le HTTP 429)
    @Min(0)
    private long requestDelayMs = 500;
}
