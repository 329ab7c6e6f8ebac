package com.tony.gridironStats.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Paramètres de la compilation automatique (job planifié).
 */
@Configuration
@ConfigurationProperties(prefix = "compilation")
@Validated
@Data
public class CompilationProperties {
    @Min(value = 1, message = "compilation.season doit être une année valide")
    private int season = 2025;

    @Min(value = 1, message = "compilation.end-week doit être >= 1")
    @Max(value = 18, message = "compilation.end-week ne peut pas dépasser 18")
    private int endWeek = 7;

    @Min(1) @Max(3)
    private int seasonType = 2; // 1 = preseason, 2 = regular season, 3 = playoffs
}
