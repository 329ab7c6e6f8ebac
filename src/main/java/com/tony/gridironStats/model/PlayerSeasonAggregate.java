package com.tony.gridironStats.model;

import com.opencsv.bean.CsvIgnore;
import com.tony.gridironStats.model.game.PlayerIdentity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Cumul saison d'un joueur pour une catégorie. Une ligne par player_id et par table.
 */
@MappedSuperclass
@Getter @Setter
public abstract class PlayerSeasonAggregate {

    @Id
    @CsvIgnore
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // Jamais tronqué : deux joueurs distincts ne doivent pas partager une ligne
    @Column(name = "player_id", nullable = false, unique = true, length = Lengths.PLAYER_ID_LENGTH)
    private String playerId;

    // --- Identité (dernier match traité, jamais cumulée) ---
    @Column(length = Lengths.TEAM_ID_LENGTH)
    private String teamId;
    @Column(length = Lengths.NAME_LENGTH)
    private String teamName;
    @Column(length = Lengths.NAME_LENGTH)
    private String playerName;

    @Column(name = "player_headshot_url", length = Lengths.HEADSHOT_URL_LENGTH)
    private String playerHeadshotUrl;

    // Hors export CSV : horodatage technique
    @CsvIgnore
    private LocalDateTime createdAt;
    @CsvIgnore
    private LocalDateTime updatedAt;

    public abstract StatCategory getCategory();

    /**
     * Écrase l'identité avec celle du match entrant (transfert, correction de nom...).
     * Les champs d'affichage trop longs sont coupés à la taille de leur colonne.
     */
    public void applyIdentity(PlayerIdentity identity) {
        this.playerId = identity.playerId();
        this.teamId = fit(identity.teamId(), Lengths.TEAM_ID_LENGTH);
        this.teamName = fit(identity.teamName(), Lengths.NAME_LENGTH);
        this.playerName = fit(identity.playerName(), Lengths.NAME_LENGTH);
        this.playerHeadshotUrl = fit(identity.headshotUrl(), Lengths.HEADSHOT_URL_LENGTH);
    }

    private static String fit(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) return value;
        return value.substring(0, maxLength);
    }

    @PrePersist
    void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    // Même approche que Team : égalité sur l'ID seulement
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id != null && id.equals(((PlayerSeasonAggregate) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }

    /**
     * Tailles des colonnes d'identité (hors de l'entité pour ne pas apparaître dans l'export CSV).
     */
    public static final class Lengths {
        public static final int PLAYER_ID_LENGTH = 64;
        public static final int TEAM_ID_LENGTH = 32;
        public static final int NAME_LENGTH = 128;
        public static final int HEADSHOT_URL_LENGTH = 512;

        private Lengths() {
        }
    }
}
