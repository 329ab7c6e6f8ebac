package com.tony.gridironStats.model.game;

/**
 * Identité d'un joueur telle qu'affichée dans le box-score du match.
 * Ces champs ne se cumulent pas : le dernier match traité fait foi.
 */
public record PlayerIdentity(String teamId, String teamName, String playerId, String playerName, String headshotUrl) {
}
