package com.tony.thunderAlley.model;

/**
 * Résultat du tirage de qualification : rang de la voiture au sein de son écurie (1 = meilleure).
 */
public record Qualifier(int carNumber, String driver, String team, int teamPosition) {
}
