package com.tony.thunderAlley.model;

/**
 * Une voiture inscrite au roster : numéro, pilote et écurie.
 */
public record Car(int carNumber, String driver, String team) {
}
