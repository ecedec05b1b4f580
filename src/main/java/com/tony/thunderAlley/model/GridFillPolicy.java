package com.tony.thunderAlley.model;

/**
 * Que faire des places d'une écurie non couvertes par ses qualifiés.
 */
public enum GridFillPolicy {
    /** Compléter par un tirage uniforme parmi les voitures non qualifiées du roster. */
    FILL_RANDOM,
    /** Laisser la place vide. */
    SKIP
}
