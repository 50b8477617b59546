package fr.lapetina.ultra.comparison.domain.model;

/**
 * One mile of a runner's fatigue progression.
 */
public record FatiguePoint(double mile, double fatigueFactor, Double terrainDifficulty) {
}
