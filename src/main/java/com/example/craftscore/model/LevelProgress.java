package com.example.craftscore.model;

/**
 * Position of a score between the current level floor and the next one.
 *
 * @param progressPercentage 0-100
 * @param pointsToNext       Points still missing to reach the next level, never negative
 * @param nextLevelThreshold Floor of the next level (100 at master)
 */
public record LevelProgress(int progressPercentage, int pointsToNext, int nextLevelThreshold) {

    public static final LevelProgress MAXED = new LevelProgress(100, 0, 100);
}
