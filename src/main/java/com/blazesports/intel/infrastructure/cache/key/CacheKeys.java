package com.blazesports.intel.infrastructure.cache.key;

import java.time.LocalDate;

/**
 * Standard cache keys for sports data
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String liveScores(String sport) {
        return "scores:live:" + sport;
    }

    public static String standings(String sport) {
        return standings(sport, null);
    }

    public static String standings(String sport, String conference) {
        return "standings:" + sport + ":" + (conference != null ? conference : "all");
    }

    public static String rankings(String sport) {
        return rankings(sport, "latest");
    }

    public static String rankings(String sport, String poll) {
        return "rankings:" + sport + ":" + poll;
    }

    public static String schedule(String sport, LocalDate date) {
        return "schedule:" + sport + ":" + date;
    }

    public static String team(String teamId) {
        return "team:" + teamId;
    }

    public static String player(String playerId) {
        return "player:" + playerId;
    }

    public static String game(String gameId) {
        return "game:" + gameId;
    }

    public static String boxscore(String gameId) {
        return "boxscore:" + gameId;
    }
}
