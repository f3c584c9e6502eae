package com.yerin.submitflow.domain;

import java.util.Locale;

/**
 * Package tier derived from the queue message priority.
 * Numeric priorities follow the queue convention: 1 is the most urgent.
 */
public enum PackageTier {
    STARTER(1.5, 0),
    GROWTH(1.0, 0),
    PRO(1.0, 0),
    ENTERPRISE(0.5, 500);

    private final double rateLimitFactor;
    private final long rateLimitFloorMillis;

    PackageTier(double rateLimitFactor, long rateLimitFloorMillis) {
        this.rateLimitFactor = rateLimitFactor;
        this.rateLimitFloorMillis = rateLimitFloorMillis;
    }

    public long adjustRateLimit(long baseMillis) {
        return Math.max((long) (baseMillis * rateLimitFactor), rateLimitFloorMillis);
    }

    public static PackageTier fromPriority(Object priority) {
        if (priority == null) return STARTER;
        if (priority instanceof Number n) return fromRank(n.intValue());

        String raw = priority.toString().trim();
        if (raw.isEmpty()) return STARTER;
        if (raw.chars().allMatch(Character::isDigit)) return fromRank(Integer.parseInt(raw));

        try {
            return PackageTier.valueOf(raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown priority: " + raw);
        }
    }

    private static PackageTier fromRank(int rank) {
        if (rank <= 1) return ENTERPRISE;
        if (rank == 2) return PRO;
        if (rank == 3) return GROWTH;
        return STARTER;
    }
}
