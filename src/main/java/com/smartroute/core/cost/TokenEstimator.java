package com.smartroute.core.cost;

/**
 * Rough token counts from character counts. CJK ideographs average about 1.5
 * characters per token, everything else about 4.
 */
public final class TokenEstimator {

    private TokenEstimator() {} // utility class

    public static int inputTokens(String content) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        long cjk = content.codePoints().filter(TokenEstimator::isCjk).count();
        long other = content.codePoints().count() - cjk;
        return (int) (cjk / 1.5 + other / 4.0);
    }

    public static int outputTokens(int inputTokens, double multiplier) {
        return (int) Math.floor(inputTokens * multiplier);
    }

    static boolean isCjk(int codePoint) {
        return codePoint >= 0x4E00 && codePoint <= 0x9FFF;
    }
}
