package com.novelforge.service.context;

/**
 * Token 估算：中文约每1.5字1个token，其他字符约每4个1个token
 *
 * 字符计数可累加，拼接后的总 token 数可由各部分计数精确求出
 */
public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(String text) {
        return count(text).tokens();
    }

    public static Count count(String text) {
        if (text == null || text.isEmpty()) {
            return Count.ZERO;
        }
        long cjk = 0;
        long other = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '一' && c <= '鿿') {
                cjk++;
            } else {
                other++;
            }
        }
        return new Count(cjk, other);
    }

    /**
     * 字符计数
     */
    public static final class Count {

        public static final Count ZERO = new Count(0, 0);

        private final long cjk;
        private final long other;

        public Count(long cjk, long other) {
            this.cjk = cjk;
            this.other = other;
        }

        public Count plus(Count that) {
            return new Count(cjk + that.cjk, other + that.other);
        }

        /**
         * ceil(cjk / 1.5 + other / 4) = ceil((8 * cjk + 3 * other) / 12)
         */
        public int tokens() {
            long numerator = 8 * cjk + 3 * other;
            return (int) ((numerator + 11) / 12);
        }
    }
}
