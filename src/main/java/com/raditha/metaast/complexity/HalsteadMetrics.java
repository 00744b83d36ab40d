package com.raditha.metaast.complexity;

/**
 * Halstead software science measures.
 *
 * @param distinctOperators n1
 * @param distinctOperands  n2
 * @param totalOperators    N1
 * @param totalOperands     N2
 * @param vocabulary        n = n1 + n2
 * @param length            N = N1 + N2
 * @param volume            V = N * log2(n)
 * @param difficulty        D = (n1 / 2) * (N2 / n2)
 * @param effort            E = D * V
 */
public record HalsteadMetrics(
        int distinctOperators,
        int distinctOperands,
        int totalOperators,
        int totalOperands,
        int vocabulary,
        int length,
        double volume,
        double difficulty,
        double effort) {

    public static final HalsteadMetrics EMPTY = of(0, 0, 0, 0);

    /**
     * Derive all measures from the four basic counts. Zero vocabulary, length
     * or operand count yields 0.0 rather than a division error.
     */
    public static HalsteadMetrics of(int n1, int n2, int bigN1, int bigN2) {
        int vocabulary = n1 + n2;
        int length = bigN1 + bigN2;

        double volume = 0.0;
        if (vocabulary > 0 && length > 0) {
            volume = length * (Math.log(vocabulary) / Math.log(2));
        }

        double difficulty = 0.0;
        if (n1 > 0 && n2 > 0) {
            difficulty = (n1 / 2.0) * ((double) bigN2 / n2);
        }

        return new HalsteadMetrics(n1, n2, bigN1, bigN2, vocabulary, length, volume, difficulty,
                difficulty * volume);
    }

    /**
     * Field-wise maximum, used when merging results.
     */
    public HalsteadMetrics max(HalsteadMetrics other) {
        return new HalsteadMetrics(
                Math.max(distinctOperators, other.distinctOperators),
                Math.max(distinctOperands, other.distinctOperands),
                Math.max(totalOperators, other.totalOperators),
                Math.max(totalOperands, other.totalOperands),
                Math.max(vocabulary, other.vocabulary),
                Math.max(length, other.length),
                Math.max(volume, other.volume),
                Math.max(difficulty, other.difficulty),
                Math.max(effort, other.effort));
    }
}
