package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// Synthetic texts and keyword sets for benchmarks and randomized tests.
public final class Generator {

    private Generator() {
    }

    public static String generateUniform(int length, int minDomain, int maxDomain, long seed) {
        validate(length, minDomain, maxDomain);
        RandomGenerator rng = new Well19937c(seed);
        int alphabetSize = maxDomain - minDomain;
        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            chars[i] = (char) (minDomain + rng.nextInt(alphabetSize));
        }
        return new String(chars);
    }

    /**
     * Text whose characters follow a Zipf law over the half open code range
     * [minDomain, maxDomain): the first code is the most frequent.
     */
    public static String generateZipf(int length,
                                      int minDomain,
                                      int maxDomain,
                                      double exponent,
                                      long seed) {
        validate(length, minDomain, maxDomain);
        if (!(exponent > 0.0)) {
            throw new IllegalArgumentException("exponent must be positive");
        }

        // Seeded random number generator for reproducibility
        RandomGenerator rng = new Well19937c(seed);

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, maxDomain - minDomain, exponent);

        char[] chars = new char[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();
            chars[i] = (char) (minDomain + (rank - 1));
        }
        return new String(chars);
    }

    /**
     * Up to {@code count} distinct keywords cut from random positions of {@code text}, with lengths
     * drawn uniformly from [minLength, maxLength]. Fewer come back when the text does not hold
     * enough distinct substrings.
     */
    public static List<String> sampleKeywords(String text, int count, int minLength, int maxLength, long seed) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be nonnegative");
        }
        if (minLength <= 0 || maxLength < minLength) {
            throw new IllegalArgumentException("need 0 < minLength <= maxLength");
        }
        if (text.length() < minLength) {
            return new ArrayList<>();
        }

        RandomGenerator rng = new Well19937c(seed);
        Set<String> keywords = new LinkedHashSet<>();
        int attempts = 0;
        int maxAttempts = Math.max(16, count * 8);
        while (keywords.size() < count && attempts++ < maxAttempts) {
            int len = minLength + rng.nextInt(Math.min(maxLength, text.length()) - minLength + 1);
            int start = rng.nextInt(text.length() - len + 1);
            keywords.add(text.substring(start, start + len));
        }
        return new ArrayList<>(keywords);
    }

    private static void validate(int length, int minDomain, int maxDomain) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be nonnegative");
        }
        if (minDomain < Character.MIN_VALUE) {
            throw new IllegalArgumentException("minDomain < Character.MIN_VALUE");
        }
        if (maxDomain <= minDomain) {
            throw new IllegalArgumentException("maxDomain must be greater than minDomain");
        }
        if (maxDomain - 1 > Character.MAX_VALUE) {
            throw new IllegalArgumentException("maxDomain - 1 exceeds Character.MAX_VALUE");
        }
    }
}
