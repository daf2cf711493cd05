import PMIndex.AhoCorasickIndex;
import PMIndex.IMultiPatternIndex;
import PMIndex.RegexIndex;
import datagenerators.Generator;
import trie.TrieConfiguration;
import trie.transitions.TransitionStrategy;
import utilities.MatcherLogger;
import utilities.MemUtil;

import java.util.List;
import java.util.Locale;

/**
 * Benchmark driver: generates a Zipf-distributed text and a keyword set cut from it, then scans the
 * text with the Aho-Corasick index and with the per-keyword regex baseline. Command-line switches
 * override the defaults.
 */
public final class Main {

    private static final int DEFAULT_TEXT_LEN = 1 << 20;
    private static final int DEFAULT_MIN_DOMAIN = 'a';
    private static final int DEFAULT_ALPHABET = 26;
    private static final double DEFAULT_EXPONENT = 1.1;
    private static final int DEFAULT_KEYWORDS = 200;
    private static final int DEFAULT_MIN_LEN = 3;
    private static final int DEFAULT_MAX_LEN = 8;
    private static final int DEFAULT_RUNS = 3;
    private static final long DEFAULT_SEED = 42L;

    private Main() {
    }

    public static void main(String[] args) {
        CliOptions options = CliOptions.parse(args);

        String text = Generator.generateZipf(options.textLength, DEFAULT_MIN_DOMAIN,
                DEFAULT_MIN_DOMAIN + options.alphabet, options.exponent, options.seed);
        List<String> keywords = Generator.sampleKeywords(text, options.keywords,
                options.minLength, options.maxLength, options.seed);

        System.out.printf(Locale.ROOT,
                "Text: %d chars  Alphabet: %d  Zipf: %.2f  Keywords: %d (len %d-%d)  Strategy: %s%n",
                text.length(), options.alphabet, options.exponent, keywords.size(),
                options.minLength, options.maxLength, options.strategy);

        TrieConfiguration configuration = TrieConfiguration.builder()
                .transitionStrategy(options.strategy)
                .storeStatesInBfsOrder(options.bfsOrder)
                .build();

        double acTotalMs = 0;
        double regexTotalMs = 0;
        int acMatches = 0;
        int regexMatches = 0;
        AhoCorasickIndex ac = null;

        for (int run = 0; run < options.runs; run++) {
            ac = new AhoCorasickIndex(configuration);
            long t0 = System.nanoTime();
            insertAll(ac, keywords);
            ac.trie();
            double buildMs = (System.nanoTime() - t0) / 1e6;

            t0 = System.nanoTime();
            acMatches = ac.report(text).size();
            double acMs = (System.nanoTime() - t0) / 1e6;

            IMultiPatternIndex regex = new RegexIndex();
            insertAll(regex, keywords);
            t0 = System.nanoTime();
            regexMatches = regex.report(text).size();
            double regexMs = (System.nanoTime() - t0) / 1e6;

            System.out.printf(Locale.ROOT,
                    "Run %d: build %.2f ms, Aho-Corasick %.2f ms (%d matches), regex %.2f ms (%d matches)%n",
                    run, buildMs, acMs, acMatches, regexMs, regexMatches);
            acTotalMs += acMs;
            regexTotalMs += regexMs;
        }

        if (options.runs > 0) {
            System.out.printf(Locale.ROOT, "Avg Aho-Corasick: %.3f ms%n", acTotalMs / options.runs);
            System.out.printf(Locale.ROOT, "Avg regex: %.3f ms%n", regexTotalMs / options.runs);
            if (acMatches != regexMatches) {
                MatcherLogger.warning("Match counts differ: Aho-Corasick=" + acMatches + " regex=" + regexMatches);
            }
        }

        if (options.memory && ac != null) {
            System.out.println(new MemUtil().jolMemoryReport(false, ac.trie()));
            System.out.println(new MemUtil().jolMemoryReportPartitioned(ac.trie()));
        }
    }

    private static void insertAll(IMultiPatternIndex index, List<String> keywords) {
        for (String keyword : keywords) {
            index.insert(keyword);
        }
    }

    static final class CliOptions {
        final int textLength;
        final int alphabet;
        final double exponent;
        final int keywords;
        final int minLength;
        final int maxLength;
        final int runs;
        final long seed;
        final TransitionStrategy strategy;
        final boolean bfsOrder;
        final boolean memory;

        private CliOptions(int textLength,
                           int alphabet,
                           double exponent,
                           int keywords,
                           int minLength,
                           int maxLength,
                           int runs,
                           long seed,
                           TransitionStrategy strategy,
                           boolean bfsOrder,
                           boolean memory) {
            this.textLength = textLength;
            this.alphabet = alphabet;
            this.exponent = exponent;
            this.keywords = keywords;
            this.minLength = minLength;
            this.maxLength = maxLength;
            this.runs = runs;
            this.seed = seed;
            this.strategy = strategy;
            this.bfsOrder = bfsOrder;
            this.memory = memory;
        }

        static CliOptions parse(String[] args) {
            int textLength = DEFAULT_TEXT_LEN;
            int alphabet = DEFAULT_ALPHABET;
            double exponent = DEFAULT_EXPONENT;
            int keywords = DEFAULT_KEYWORDS;
            int minLength = DEFAULT_MIN_LEN;
            int maxLength = DEFAULT_MAX_LEN;
            int runs = DEFAULT_RUNS;
            long seed = DEFAULT_SEED;
            TransitionStrategy strategy = TransitionStrategy.SPARSE;
            boolean bfsOrder = false;
            boolean memory = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (key.equals("memory") || key.equals("bfs-order")) {
                        value = "true";
                    } else {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for option --" + key);
                        }
                        value = args[++i];
                    }
                }
                switch (key) {
                    case "text" -> textLength = Integer.parseInt(value);
                    case "alphabet" -> alphabet = Integer.parseInt(value);
                    case "zipf" -> exponent = Double.parseDouble(value);
                    case "keywords" -> keywords = Integer.parseInt(value);
                    case "lengths" -> {
                        String[] bounds = value.split("[-:]");
                        if (bounds.length == 2) {
                            minLength = Integer.parseInt(bounds[0]);
                            maxLength = Integer.parseInt(bounds[1]);
                        } else {
                            int parsed = Integer.parseInt(value);
                            minLength = parsed;
                            maxLength = parsed;
                        }
                    }
                    case "runs" -> runs = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "strategy" -> strategy = TransitionStrategy.valueOf(value.toUpperCase(Locale.ROOT));
                    case "bfs-order" -> bfsOrder = Boolean.parseBoolean(value);
                    case "memory" -> memory = Boolean.parseBoolean(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            if (textLength <= 0 || alphabet <= 0 || keywords < 0 || runs < 0) {
                throw new IllegalArgumentException("text, alphabet must be positive; keywords, runs nonnegative");
            }
            if (strategy == TransitionStrategy.DENSE_BYTE && DEFAULT_MIN_DOMAIN + alphabet > 256) {
                throw new IllegalArgumentException("dense byte strategy needs an alphabet ending below 256");
            }
            return new CliOptions(textLength, alphabet, exponent, keywords, minLength, maxLength,
                    runs, seed, strategy, bfsOrder, memory);
        }
    }
}
