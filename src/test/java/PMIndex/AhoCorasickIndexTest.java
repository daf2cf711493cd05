package PMIndex;

import datagenerators.Generator;
import org.junit.jupiter.api.Test;
import search.Emit;
import search.Token;
import trie.Trie;
import trie.TrieConfiguration;
import utilities.MatcherLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AhoCorasickIndexTest {

    @Test
    void automatonIsBuiltOnFirstQuery() {
        AhoCorasickIndex index = new AhoCorasickIndex();
        index.insert("he");
        index.insert("she");

        assertThat(index.isBuilt()).isFalse();
        assertThat(index.numKeywords()).isEqualTo(2);

        assertThat(index.report("ushers")).containsExactly(
                new Emit(1, 3, "she", 1),
                new Emit(2, 3, "he", 0));
        assertThat(index.isBuilt()).isTrue();
        assertThat(index.numKeywords()).isEqualTo(2);
        assertThat(index.containsMatch("ahem")).isTrue();
    }

    @Test
    void firstQueryLogsTheBuildSummaryAtInfo() {
        List<LogRecord> records = new ArrayList<>();
        Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        Logger logger = Logger.getLogger(MatcherLogger.class.getName());
        logger.addHandler(capture);
        try {
            AhoCorasickIndex index = new AhoCorasickIndex();
            index.insert("he");
            index.insert("she");
            index.report("ushers");
            index.report("ushers");
        } finally {
            logger.removeHandler(capture);
        }

        assertThat(records)
                .filteredOn(r -> r.getLevel() == Level.INFO)
                .extracting(LogRecord::getMessage)
                .singleElement()
                .asString()
                .contains("2 keywords", "6 states");
    }

    @Test
    void insertAfterFirstQueryFails() {
        AhoCorasickIndex index = new AhoCorasickIndex();
        index.insert("abc");
        index.report("xabcx");

        assertThatThrownBy(() -> index.insert("def"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void tokenizeUsesTheConfiguredPolicy() {
        AhoCorasickIndex index = new AhoCorasickIndex(TrieConfiguration.builder().removeOverlaps().build());
        index.insert("he");
        index.insert("she");
        index.insert("hers");
        index.insert("his");

        List<Token> tokens = index.tokenize("ushers");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0).getFragment()).isEqualTo("u");
        assertThat(tokens.get(1).getEmit()).isEqualTo(new Emit(2, 5, "hers", 2));
    }

    @Test
    void concurrentFirstQueriesShareOneAutomaton() throws Exception {
        AhoCorasickIndex index = new AhoCorasickIndex();
        for (String keyword : List.of("he", "she", "hers", "his")) {
            index.insert(keyword);
        }

        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Trie>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    assertThat(index.report("ushers")).hasSize(3);
                    return index.trie();
                }));
            }
            start.countDown();

            Trie first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<Trie> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void reportsTheSameMatchesAsTheRegexBaseline() {
        String text = Generator.generateZipf(10_000, 'a', 'a' + 8, 1.0, 21L);
        List<String> keywords = Generator.sampleKeywords(text, 80, 2, 7, 4L);

        IMultiPatternIndex ac = new AhoCorasickIndex();
        IMultiPatternIndex regex = new RegexIndex();
        for (String keyword : keywords) {
            ac.insert(keyword);
            regex.insert(keyword);
        }

        assertThat(ac.numKeywords()).isEqualTo(regex.numKeywords());
        assertThat(ac.report(text)).isEqualTo(regex.report(text));
    }

    @Test
    void caseInsensitiveMatchesAgreeWithTheRegexBaseline() {
        String lower = Generator.generateUniform(3_000, 'a', 'a' + 3, 8L);
        List<String> keywords = Generator.sampleKeywords(lower, 20, 2, 4, 2L);
        String text = lower.toUpperCase(Locale.ROOT);

        IMultiPatternIndex ac = new AhoCorasickIndex(TrieConfiguration.builder().caseInsensitive().build());
        IMultiPatternIndex regex = new RegexIndex(true);
        for (String keyword : keywords) {
            ac.insert(keyword);
            regex.insert(keyword);
        }

        List<Emit> emits = ac.report(text);
        assertThat(emits).isNotEmpty();
        assertThat(emits).isEqualTo(regex.report(text));
    }

    @Test
    void regexBaselineRejectsEmptyAndDuplicateKeywords() {
        RegexIndex regex = new RegexIndex();

        assertThat(regex.insert("")).isFalse();
        assertThat(regex.insert("aa")).isTrue();
        assertThat(regex.insert("aa")).isFalse();
        assertThat(regex.report("aaa")).containsExactly(
                new Emit(0, 1, "aa", 0),
                new Emit(1, 2, "aa", 0));
    }
}
