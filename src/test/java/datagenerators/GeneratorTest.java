package datagenerators;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GeneratorTest {

    @Test
    void sameSeed_sameText() {
        assertThat(Generator.generateZipf(1_000, 'a', 'z' + 1, 1.1, 42L))
                .isEqualTo(Generator.generateZipf(1_000, 'a', 'z' + 1, 1.1, 42L));
        assertThat(Generator.generateUniform(1_000, 'a', 'z' + 1, 42L))
                .isEqualTo(Generator.generateUniform(1_000, 'a', 'z' + 1, 42L));
    }

    @Test
    void charactersStayInsideTheDomain() {
        String zipf = Generator.generateZipf(5_000, 'a', 'f', 1.3, 1L);
        String uniform = Generator.generateUniform(5_000, 'a', 'f', 1L);

        assertThat(zipf).hasSize(5_000);
        assertThat(zipf.chars()).allMatch(c -> c >= 'a' && c < 'f');
        assertThat(uniform.chars()).allMatch(c -> c >= 'a' && c < 'f');
        // rank one is the most frequent symbol
        long as = zipf.chars().filter(c -> c == 'a').count();
        long es = zipf.chars().filter(c -> c == 'e').count();
        assertThat(as).isGreaterThan(es);
    }

    @Test
    void sampledKeywordsAreDistinctSubstringsOfTheText() {
        String text = Generator.generateUniform(2_000, 'a', 'h', 3L);

        List<String> keywords = Generator.sampleKeywords(text, 50, 3, 6, 3L);

        assertThat(keywords).hasSize(50).doesNotHaveDuplicates();
        assertThat(keywords).allSatisfy(k -> {
            assertThat(k.length()).isBetween(3, 6);
            assertThat(text).contains(k);
        });
    }

    @Test
    void sampling_returnsFewerWhenTheTextRunsOut() {
        assertThat(Generator.sampleKeywords("ab", 5, 3, 4, 1L)).isEmpty();
        assertThat(Generator.sampleKeywords("aaaa", 5, 2, 2, 1L)).containsExactly("aa");
    }

    @Test
    void invalidArgumentsAreRejected() {
        assertThatThrownBy(() -> Generator.generateUniform(-1, 'a', 'z', 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Generator.generateUniform(10, 'z', 'a', 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Generator.generateZipf(10, 'a', 'z', 0.0, 1L))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Generator.sampleKeywords("abc", 1, 0, 2, 1L))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
