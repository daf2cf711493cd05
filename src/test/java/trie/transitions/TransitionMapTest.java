package trie.transitions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransitionMapTest {

    @ParameterizedTest
    @EnumSource(TransitionStrategy.class)
    void putAndGet_roundTripsAndMissesReturnNoTransition(TransitionStrategy strategy) {
        TransitionMap map = strategy.newMap();

        assertThat(map.isEmpty()).isTrue();
        assertThat(map.get('a')).isEqualTo(TransitionMap.NO_TRANSITION);

        map.put('c', 3);
        map.put('a', 1);
        map.put('b', 2);
        map.put('z', 26);

        assertThat(map.size()).isEqualTo(4);
        assertThat(map.get('a')).isEqualTo(1);
        assertThat(map.get('b')).isEqualTo(2);
        assertThat(map.get('c')).isEqualTo(3);
        assertThat(map.get('z')).isEqualTo(26);
        assertThat(map.get('d')).isEqualTo(TransitionMap.NO_TRANSITION);
    }

    @ParameterizedTest
    @EnumSource(TransitionStrategy.class)
    void transitions_areEnumeratedInAscendingOrder(TransitionStrategy strategy) {
        TransitionMap map = strategy.newMap();
        for (char c : "qwertyuiop".toCharArray()) {
            map.put(c, c);
        }
        map.freeze();

        assertThat(map.transitions()).containsExactly("eiopqrtuwy".toCharArray());
        assertThat(map.get('w')).isEqualTo((int) 'w');
    }

    @ParameterizedTest
    @EnumSource(TransitionStrategy.class)
    void put_replacesExistingTargetWithoutGrowing(TransitionStrategy strategy) {
        TransitionMap map = strategy.newMap();
        map.put('x', 5);
        map.put('x', 7);

        assertThat(map.size()).isEqualTo(1);
        assertThat(map.get('x')).isEqualTo(7);
        assertThat(map.transitions()).containsExactly('x');
    }

    @Test
    void compactMap_keepsAnswersAcrossPromotion() {
        // third child moves the two inline edges into the hash map
        CompactTransitionMap map = new CompactTransitionMap();
        map.put('b', 10);
        map.put('a', 20);
        assertThat(map.transitions()).containsExactly('a', 'b');

        map.put('c', 30);
        assertThat(map.size()).isEqualTo(3);
        assertThat(map.get('a')).isEqualTo(20);
        assertThat(map.get('b')).isEqualTo(10);
        assertThat(map.get('c')).isEqualTo(30);
        assertThat(map.transitions()).containsExactly('a', 'b', 'c');
    }

    @Test
    void denseMap_rejectsCharactersOutsideTheByteAlphabet() {
        DenseByteTransitionMap map = new DenseByteTransitionMap();

        assertThat(map.supports('\u00ff')).isTrue();
        assertThat(map.supports('\u0100')).isFalse();
        assertThatThrownBy(() -> map.put('日', 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("U+65E5");
        // lookups of such characters simply miss
        assertThat(map.get('日')).isEqualTo(TransitionMap.NO_TRANSITION);
    }

    @Test
    void sparseAndCompactMaps_acceptAnyCharacter() {
        assertThat(new SparseTransitionMap().supports('\uffff')).isTrue();
        assertThat(new CompactTransitionMap().supports('日')).isTrue();
    }
}
