package orderedmap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class OrderedMapTest extends OrderedMapLoggingConfig {

    @Nested
    class Mutation {

        @Test
        void setAndGet() {
            var o = new OrderedMap<Object>();
            o.set("number", 3);
            o.set("string", "x");
            o.set("strings", List.of("t", "u"));
            o.set("mixed", List.of(1, "1"));

            assertThat(o.get("number")).isEqualTo(3);
            assertThat(o.get("string")).isEqualTo("x");
            assertThat(o.get("strings")).isEqualTo(List.of("t", "u"));
            assertThat(o.get("mixed")).isEqualTo(List.of(1, "1"));
            assertThat(o.keys()).containsExactly("number", "string", "strings", "mixed");
        }

        @Test
        void overwriteKeepsPosition() {
            var o = new OrderedMap<Integer>();
            o.set("number", 3);
            o.set("z", 1);
            o.set("a", 2);
            o.set("number", 4);

            assertThat(o.get("number")).isEqualTo(4);
            assertThat(o.keys()).containsExactly("number", "z", "a");
            assertThat(o.size()).isEqualTo(3);
        }

        @Test
        void missingKeyIsNotAnError() {
            var o = new OrderedMap<String>();
            o.set("present", null);

            assertThat(o.get("absent")).isNull();
            assertThat(o.containsKey("absent")).isFalse();
            assertThat(o.containsKey("present")).isTrue();
            assertThat(o.getOrDefault("absent", "fallback")).isEqualTo("fallback");
            assertThat(o.getOrDefault("present", "fallback")).isNull();
        }

        @Test
        void delete() {
            var o = new OrderedMap<Object>();
            o.set("number", 3);
            o.set("string", "x");
            o.set("strings", List.of("t", "u"));
            o.set("mixed", List.of(1, "1"));

            o.delete("strings");
            o.delete("not a key being used");

            assertThat(o.keys()).containsExactly("number", "string", "mixed");
            assertThat(o.containsKey("strings")).isFalse();
            assertThat(o.get("strings")).isNull();
        }

        @Test
        void deleteThenSetAppends() {
            var o = new OrderedMap<Integer>();
            o.set("a", 1);
            o.set("b", 2);
            o.delete("a");
            o.set("a", 3);

            assertThat(o.keys()).containsExactly("b", "a");
        }

        @Test
        void nullKeyIsRejected() {
            var o = new OrderedMap<Integer>();
            assertThatThrownBy(() -> o.set(null, 1))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("key");
        }
    }

    @Nested
    class Keys {

        @Test
        void keysIsLiveReadOnlyView() {
            var o = new OrderedMap<Integer>();
            o.set("a", 1);
            var keys = o.keys();

            o.set("b", 2);
            assertThat(keys).containsExactly("a", "b");

            assertThatThrownBy(() -> keys.add("c")).isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(keys::clear).isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void snapshotIsIndependent() {
            var o = new OrderedMap<Integer>();
            o.set("a", 1);
            var snapshot = new ArrayList<>(o.keys());

            o.delete("a");
            assertThat(snapshot).containsExactly("a");
            assertThat(o.keys()).isEmpty();
            assertThat(o.isEmpty()).isTrue();
        }
    }

    @Nested
    class Sorting {

        private OrderedMap<Integer> bac() {
            var o = new OrderedMap<Integer>();
            o.set("b", 2);
            o.set("a", 1);
            o.set("c", 3);
            return o;
        }

        @Test
        void sortKeys() {
            var o = bac();
            o.sortKeys(Comparator.naturalOrder());

            assertThat(o.keys()).containsExactly("a", "b", "c");
            assertThat(o.get("a")).isEqualTo(1);
            assertThat(o.get("b")).isEqualTo(2);
        }

        @Test
        void sortKeysReversed() {
            var o = bac();
            o.sortKeys(Comparator.reverseOrder());

            assertThat(o.keys()).containsExactly("c", "b", "a");
        }

        @Test
        void sortByValueDescending() {
            var o = bac();
            o.sort((a, b) -> Integer.compare(b.value(), a.value()));

            assertThat(o.keys()).containsExactly("c", "b", "a");
            assertThat(o.toJson()).isEqualTo("{\"c\":3,\"b\":2,\"a\":1}");
        }

        @Test
        void sortIsStable() {
            var o = new OrderedMap<Integer>();
            o.set("x", 1);
            o.set("y", 0);
            o.set("z", 1);
            o.set("w", 0);
            o.sort((a, b) -> Integer.compare(a.value(), b.value()));

            assertThat(o.keys()).containsExactly("y", "w", "x", "z");
        }

        @Test
        void sortByKeyAndValue() {
            var o = new OrderedMap<String>();
            o.set("k2", "same");
            o.set("k1", "same");
            o.set("k3", "first");
            o.sort(Comparator.<OrderedMap.Entry<String>, String>comparing(OrderedMap.Entry::value)
                    .thenComparing(OrderedMap.Entry::key));

            assertThat(o.keys()).containsExactly("k3", "k1", "k2");
        }
    }

    @Nested
    class Views {

        @Test
        void entriesAndIteration() {
            var o = new OrderedMap<Integer>();
            o.set("z", 26);
            o.set("a", 1);

            assertThat(o.entries())
                    .containsExactly(new OrderedMap.Entry<>("z", 26), new OrderedMap.Entry<>("a", 1));

            var seen = new ArrayList<String>();
            for (var entry : o) seen.add(entry.key() + "=" + entry.value());
            assertThat(seen).containsExactly("z=26", "a=1");
        }

        @Test
        void equalityDependsOnOrder() {
            var ab = new OrderedMap<Integer>();
            ab.set("a", 1);
            ab.set("b", 2);
            var ba = new OrderedMap<Integer>();
            ba.set("b", 2);
            ba.set("a", 1);
            var ab2 = new OrderedMap<Integer>();
            ab2.set("a", 1);
            ab2.set("b", 2);
            ab2.setEscapeHtml(false);

            assertThat(ab).isNotEqualTo(ba);
            assertThat(ab).isEqualTo(ab2).hasSameHashCodeAs(ab2);
        }

        @Test
        void toStringIsJson() {
            var o = new OrderedMap<Object>();
            o.set("z", 1);
            o.set("a", List.of());

            assertThat(o).hasToString("{\"z\":1,\"a\":[]}");
        }

        @Test
        void escapeHtmlDefaultsToTrue() {
            var o = new OrderedMap<Object>();
            assertThat(o.isEscapeHtml()).isTrue();

            o.setEscapeHtml(false);
            assertThat(o.isEscapeHtml()).isFalse();
        }
    }
}
