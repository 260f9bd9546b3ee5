package orderedmap;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

/**
 * Cross-checks output and key order against Jackson.
 */
class JacksonTest extends OrderedMapLoggingConfig {

    private final JsonMapper jsonMapper = JsonMapper.builder().build();

    @Test
    void jacksonReadsEncodedOutputInOrder() {
        var sample = JsonTest.sample();

        for (var json : List.of(sample.toJson(), Json.stringify(sample, "  "))) {
            Map<?, ?> read = jsonMapper.readValue(json, LinkedHashMap.class);

            assertThat(keys(read)).containsExactlyElementsOf(sample.keys());
            assertThat(read.get("specialstring")).isEqualTo("\\.<>[]{}_-");
            assertThat(read.get("test\n\r\t\\\"ing")).isEqualTo(9);
            assertThat(keys((Map<?, ?>) read.get("orderedmap"))).containsExactly("e", "a");
        }
    }

    @Test
    void keyOrderMatchesJackson() {
        // @spotless:off
        var table = new String[] {
                "{\"z\":1,\"a\":2,\"m\":3}",
                "{\"b\":{\"y\":1,\"x\":2},\"a\":[{\"d\":1,\"c\":2}]}",
                "{\"key with { brace\":\"value with } brace\",\"\\\"quoted\\\"\":\"\\\\\"}",
                "{\"\\u00e9\":1,\"e\":2}",
        };
        // @spotless:on

        assertAll(IntStream.range(0, table.length).mapToObj(i -> () -> {
            var input = table[i];
            Map<?, ?> expected = jsonMapper.readValue(input, LinkedHashMap.class);
            var actual = Json.decode(input.getBytes(UTF_8));
            assertThat(actual.keys()).as("Case %d: input=%s", i, input).containsExactlyElementsOf(keys(expected));
        }));
    }

    @Test
    void jacksonAgreesWithUnescapedOutput() {
        var o = new OrderedMap<Object>();
        o.set("html", "<a>&</a>");
        o.set("list", List.of(1, "two", false));
        o.setEscapeHtml(false);

        var fromJackson = jsonMapper.writeValueAsString(jsonMapper.readValue(o.toJson(), LinkedHashMap.class));

        assertThat(o.toJson()).isEqualTo(fromJackson);
    }

    private static List<String> keys(Map<?, ?> map) {
        var keys = new ArrayList<String>();
        for (var key : map.keySet()) keys.add((String) key);
        return keys;
    }
}
