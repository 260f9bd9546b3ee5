package orderedmap;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/**
 * Codecs found with {@link java.util.ServiceLoader}, see {@link UuidCodec}.
 */
class CodecTest extends OrderedMapLoggingConfig {

    private static final UUID FIRST = UUID.fromString("00000000-0000-0000-0000-000000000002");
    private static final UUID SECOND = UUID.fromString("00000000-0000-0000-0000-000000000001");

    @Test
    void codecIsLoaded() {
        assertThat(Json.loadCodecs()).hasAtLeastOneElementOfType(UuidCodec.class);
    }

    @Test
    void encodeWithCodec() {
        var o = new OrderedMap<UUID>();
        o.set("first", FIRST);
        o.set("second", SECOND);

        assertThat(o.toJson())
                .isEqualTo("{\"first\":\"00000000-0000-0000-0000-000000000002\","
                        + "\"second\":\"00000000-0000-0000-0000-000000000001\"}");
    }

    @Test
    void decodeWithCodec() {
        var json = "{\"first\":\"00000000-0000-0000-0000-000000000002\","
                + "\"second\":\"00000000-0000-0000-0000-000000000001\"}";

        var o = Json.decode(json.getBytes(UTF_8), UUID.class);

        assertThat(o.keys()).containsExactly("first", "second");
        assertThat(o.get("first")).isEqualTo(FIRST);
        assertThat(o.get("second")).isEqualTo(SECOND);
    }

    @Test
    void codecAppliesToNestedValues() {
        record Batch(String name, List<UUID> ids) {}

        var o = Json.parse(
                "{\"b\":{\"name\":\"x\",\"ids\":[\"00000000-0000-0000-0000-000000000001\"]}}",
                new Json.Type<OrderedMap<Batch>>() {});

        assertThat(o.get("b")).isEqualTo(new Batch("x", List.of(SECOND)));
        assertThat(o.toJson()).isEqualTo("{\"b\":{\"name\":\"x\",\"ids\":[\"00000000-0000-0000-0000-000000000001\"]}}");
    }

    @Test
    void codecErrorIsWrapped() {
        assertThatCode(() -> Json.decode("{\"id\":\"nope\"}".getBytes(UTF_8), UUID.class))
                .isInstanceOf(Json.ConversionException.class)
                .hasMessageContaining("Failed to convert value of key 'id': Invalid UUID: 'nope'");
    }
}
