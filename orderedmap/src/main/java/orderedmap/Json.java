package orderedmap;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.IntStream;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;

/**
 * JSON writer and parser that keeps object member order.
 *
 * <p> Objects are read into {@link OrderedMap}s whose key order follows the input text. When a key
 * repeats inside one object, the last value wins and the key takes the position of its last
 * occurrence. {@link OrderedMap}s are written in their key order.
 *
 * @since 0.1.0
 */
public final class Json {

    private static final Logger LOG = Logger.getLogger(Json.class.getName());

    /**
     * Deepest nesting of objects and arrays that is read or written.
     */
    public static final int MAX_DEPTH = 1000;

    private static final int MAX_BIG_INTEGER_DIGITS = 1000;

    private static final List<Codec> codecs = loadCodecs();

    private static final Writer defaultWriter = Writer.builder().build();
    private static final Writer htmlUnsafeWriter = Writer.builder().escapeHtml(false).build();
    private static final Parser defaultParser = Parser.builder().build();

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Serialize a value to compact JSON text.
     *
     * <p> An {@link OrderedMap} passed here is written with its own
     * {@link OrderedMap#isEscapeHtml() escaping mode}, which then applies to everything nested in
     * it. Any other value is written HTML-safe.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * var map = new OrderedMap<Object>();
     * map.set("b", 1);
     * map.set("a", List.of("x", true));
     * Json.stringify(map);
     * // -> {"b":1,"a":["x",true]}
     * }</pre>
     *
     * @param o any supported value, may be {@code null}
     * @return non-null JSON text
     * @throws WriteException if the value, or anything nested in it, cannot be represented in JSON
     */
    public static String stringify(@Nullable Object o) {
        return writerFor(o).write(o);
    }

    /**
     * Serialize a value to indented JSON text.
     *
     * @param o      any supported value, may be {@code null}
     * @param indent indentation per nesting level, e.g. two spaces
     * @return non-null JSON text
     * @see #stringify(Object)
     */
    public static String stringify(@Nullable Object o, String indent) {
        Objects.requireNonNull(indent, "indent");
        return writerFor(o).toBuilder().indent(indent).build().write(o);
    }

    /**
     * Encode an ordered map to UTF-8 JSON bytes, members in key order.
     *
     * @param map map to encode, not {@code null}
     * @return UTF-8 encoded JSON object
     * @throws WriteException if a value cannot be represented in JSON
     */
    public static byte[] encode(OrderedMap<?> map) {
        Objects.requireNonNull(map, "map");
        return stringify(map).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decode a UTF-8 JSON object into an ordered map with untyped values.
     *
     * <p> Numbers become {@code Double}s, or {@code BigDecimal}s when a double would not give back
     * the same decimal value. Arrays become {@code List}s and nested objects become
     * {@code OrderedMap}s.
     *
     * @param json UTF-8 JSON object, not {@code null}
     * @return a new map, keys in input order
     * @throws SyntaxException     if the input is not valid JSON
     * @throws ConversionException if the input is valid JSON but not an object
     */
    public static OrderedMap<Object> decode(byte[] json) {
        return decode(json, Object.class);
    }

    /**
     * Decode a UTF-8 JSON object into an ordered map whose values are bound to {@code valueType}.
     *
     * @param json      UTF-8 JSON object, not {@code null}
     * @param valueType value type, not {@code null}
     * @param <T>       value type
     * @return a new map, keys in input order
     * @throws SyntaxException     if the input is not valid JSON
     * @throws ConversionException if the input is not an object or a value cannot be bound
     */
    public static <T> OrderedMap<T> decode(byte[] json, Class<T> valueType) {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(valueType, "valueType");
        var jv = Reader.read(new String(json, StandardCharsets.UTF_8));
        return defaultParser.toOrderedMap(Parser.expectObject(jv), valueType);
    }

    /**
     * Parse JSON text into a target type described by a {@link Type} token.
     *
     * <h3>Example</h3>
     * <pre>{@code
     * record Report(String title, OrderedMap<Integer> totals) {}
     * Report r = Json.parse("{\"title\":\"q3\",\"totals\":{\"b\":2,\"a\":1}}", new Json.Type<Report>() {});
     * r.totals().keys();
     * // -> [b, a]
     * }</pre>
     *
     * @param json JSON text, not {@code null}
     * @param type target type token, not {@code null}
     * @param <T>  result type
     * @return parsed instance (maybe {@code null} if json is "null")
     */
    public static <T> T parse(String json, Type<T> type) {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(type, "type");
        return defaultParser.parse(json, type);
    }

    /**
     * Parse JSON text into a target type.
     *
     * <p> This is a convenience overload of {@link #parse(String, Type)}
     *
     * @param json  JSON text, not {@code null}
     * @param clazz target class, not {@code null}
     * @param <T>   result type
     * @return parsed instance (maybe {@code null} if json is "null")
     */
    public static <T> T parse(String json, Class<T> clazz) {
        Objects.requireNonNull(clazz, "clazz");
        return parse(json, Type.of(clazz));
    }

    static Writer writerFor(@Nullable Object o) {
        return o instanceof OrderedMap<?> map && !map.isEscapeHtml() ? htmlUnsafeWriter : defaultWriter;
    }

    // ============================================================
    // AST
    // ============================================================

    public sealed interface JsonValue permits JsonArray, JsonBoolean, JsonNull, JsonNumber, JsonObject, JsonString {}

    public record JsonArray(List<JsonValue> value) implements JsonValue {}

    public record JsonBoolean(boolean value) implements JsonValue {}

    public record JsonNull() implements JsonValue {}

    public record JsonNumber(Number value) implements JsonValue {}

    /**
     * A JSON object. Members iterate in the order of each key's last occurrence in the source text.
     */
    public record JsonObject(Map<String, JsonValue> value) implements JsonValue {}

    public record JsonString(String value) implements JsonValue {}

    // ============================================================
    // Extension point
    // ============================================================

    /**
     * A {@link Serializer} and {@link Deserializer} pair discovered with {@link ServiceLoader}
     * from {@code META-INF/services/orderedmap.Json$Codec}. Codecs apply to every writer and parser.
     */
    public interface Codec extends Serializer, Deserializer {}

    public interface Serializer {
        boolean canSerialize(Object o);

        /**
         * @return JSON text for {@code o}, inserted as-is into the output
         */
        String serialize(Json.Writer writer, Object o);
    }

    public interface Deserializer {
        boolean canDeserialize(JsonValue jsonValue, java.lang.reflect.Type targetType);

        Object deserialize(Json.Parser parser, JsonValue jsonValue, java.lang.reflect.Type targetType);
    }

    // ============================================================
    // Type token
    // ============================================================

    /**
     * Captures a generic target type, e.g. {@code new Json.Type<OrderedMap<List<Integer>>>() {}}.
     *
     * @param <T> the captured type
     */
    public abstract static class Type<T> {
        private final java.lang.reflect.Type type;

        protected Type() {
            this.type = capture(getClass());
        }

        private Type(Class<T> clazz) {
            this.type = clazz;
        }

        public static <T> Type<T> of(Class<T> clazz) {
            return new Type<T>(clazz) {};
        }

        public java.lang.reflect.Type getType() {
            return type;
        }

        private static java.lang.reflect.Type capture(Class<?> subclass) {
            for (Class<?> c = subclass; c != Object.class; c = c.getSuperclass()) {
                if (c.getGenericSuperclass() instanceof ParameterizedType p && p.getRawType() == Type.class) {
                    return p.getActualTypeArguments()[0];
                }
            }
            throw new IllegalStateException("Json.Type needs a type argument, e.g. new Json.Type<List<String>>() {}");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Type<?> other && type.equals(other.type);
        }

        @Override
        public int hashCode() {
            return type.hashCode();
        }

        @Override
        public String toString() {
            return "Json.Type<" + type.getTypeName() + ">";
        }
    }

    // ============================================================
    // Lexer
    // ============================================================

    enum Token {
        LBRACE("'{'"),
        RBRACE("'}'"),
        LBRACKET("'['"),
        RBRACKET("']'"),
        COLON("':'"),
        COMMA("','"),
        STRING("string"),
        NUMBER("number"),
        TRUE("true"),
        FALSE("false"),
        NULL("null"),
        EOF("end of input");

        private final String display;

        Token(String display) {
            this.display = display;
        }

        @Override
        public String toString() {
            return display;
        }
    }

    /**
     * Splits JSON text into tokens. String contents are decoded here, so brackets, quotes and
     * backslashes inside a string never surface as structural tokens.
     */
    static final class Lexer {
        private final String s;
        private int pos = 0, line = 1, col = 1;
        private Token current;
        private @Nullable String text;

        Lexer(String s) {
            this.s = Objects.requireNonNull(s, "json");
            advance();
        }

        Token current() {
            return current;
        }

        /**
         * @return decoded string value of a STRING token, or the lexeme of a NUMBER token
         */
        String text() {
            return Objects.requireNonNull(text);
        }

        int line() {
            return line;
        }

        int col() {
            return col;
        }

        void advance() {
            skipWhitespace();
            if (pos >= s.length()) {
                current = Token.EOF;
                return;
            }
            char c = s.charAt(pos);
            current = switch (c) {
                case '{' -> punctuation(Token.LBRACE);
                case '}' -> punctuation(Token.RBRACE);
                case '[' -> punctuation(Token.LBRACKET);
                case ']' -> punctuation(Token.RBRACKET);
                case ':' -> punctuation(Token.COLON);
                case ',' -> punctuation(Token.COMMA);
                case '"' -> {
                    text = readString();
                    yield Token.STRING;
                }
                case 't' -> literal("true", Token.TRUE);
                case 'f' -> literal("false", Token.FALSE);
                case 'n' -> literal("null", Token.NULL);
                default -> {
                    if (c != '-' && !isDigit(c)) throw error("Unexpected character: '" + c + "'");
                    text = readNumber();
                    yield Token.NUMBER;
                }
            };
        }

        private Token punctuation(Token t) {
            consume();
            return t;
        }

        private Token literal(String keyword, Token t) {
            for (int k = 0; k < keyword.length(); k++) {
                if (eof() || peek() != keyword.charAt(k)) throw error("Invalid literal, expected '" + keyword + "'");
                consume();
            }
            return t;
        }

        private void skipWhitespace() {
            while (!eof()) {
                char c = peek();
                if (c == '\n') {
                    pos++;
                    line++;
                    col = 1;
                } else if (c == ' ' || c == '\t' || c == '\r') {
                    consume();
                } else {
                    return;
                }
            }
        }

        private String readString() {
            consume(); // opening quote
            var sb = new StringBuilder();
            while (!eof()) {
                char c = consume();
                if (c == '"') return sb.toString();
                if (c == '\\') readEscape(sb);
                else if (c < 0x20) throw error("Unescaped control character in string (code " + (int) c + ")");
                else sb.append(c);
            }
            throw error("Unterminated string literal");
        }

        private void readEscape(StringBuilder sb) {
            if (eof()) throw error("Unterminated escape sequence");
            char e = consume();
            switch (e) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case '/' -> sb.append('/');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                // surrogate pairs arrive as two escapes and recombine in the builder
                case 'u' -> sb.append((char) readHex4());
                default -> throw error("Invalid escape sequence: \\" + e);
            }
        }

        private int readHex4() {
            int cp = 0;
            for (int k = 0; k < 4; k++) {
                if (eof()) throw error("Unexpected end of input in unicode escape sequence");
                char c = consume();
                int v;
                if (c >= '0' && c <= '9') v = c - '0';
                else if (c >= 'a' && c <= 'f') v = c - 'a' + 10;
                else if (c >= 'A' && c <= 'F') v = c - 'A' + 10;
                else throw error("Invalid hexadecimal digit in unicode escape sequence");
                cp = (cp << 4) | v;
            }
            return cp;
        }

        private String readNumber() {
            int start = pos;
            if (peek() == '-') consume();
            if (eof()) throw error("Unexpected end of input while parsing number");
            if (peek() == '0') consume();
            else if (isDigit(peek())) digits();
            else throw error("Invalid number format (integer part)");
            if (!eof() && peek() == '.') {
                consume();
                if (eof() || !isDigit(peek())) throw error("Invalid number format (fractional part)");
                digits();
            }
            if (!eof() && (peek() == 'e' || peek() == 'E')) {
                consume();
                if (!eof() && (peek() == '+' || peek() == '-')) consume();
                if (eof() || !isDigit(peek())) throw error("Invalid number format (exponent part)");
                digits();
            }
            return s.substring(start, pos);
        }

        private void digits() {
            while (!eof() && isDigit(peek())) consume();
        }

        private boolean eof() {
            return pos >= s.length();
        }

        private char peek() {
            return s.charAt(pos);
        }

        private char consume() {
            col++;
            return s.charAt(pos++);
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        SyntaxException error(String msg) {
            return new SyntaxException(msg + " at line " + line + ", column " + col);
        }
    }

    // ============================================================
    // Reader (token stream -> JsonValue)
    // ============================================================

    /**
     * Builds a {@link JsonValue} tree from a token stream with an explicit stack of frames, one per
     * open object or array.
     *
     * <p> Object frames go {@code EXPECT_KEY_OR_END -> EXPECT_COLON -> EXPECT_VALUE ->
     * EXPECT_COMMA_OR_END} and back to {@code EXPECT_KEY} after a comma. Array frames go
     * {@code EXPECT_VALUE_OR_END -> EXPECT_COMMA_OR_END} and back to {@code EXPECT_VALUE} after a
     * comma. A finished value is handed to the frame below it.
     */
    static final class Reader {

        enum State {
            EXPECT_KEY_OR_END,
            EXPECT_KEY,
            EXPECT_COLON,
            EXPECT_VALUE_OR_END,
            EXPECT_VALUE,
            EXPECT_COMMA_OR_END
        }

        private static final class Frame {
            // members keep the position of each key's last occurrence: remove, then put
            private final @Nullable LinkedHashMap<String, JsonValue> members;
            private final @Nullable List<JsonValue> elements;
            private State state;
            private @Nullable String key;

            private Frame(@Nullable LinkedHashMap<String, JsonValue> members, @Nullable List<JsonValue> elements) {
                this.members = members;
                this.elements = elements;
                this.state = members != null ? State.EXPECT_KEY_OR_END : State.EXPECT_VALUE_OR_END;
            }

            static Frame object() {
                return new Frame(new LinkedHashMap<>(), null);
            }

            static Frame array() {
                return new Frame(null, new ArrayList<>());
            }

            boolean isObject() {
                return members != null;
            }

            void accept(JsonValue value) {
                if (members != null) {
                    var k = Objects.requireNonNull(key);
                    if (members.remove(k) != null) {
                        int position = members.size();
                        LOG.finer(() -> "Duplicate key '" + k + "' moved to position " + position);
                    }
                    members.put(k, value);
                    key = null;
                } else {
                    Objects.requireNonNull(elements).add(value);
                }
                state = State.EXPECT_COMMA_OR_END;
            }

            JsonValue complete() {
                return members != null ? new JsonObject(members) : new JsonArray(Objects.requireNonNull(elements));
            }
        }

        private final Lexer lexer;
        private final Deque<Frame> stack = new ArrayDeque<>();

        private Reader(Lexer lexer) {
            this.lexer = lexer;
        }

        /**
         * Read exactly one JSON value spanning the whole text.
         *
         * @throws SyntaxException if the text is not a single well-formed JSON value
         */
        static JsonValue read(String json) {
            var reader = new Reader(new Lexer(json));
            var value = reader.readValue();
            if (reader.lexer.current() != Token.EOF) throw reader.error("Trailing characters after top-level value");
            return value;
        }

        private JsonValue readValue() {
            var value = startValue();
            while (true) {
                if (value != null) {
                    var parent = stack.peek();
                    if (parent == null) return value;
                    parent.accept(value);
                }
                value = step(Objects.requireNonNull(stack.peek()));
            }
        }

        /**
         * Advance the top frame by one token.
         *
         * @return a finished value to hand to the frame below, or {@code null} if there is none yet
         */
        private @Nullable JsonValue step(Frame frame) {
            switch (frame.state) {
                case EXPECT_KEY_OR_END -> {
                    if (accept(Token.RBRACE)) return close();
                    readKey(frame, "Expected string key or '}' in object");
                    return null;
                }
                case EXPECT_KEY -> {
                    readKey(frame, "Expected string key in object");
                    return null;
                }
                case EXPECT_COLON -> {
                    if (!accept(Token.COLON)) throw error("Expected ':' after object key");
                    frame.state = State.EXPECT_VALUE;
                    return null;
                }
                case EXPECT_VALUE_OR_END -> {
                    if (accept(Token.RBRACKET)) return close();
                    return startValue();
                }
                case EXPECT_VALUE -> {
                    return startValue();
                }
                case EXPECT_COMMA_OR_END -> {
                    if (accept(Token.COMMA)) {
                        frame.state = frame.isObject() ? State.EXPECT_KEY : State.EXPECT_VALUE;
                        return null;
                    }
                    if (accept(frame.isObject() ? Token.RBRACE : Token.RBRACKET)) return close();
                    throw error(frame.isObject() ? "Expected ',' or '}' in object" : "Expected ',' or ']' in array");
                }
                default -> throw new IllegalStateException("Unknown state: " + frame.state);
            }
        }

        private void readKey(Frame frame, String message) {
            if (lexer.current() != Token.STRING) throw error(message);
            frame.key = lexer.text();
            frame.state = State.EXPECT_COLON;
            lexer.advance();
        }

        /**
         * @return the scalar at the current token, or {@code null} after opening a new frame
         */
        private @Nullable JsonValue startValue() {
            var token = lexer.current();
            switch (token) {
                case LBRACE -> {
                    open(Frame.object());
                    return null;
                }
                case LBRACKET -> {
                    open(Frame.array());
                    return null;
                }
                case EOF -> throw error("Unexpected end of input while expecting a value");
                case RBRACE, RBRACKET, COMMA, COLON -> throw error("Unexpected token");
                default -> {
                    JsonValue v = switch (token) {
                        case STRING -> new JsonString(lexer.text());
                        case NUMBER -> new JsonNumber(parseNumber(lexer.text()));
                        case TRUE -> new JsonBoolean(true);
                        case FALSE -> new JsonBoolean(false);
                        default -> new JsonNull();
                    };
                    lexer.advance();
                    return v;
                }
            }
        }

        private void open(Frame frame) {
            if (stack.size() >= MAX_DEPTH) throw error("Maximum nesting depth of " + MAX_DEPTH + " exceeded");
            lexer.advance();
            stack.push(frame);
        }

        private JsonValue close() {
            return stack.pop().complete();
        }

        private boolean accept(Token t) {
            if (lexer.current() != t) return false;
            lexer.advance();
            return true;
        }

        private SyntaxException error(String msg) {
            return new SyntaxException(msg + " (token: " + lexer.current() + ") at line " + lexer.line() + ", column "
                    + lexer.col());
        }

        /**
         * Numbers are kept as exact decimals; binding decides what they become.
         */
        private BigDecimal parseNumber(String s) {
            try {
                return new BigDecimal(s);
            } catch (NumberFormatException e) {
                throw error("Number out of range: " + s);
            }
        }
    }

    // ============================================================
    // Writer
    // ============================================================

    /**
     * Writes values as JSON text.
     *
     * <pre>{@code
     * var writer = Json.Writer.builder().escapeHtml(false).indent("  ").build();
     * writer.write(map);
     * }</pre>
     *
     * <p> Instances are immutable and can be shared.
     */
    @Builder(toBuilder = true)
    public static final class Writer {

        @Singular("serializer")
        private final List<Serializer> serializers;

        /**
         * Write {@code <}, {@code >} and {@code &} as unicode escapes, in keys and values at any depth.
         */
        @Builder.Default
        private final boolean escapeHtml = true;

        /**
         * Indentation per nesting level; empty for compact output.
         */
        @Builder.Default
        private final String indent = "";

        public boolean isEscapeHtml() {
            return escapeHtml;
        }

        public String getIndent() {
            return indent;
        }

        /**
         * @param o value to write, may be {@code null}
         * @return JSON text, only returned when the whole value was written
         * @throws WriteException if the value, or anything nested in it, cannot be represented in JSON
         */
        public String write(@Nullable Object o) {
            var out = new Output(indent == null ? "" : indent);
            write(out, o);
            return out.toString();
        }

        void write(Output out, @Nullable Object o) {
            if (o == null) {
                out.append("null");
                return;
            }
            var serializer = serializerFor(o);
            if (serializer != null) {
                out.append(serializer.serialize(this, o));
            } else if (o instanceof OrderedMap<?> map) {
                writeOrderedMap(out, map);
            } else if (o instanceof JsonValue jv) {
                writeJsonValue(out, jv);
            } else if (o instanceof CharSequence || o instanceof Character) {
                writeString(out, o.toString());
            } else if (o instanceof Enum<?> e) {
                writeString(out, e.name());
            } else if (o instanceof Boolean || o instanceof Number) {
                writeScalar(out, o);
            } else if (o instanceof Optional<?> optional) {
                write(out, optional.orElse(null));
            } else if (o.getClass().isArray()) {
                writeElements(out, o, IntStream.range(0, Array.getLength(o)).mapToObj(i -> Array.get(o, i)).iterator());
            } else if (o instanceof Iterable<?> iterable) {
                writeElements(out, iterable, iterable.iterator());
            } else if (o instanceof Map<?, ?> map) {
                writeMap(out, map);
            } else if (o instanceof Record record) {
                writeRecord(out, record);
            } else {
                throw new WriteException("Unsupported value type: " + o.getClass().getName());
            }
        }

        private @Nullable Serializer serializerFor(Object o) {
            for (var serializer : serializers) {
                if (serializer.canSerialize(o)) return serializer;
            }
            for (var codec : codecs) {
                if (codec.canSerialize(o)) return codec;
            }
            return null;
        }

        private void writeOrderedMap(Output out, OrderedMap<?> map) {
            out.enter(map);
            out.open('{');
            var keys = map.keys();
            for (int i = 0; i < keys.size(); i++) {
                writeMember(out, i == 0, keys.get(i), map.get(keys.get(i)));
            }
            out.close('}', keys.isEmpty());
            out.exit(map);
        }

        private void writeMap(Output out, Map<?, ?> map) {
            out.enter(map);
            out.open('{');
            boolean first = true;
            for (var entry : map.entrySet()) {
                writeMember(out, first, String.valueOf(entry.getKey()), entry.getValue());
                first = false;
            }
            out.close('}', first);
            out.exit(map);
        }

        /**
         * Components in declaration order. Empty {@link Optional} components are left out.
         */
        private void writeRecord(Output out, Record record) {
            out.enter(record);
            out.open('{');
            boolean first = true;
            for (var component : record.getClass().getRecordComponents()) {
                var value = componentValue(record, component);
                if (component.getType() == Optional.class && (value == null || ((Optional<?>) value).isEmpty())) continue;
                writeMember(out, first, component.getName(), value);
                first = false;
            }
            out.close('}', first);
            out.exit(record);
        }

        private static @Nullable Object componentValue(Record record, RecordComponent component) {
            try {
                var accessor = component.getAccessor();
                if (!accessor.canAccess(record)) accessor.setAccessible(true);
                return accessor.invoke(record);
            } catch (ReflectiveOperationException | RuntimeException e) {
                throw new WriteException(
                        "Failed to access record component '" + component.getName() + "' of type "
                                + record.getClass().getName(),
                        e);
            }
        }

        private void writeMember(Output out, boolean first, String name, @Nullable Object value) {
            out.item(first);
            writeString(out, name);
            out.colon();
            write(out, value);
        }

        private void writeElements(Output out, Object container, Iterator<?> elements) {
            out.enter(container);
            out.open('[');
            boolean empty = true;
            while (elements.hasNext()) {
                out.item(empty);
                empty = false;
                write(out, elements.next());
            }
            out.close(']', empty);
            out.exit(container);
        }

        private void writeJsonValue(Output out, JsonValue jv) {
            if (jv instanceof JsonObject o) {
                writeMap(out, o.value());
            } else if (jv instanceof JsonArray a) {
                writeElements(out, a, a.value().iterator());
            } else if (jv instanceof JsonString s) {
                writeString(out, s.value());
            } else if (jv instanceof JsonNumber n) {
                writeScalar(out, n.value());
            } else if (jv instanceof JsonBoolean b) {
                writeScalar(out, b.value());
            } else {
                out.append("null");
            }
        }

        private static void writeScalar(Output out, Object booleanOrNumber) {
            if ((booleanOrNumber instanceof Double || booleanOrNumber instanceof Float)
                    && !Double.isFinite(((Number) booleanOrNumber).doubleValue())) {
                throw new WriteException("Cannot serialize NaN or Infinity as JSON number: " + booleanOrNumber);
            }
            out.append(booleanOrNumber.toString());
        }

        private void writeString(Output out, String s) {
            out.append('"');
            escapeTo(out.sb, s, escapeHtml);
            out.append('"');
        }

        static void escapeTo(StringBuilder out, String s, boolean escapeHtml) {
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                switch (c) {
                    case '"' -> out.append("\\\"");
                    case '\\' -> out.append("\\\\");
                    case '\b' -> out.append("\\b");
                    case '\f' -> out.append("\\f");
                    case '\n' -> out.append("\\n");
                    case '\r' -> out.append("\\r");
                    case '\t' -> out.append("\\t");
                    case '<', '>', '&' -> {
                        if (escapeHtml) unicodeEscape(out, c);
                        else out.append(c);
                    }
                    // line and paragraph separators end a JavaScript string literal
                    case 0x2028, 0x2029 -> unicodeEscape(out, c);
                    default -> {
                        if (c < 0x20) {
                            unicodeEscape(out, c);
                        } else if (Character.isHighSurrogate(c) && i + 1 < s.length()
                                && Character.isLowSurrogate(s.charAt(i + 1))) {
                            out.append(c).append(s.charAt(++i));
                        } else if (Character.isSurrogate(c)) {
                            // unpaired, has no UTF-8 form
                            unicodeEscape(out, c);
                        } else {
                            out.append(c);
                        }
                    }
                }
            }
        }

        private static void unicodeEscape(StringBuilder out, char c) {
            out.append("\\u");
            String hex = Integer.toHexString(c);
            for (int k = hex.length(); k < 4; k++) out.append('0');
            out.append(hex);
        }
    }

    /**
     * Output buffer of one {@link Writer#write(Object)} call: layout and the containers being written.
     */
    static final class Output {
        private final StringBuilder sb = new StringBuilder();
        private final String indent;
        private final Set<Object> writing = Collections.newSetFromMap(new IdentityHashMap<>());
        private int depth;

        Output(String indent) {
            this.indent = indent;
        }

        void append(char c) {
            sb.append(c);
        }

        void append(String s) {
            sb.append(s);
        }

        void enter(Object container) {
            if (writing.size() >= MAX_DEPTH)
                throw new WriteException("Maximum nesting depth of " + MAX_DEPTH + " exceeded");
            if (!writing.add(container))
                throw new WriteException("Cyclic value graph: " + container.getClass().getName() + " contains itself");
        }

        void exit(Object container) {
            writing.remove(container);
        }

        void open(char c) {
            sb.append(c);
            depth++;
        }

        void item(boolean first) {
            if (!first) sb.append(',');
            newline();
        }

        void colon() {
            sb.append(indent.isEmpty() ? ":" : ": ");
        }

        void close(char c, boolean empty) {
            depth--;
            if (!empty) newline();
            sb.append(c);
        }

        private void newline() {
            if (indent.isEmpty()) return;
            sb.append('\n');
            for (int i = 0; i < depth; i++) sb.append(indent);
        }

        @Override
        public String toString() {
            return sb.toString();
        }
    }

    // ============================================================
    // Parser
    // ============================================================

    /**
     * Binds parsed JSON to Java types.
     *
     * <p> Targets: {@link OrderedMap}, records, collections, arrays, maps, {@link Optional}, enums,
     * strings, booleans, numbers, {@link JsonValue} and {@code Object}. Binding is strict: a value
     * must already have the JSON kind its target expects, so {@code "42"} does not bind to an
     * {@code int}. An {@code Object} target takes the natural Java form of the value, with objects
     * as {@code OrderedMap<Object>}.
     *
     * <p> Instances are immutable and can be shared.
     */
    @Builder(toBuilder = true)
    public static final class Parser {

        @Singular("deserializer")
        private final List<Deserializer> deserializers;

        public <T> T parse(String json, Class<T> clazz) {
            return parse(json, Type.of(clazz));
        }

        public <T> T parse(String json, Type<T> type) {
            return parseJsonValue(Reader.read(json), type.getType());
        }

        /**
         * Bind an already parsed value.
         *
         * @throws ConversionException if the value does not fit {@code targetType}
         */
        @SuppressWarnings("unchecked")
        public <T> T parseJsonValue(JsonValue jv, java.lang.reflect.Type targetType) {
            var type = canonicalize(targetType);
            return (T) bind(jv, type, raw(type));
        }

        private @Nullable Object bind(JsonValue jv, java.lang.reflect.Type type, Class<?> raw) {
            if (raw == Object.class) return fromUntyped(jv);
            if (JsonValue.class.isAssignableFrom(raw)) return expect(jv, raw.asSubclass(JsonValue.class), raw);

            for (var deserializer : deserializers) {
                if (deserializer.canDeserialize(jv, type)) return deserializer.deserialize(this, jv, type);
            }
            for (var codec : codecs) {
                if (codec.canDeserialize(jv, type)) return codec.deserialize(this, jv, type);
            }

            if (raw == Optional.class) {
                return jv instanceof JsonNull ? Optional.empty() : Optional.ofNullable(parseJsonValue(jv, typeArgument(type, 0)));
            }
            if (jv instanceof JsonNull) {
                if (raw.isPrimitive()) throw new ConversionException("Cannot assign null to primitive type " + raw.getName());
                return null;
            }

            if (raw == String.class || raw == CharSequence.class) return expect(jv, JsonString.class, raw).value();
            if (raw == boolean.class || raw == Boolean.class) return expect(jv, JsonBoolean.class, raw).value();
            if (raw == char.class || raw == Character.class) return toChar(expect(jv, JsonString.class, raw).value());
            if (raw.isPrimitive() || Number.class.isAssignableFrom(raw)) {
                return toNumber(expect(jv, JsonNumber.class, raw).value(), raw);
            }
            if (raw.isEnum()) return toEnum(expect(jv, JsonString.class, raw).value(), raw);

            if (raw.isArray()) return toArray(expect(jv, JsonArray.class, raw), raw.getComponentType(), typeArgument(type, 0));
            if (Collection.class.isAssignableFrom(raw)) return toCollection(expect(jv, JsonArray.class, raw), type, raw);

            var jo = expect(jv, JsonObject.class, raw);
            if (raw == OrderedMap.class) return toOrderedMap(jo, typeArgument(type, 0));
            if (Map.class.isAssignableFrom(raw)) return toMap(jo, type, raw);
            if (raw.isRecord()) return toRecord(jo, raw);

            throw new ConversionException("Unsupported target type: " + raw.getName());
        }

        /**
         * Bind every member of {@code jo} to {@code valueType}, keeping the member order.
         */
        <T> OrderedMap<T> toOrderedMap(JsonObject jo, java.lang.reflect.Type valueType) {
            var map = new OrderedMap<T>(jo.value().size());
            jo.value().forEach((key, value) -> {
                try {
                    map.set(key, parseJsonValue(value, valueType));
                } catch (Exception e) {
                    throw new ConversionException("Failed to convert value of key '" + key + "': " + e.getMessage(), e);
                }
            });
            return map;
        }

        private Map<Object, Object> toMap(JsonObject jo, java.lang.reflect.Type type, Class<?> raw) {
            var keyType = typeArgument(type, 0);
            var valueType = typeArgument(type, 1);
            var keyIsText = raw(keyType) == String.class || raw(keyType) == Object.class;
            Map<Object, Object> map = newMap(raw, jo.value().size());
            jo.value().forEach((key, value) -> map.put(
                    keyIsText ? key : parseJsonValue(new JsonString(key), keyType),
                    parseJsonValue(value, valueType)));
            return map;
        }

        private Collection<Object> toCollection(JsonArray ja, java.lang.reflect.Type type, Class<?> raw) {
            var elementType = typeArgument(type, 0);
            Collection<Object> collection = newCollection(raw, ja.value().size());
            for (var element : ja.value()) collection.add(parseJsonValue(element, elementType));
            return collection;
        }

        private Object toArray(JsonArray ja, Class<?> componentClass, java.lang.reflect.Type componentType) {
            var elements = ja.value();
            var array = Array.newInstance(componentClass, elements.size());
            for (int i = 0; i < elements.size(); i++) {
                Array.set(array, i, parseJsonValue(elements.get(i), componentType));
            }
            return array;
        }

        /**
         * Components are matched by exact name. A missing component gets {@code null}, an empty
         * {@code Optional}, or zero for primitives.
         */
        private Object toRecord(JsonObject jo, Class<?> raw) {
            var components = raw.getRecordComponents();
            var types = new Class<?>[components.length];
            var args = new Object[components.length];
            for (int i = 0; i < components.length; i++) {
                var component = components[i];
                types[i] = component.getType();
                var value = jo.value().get(component.getName());
                try {
                    args[i] = value == null
                            ? missingComponent(component.getType())
                            : parseJsonValue(value, component.getGenericType());
                } catch (Exception e) {
                    throw new ConversionException(
                            "Failed to convert component '" + component.getName() + "' of record " + raw.getName()
                                    + ": " + e.getMessage(),
                            e);
                }
            }
            try {
                var constructor = raw.getDeclaredConstructor(types);
                if (!constructor.canAccess(null)) constructor.setAccessible(true);
                return constructor.newInstance(args);
            } catch (InvocationTargetException e) {
                var cause = e.getTargetException();
                throw new ConversionException(
                        "Constructor of record " + raw.getName() + " rejected the values: " + cause.getMessage(), cause);
            } catch (ReflectiveOperationException e) {
                throw new ConversionException("Failed to construct record instance of type " + raw.getName(), e);
            }
        }

        /**
         * Objects become {@link OrderedMap}s so nested member order survives untyped binding too.
         */
        private @Nullable Object fromUntyped(JsonValue jv) {
            if (jv instanceof JsonObject o) return this.<Object>toOrderedMap(o, Object.class);
            if (jv instanceof JsonArray a) {
                var list = new ArrayList<@Nullable Object>(a.value().size());
                for (var element : a.value()) list.add(fromUntyped(element));
                return list;
            }
            if (jv instanceof JsonString s) return s.value();
            if (jv instanceof JsonNumber n) return toUntypedNumber(n.value());
            if (jv instanceof JsonBoolean b) return b.value();
            return null;
        }

        /**
         * @throws ConversionException if {@code jv} is not a {@code kind}
         */
        static <V extends JsonValue> V expect(JsonValue jv, Class<V> kind, Class<?> target) {
            if (kind.isInstance(jv)) return kind.cast(jv);
            throw new ConversionException(
                    "Expected " + describe(kind) + " for " + target.getSimpleName() + ", but got " + describe(jv.getClass()));
        }

        static JsonObject expectObject(JsonValue jv) {
            if (jv instanceof JsonObject o) return o;
            throw new ConversionException("Expected JSON object, but got " + describe(jv.getClass()));
        }

        private static String describe(Class<?> kind) {
            if (kind == JsonObject.class) return "JSON object";
            if (kind == JsonArray.class) return "JSON array";
            if (kind == JsonString.class) return "JSON string";
            if (kind == JsonNumber.class) return "JSON number";
            if (kind == JsonBoolean.class) return "JSON boolean";
            if (kind == JsonNull.class) return "JSON null";
            return kind.getSimpleName();
        }
    }

    // ============================================================
    // Scalar conversion
    // ============================================================

    static @Nullable Object missingComponent(Class<?> type) {
        if (type.isPrimitive()) return Array.get(Array.newInstance(type, 1), 0);
        return type == Optional.class ? Optional.empty() : null;
    }

    static Character toChar(String s) {
        if (s.length() != 1) throw new ConversionException("Expected a single character, but got \"" + s + "\"");
        return s.charAt(0);
    }

    /**
     * A {@code Double} when it reads back as the same decimal value, else the exact {@code BigDecimal}.
     */
    static Number toUntypedNumber(Number n) {
        if (!(n instanceof BigDecimal exact)) return n;
        double d = exact.doubleValue();
        return Double.isFinite(d) && exact.compareTo(BigDecimal.valueOf(d)) == 0 ? (Number) d : exact;
    }

    /**
     * Integral targets only take integral values that fit; floating point targets take any number.
     */
    static Number toNumber(Number n, Class<?> target) {
        if (target == Number.class) return toUntypedNumber(n);
        var exact = n instanceof BigDecimal d ? d : n instanceof BigInteger i ? new BigDecimal(i) : new BigDecimal(n.toString());
        try {
            if (target == double.class || target == Double.class) return finite(exact.doubleValue());
            if (target == float.class || target == Float.class) return (float) finite(exact.floatValue());
            if (target == BigDecimal.class) return exact;
            if (target == BigInteger.class) {
                // toBigIntegerExact would expand the exponent digit by digit
                if (exact.signum() == 0) return BigInteger.ZERO;
                long integerDigits = (long) exact.precision() - exact.scale();
                if (integerDigits <= 0 || integerDigits > MAX_BIG_INTEGER_DIGITS) {
                    throw new ArithmeticException("Too many digits or not integral");
                }
                return exact.toBigIntegerExact();
            }
            if (target == long.class || target == Long.class) return exact.longValueExact();
            if (target == int.class || target == Integer.class) return exact.intValueExact();
            if (target == short.class || target == Short.class) return exact.shortValueExact();
            if (target == byte.class || target == Byte.class) return exact.byteValueExact();
        } catch (ArithmeticException e) {
            throw new ConversionException("Number " + n + " does not fit " + target.getSimpleName(), e);
        }
        throw new ConversionException("Unsupported numeric target type: " + target.getName());
    }

    private static double finite(double d) {
        if (!Double.isFinite(d)) throw new ArithmeticException("Overflow");
        return d;
    }

    static Object toEnum(String name, Class<?> enumType) {
        for (var constant : enumType.getEnumConstants()) {
            if (((Enum<?>) constant).name().equals(name)) return constant;
        }
        throw new ConversionException("No enum constant named '" + name + "' in " + enumType.getSimpleName());
    }

    // ============================================================
    // Type utils
    // ============================================================

    static List<Codec> loadCodecs() {
        var codecs = new ArrayList<Codec>();
        for (var c : ServiceLoader.load(Codec.class)) {
            LOG.config(() -> "Loaded JSON codec " + c.getClass().getName());
            codecs.add(c);
        }
        return List.copyOf(codecs);
    }

    /**
     * Initial {@link java.util.HashMap} capacity that holds {@code expectedSize} entries without rehashing.
     */
    static int mapCap(int expectedSize) {
        return expectedSize < 3 ? expectedSize + 1 : (int) Math.ceil(expectedSize / 0.75);
    }

    static Map<Object, Object> newMap(Class<?> raw, int size) {
        if (raw.isAssignableFrom(LinkedHashMap.class)) return new LinkedHashMap<>(mapCap(size));
        if (raw.isAssignableFrom(TreeMap.class)) return new TreeMap<>();
        return instantiate(raw);
    }

    static Collection<Object> newCollection(Class<?> raw, int size) {
        if (raw.isAssignableFrom(ArrayList.class)) return new ArrayList<>(size);
        if (raw.isAssignableFrom(LinkedHashSet.class)) return new LinkedHashSet<>(mapCap(size));
        if (raw.isAssignableFrom(TreeSet.class)) return new TreeSet<>();
        if (raw.isAssignableFrom(ArrayDeque.class)) return new ArrayDeque<>(size);
        return instantiate(raw);
    }

    @SuppressWarnings("unchecked")
    private static <C> C instantiate(Class<?> raw) {
        try {
            return (C) raw.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ConversionException("Cannot instantiate " + raw.getName() + " (no accessible no-arg constructor)", e);
        }
    }

    static Class<?> raw(java.lang.reflect.Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return raw(p.getRawType());
        if (t instanceof GenericArrayType g) return raw(g.getGenericComponentType()).arrayType();
        if (t instanceof WildcardType || t instanceof TypeVariable<?>) return raw(canonicalize(t));
        throw new IllegalArgumentException("Unsupported type: " + t);
    }

    /**
     * Type argument {@code index} of a parameterized type, the component type of an array type,
     * or {@code Object} when the type is raw.
     */
    static java.lang.reflect.Type typeArgument(java.lang.reflect.Type t, int index) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[index]);
        if (t instanceof GenericArrayType g) return canonicalize(g.getGenericComponentType());
        if (t instanceof Class<?> c && c.isArray()) return c.getComponentType();
        return Object.class;
    }

    /**
     * Replace wildcards and type variables with their first upper bound.
     */
    static java.lang.reflect.Type canonicalize(java.lang.reflect.Type t) {
        if (t instanceof WildcardType w) return canonicalize(w.getUpperBounds()[0]);
        if (t instanceof TypeVariable<?> v) return canonicalize(v.getBounds()[0]);
        return t;
    }

    // ============================================================
    // Exceptions
    // ============================================================

    /**
     * Base of every exception thrown while reading, writing or binding JSON.
     *
     * @since 0.1.0
     */
    public abstract static class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }

        public Exception(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * A value cannot be represented in JSON: unsupported type, NaN or Infinity, or a cycle.
     *
     * @since 0.1.0
     */
    public static class WriteException extends Exception {
        public WriteException(String message) {
            super(message);
        }

        public WriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The input is not well-formed JSON. The message ends with the line and column where reading stopped.
     *
     * @since 0.1.0
     */
    public static class SyntaxException extends Exception {
        public SyntaxException(String message) {
            super(message);
        }

        public SyntaxException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Well-formed JSON that cannot be bound to the requested Java type.
     *
     * @since 0.1.0
     */
    public static class ConversionException extends Exception {
        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
