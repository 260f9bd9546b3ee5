package orderedmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A string-keyed map that remembers the order in which keys were first set.
 *
 * <p> The order survives mutation, sorting and a JSON round trip through {@link Json}:
 * <pre>{@code
 * var map = new OrderedMap<Integer>();
 * map.set("z", 1);
 * map.set("a", 2);
 * map.set("z", 3); // value replaced, position kept
 * map.toJson();    // -> {"z":3,"a":2}
 * }</pre>
 *
 * <p> Instances are not thread-safe; callers that share one instance between threads must
 * synchronize externally.
 *
 * @param <T> value type
 * @since 0.1.0
 */
public final class OrderedMap<T> implements Iterable<OrderedMap.Entry<T>> {

    private final List<String> keys;
    private final Map<String, T> values;
    private boolean escapeHtml = true;

    public OrderedMap() {
        this.keys = new ArrayList<>();
        this.values = new HashMap<>();
    }

    OrderedMap(int expectedSize) {
        this.keys = new ArrayList<>(expectedSize);
        this.values = new HashMap<>(Json.mapCap(expectedSize));
    }

    /**
     * One key/value pair, in key order.
     *
     * @param key   never {@code null}
     * @param value may be {@code null}
     * @param <T>   value type
     */
    public record Entry<T>(String key, @Nullable T value) {}

    /**
     * Whether {@code <}, {@code >} and {@code &} are escaped when this map is encoded.
     *
     * @return {@code true} by default
     */
    public boolean isEscapeHtml() {
        return escapeHtml;
    }

    /**
     * Toggle HTML-safe escaping for {@link #toJson()}, {@link Json#stringify(Object)} and
     * {@link Json#encode(OrderedMap)}. The setting of the outermost map applies to every nested
     * value, nested maps included.
     *
     * @param escapeHtml {@code false} to write {@code <}, {@code >} and {@code &} literally
     */
    public void setEscapeHtml(boolean escapeHtml) {
        this.escapeHtml = escapeHtml;
    }

    /**
     * Get the value for a key.
     *
     * <p> A {@code null} result is ambiguous when {@code null} values are stored, use
     * {@link #containsKey(String)} to tell a missing key from a {@code null} value.
     *
     * @param key key, not {@code null}
     * @return the value, or {@code null} if the key is absent
     */
    public @Nullable T get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    /**
     * @param key          key, not {@code null}
     * @param defaultValue returned when the key is absent
     * @return the stored value (maybe {@code null}) if present, otherwise {@code defaultValue}
     */
    public @Nullable T getOrDefault(String key, @Nullable T defaultValue) {
        return values.containsKey(key) ? values.get(key) : defaultValue;
    }

    /**
     * Associate a value with a key. A new key goes to the end of {@link #keys()}, an existing key
     * keeps its position.
     *
     * @param key   key, not {@code null}
     * @param value value, may be {@code null}
     */
    public void set(String key, @Nullable T value) {
        Objects.requireNonNull(key, "key");
        if (!values.containsKey(key)) keys.add(key);
        values.put(key, value);
    }

    /**
     * Remove a key and its value. Removing an absent key does nothing.
     *
     * @param key key, not {@code null}
     */
    public void delete(String key) {
        if (!values.containsKey(key)) return;
        keys.remove(key);
        values.remove(key);
    }

    /**
     * The keys in order.
     *
     * <p> This is a read-only view, not a copy: it reflects later {@code set}, {@code delete} and
     * sort calls. Copy it if a snapshot is needed.
     *
     * @return unmodifiable live view of the key order
     */
    public List<String> keys() {
        return Collections.unmodifiableList(keys);
    }

    /**
     * Reorder the keys with a comparator over the key strings only.
     *
     * @param comparator key order, not {@code null}
     */
    public void sortKeys(Comparator<? super String> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        keys.sort(comparator);
    }

    /**
     * Reorder the keys with a comparator over whole entries, so the order may depend on values.
     * The sort is stable: entries the comparator considers equal keep their relative order.
     *
     * <pre>{@code
     * // descending by value
     * map.sort(Comparator.comparing(OrderedMap.Entry::value, Comparator.reverseOrder()));
     * }</pre>
     *
     * @param comparator entry order, not {@code null}
     */
    public void sort(Comparator<? super Entry<T>> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        var entries = entries();
        entries.sort(comparator);
        for (int i = 0; i < entries.size(); i++) {
            keys.set(i, entries.get(i).key());
        }
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * @return a new mutable list of the entries in key order
     */
    public List<Entry<T>> entries() {
        var entries = new ArrayList<Entry<T>>(keys.size());
        for (var key : keys) entries.add(new Entry<>(key, values.get(key)));
        return entries;
    }

    @Override
    public Iterator<Entry<T>> iterator() {
        return Collections.unmodifiableList(entries()).iterator();
    }

    /**
     * Encode this map with its own {@link #isEscapeHtml() escaping mode}.
     *
     * @return compact JSON object text, members in key order
     * @throws Json.WriteException if a value cannot be represented in JSON
     */
    public String toJson() {
        return Json.stringify(this);
    }

    /**
     * Two maps are equal when they hold the same keys in the same order with equal values.
     * The escaping mode does not take part.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderedMap<?> that)) return false;
        return keys.equals(that.keys) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keys, values);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
