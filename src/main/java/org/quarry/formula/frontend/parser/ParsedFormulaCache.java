package org.quarry.formula.frontend.parser;

import org.quarry.formula.api.FormulaException;
import org.quarry.formula.api.ParsedFormula;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded LRU cache of parse results keyed by source text.
 * <p>
 * Parsing is pure, so a cached {@link ParsedFormula} can be handed out to any number of concurrent
 * evaluations. Only successful parses are cached; a failing source is re-parsed on every request so
 * that the caller always receives a fresh exception.
 * <p>
 * Thread-safe via synchronization. A capacity of 0 disables caching.
 */
public class ParsedFormulaCache {

    private final int capacity;
    private final Map<String, ParsedFormula> entries;

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    /**
     * @param capacity Maximum number of entries; 0 disables caching.
     */
    public ParsedFormulaCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative, got " + capacity);
        }
        this.capacity = capacity;
        // access-order, so the eldest entry is the least recently used one
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ParsedFormula> eldest) {
                return size() > ParsedFormulaCache.this.capacity;
            }
        };
    }

    /**
     * Returns the cached parse of {@code source}, parsing and caching it on a miss.
     *
     * @param source The formula source text.
     * @return The parse result.
     * @throws FormulaException if the source does not parse.
     */
    public ParsedFormula getOrParse(String source) throws FormulaException {
        if (capacity == 0) {
            misses.incrementAndGet();
            return Parser.parseFormula(source);
        }
        synchronized (entries) {
            ParsedFormula cached = entries.get(source);
            if (cached != null) {
                hits.incrementAndGet();
                return cached;
            }
        }
        misses.incrementAndGet();
        ParsedFormula parsed = Parser.parseFormula(source);
        synchronized (entries) {
            entries.put(source, parsed);
        }
        return parsed;
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }
}
