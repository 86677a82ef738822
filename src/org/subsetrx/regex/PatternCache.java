/*
 * @LICENSE@
 */

package org.subsetrx.regex;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;
import com.google.common.util.concurrent.UncheckedExecutionException;

/**
 * A bounded, least recently used memo of compiled {@link Pattern}s, keyed by
 * pattern text, {@link Alphabet} and {@link EngineStyle}. Nothing in this
 * package caches by itself; a cache is only ever used when a client creates
 * one. Instances are thread safe.
 * <p>
 * Compilation failures are not cached: every lookup of a bad pattern throws
 * again.
 */
public final class PatternCache {

    private static final Logger logger = Logger.getLogger("org.subsetrx.regex");
    private static final Level level = Level.FINER;

    public static final int DEFAULT_CAPACITY = 64;

    private static final class Key {

        final String regex;
        final Alphabet alphabet;
        final EngineStyle style;

        Key(String regex, Alphabet alphabet, EngineStyle style) {
            if (regex == null) throw new NullPointerException("regex");
            if (alphabet == null) throw new NullPointerException("alphabet");
            if (style == null) throw new NullPointerException("style");
            this.regex = regex;
            this.alphabet = alphabet;
            this.style = style;
        }

        @Override
        public int hashCode() {
            final int prime = 31;
            int result = 1;
            result = prime * result + regex.hashCode();
            result = prime * result + alphabet.hashCode();
            result = prime * result + style.hashCode();
            return result;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj)
                return true;
            if (!(obj instanceof Key))
                return false;
            final Key other = (Key) obj;
            return regex.equals(other.regex)
                    && alphabet.equals(other.alphabet)
                    && style == other.style;
        }

        @Override
        public String toString() {
            return regex + ' ' + alphabet + ' ' + style;
        }
    }

    private final int capacity;
    private final Cache<Key, Pattern> cache;

    public PatternCache() {
        this(DEFAULT_CAPACITY);
    }

    public PatternCache(final int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity: " + capacity);
        }
        this.capacity = capacity;
        // one segment: eviction order is exact LRU over the whole cache
        this.cache = CacheBuilder.newBuilder()
            .concurrencyLevel(1)
            .maximumSize(capacity)
            .removalListener(new RemovalListener<Key, Pattern>() {
                public void onRemoval(RemovalNotification<Key, Pattern> n) {
                    if (n.wasEvicted()) {
                        logger.log(level, "cache evict: " + n.getKey());
                    }
                }
            })
            .build();
    }

    public Pattern compile(String regex, Alphabet alphabet) {
        return compile(regex, alphabet, EngineStyle.DFA_TABLE);
    }

    /**
     * @return the cached pattern, compiling and caching it first if absent.
     * @throws MalformedPatternException
     *             as {@link Pattern#compile(String, Alphabet, EngineStyle)}.
     * @throws BuildException
     *             as {@link Pattern#compile(String, Alphabet, EngineStyle)}.
     */
    public Pattern compile(final String regex, final Alphabet alphabet,
            final EngineStyle style) {
        final Key key = new Key(regex, alphabet, style);
        Pattern p = cache.getIfPresent(key);
        if (p != null) {
            logger.log(level, "cache hit: " + key);
            return p;
        }
        try {
            return cache.get(key, new Callable<Pattern>() {
                public Pattern call() {
                    logger.log(level, "cache miss: " + key);
                    return Pattern.compile(regex, alphabet, style);
                }
            });
        } catch (UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw e;
        } catch (ExecutionException e) {
            // the loader throws no checked exceptions
            throw new AssertionError(e);
        }
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return (int) cache.size();
    }

    public void clear() {
        cache.invalidateAll();
    }
}
