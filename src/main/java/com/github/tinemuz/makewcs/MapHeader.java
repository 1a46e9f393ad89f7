/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.makewcs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** In-memory {@link Header} that keeps keywords in insertion order. */
public final class MapHeader implements Header {
    private final Map<String, Object> cards = new LinkedHashMap<>();

    public MapHeader() {}

    public MapHeader(Map<String, ?> initial) {
        initial.forEach(this::put);
    }

    @Override
    public Object get(String keyword) {
        return cards.get(normalize(keyword));
    }

    @Override
    public void put(String keyword, Object value) {
        cards.put(normalize(keyword), value);
    }

    @Override
    public boolean containsKey(String keyword) {
        return cards.containsKey(normalize(keyword));
    }

    @Override
    public Set<String> keywords() {
        return Collections.unmodifiableSet(cards.keySet());
    }

    /** Fluent variant of {@link #put} for building fixtures. */
    public MapHeader with(String keyword, Object value) {
        put(keyword, value);
        return this;
    }

    // FITS keywords are case-insensitive; store them upper case
    private static String normalize(String keyword) {
        return keyword.trim().toUpperCase();
    }

    @Override
    public String toString() {
        return "MapHeader" + cards;
    }
}
