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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * View of an extension header layered over its primary header. Reads see
 * extension keywords first; writes go to the extension only.
 */
public final class MergedHeader implements Header {
    private final Header primary;
    private final Header extension;

    public MergedHeader(Header primary, Header extension) {
        this.primary = primary;
        this.extension = extension;
    }

    @Override
    public Object get(String keyword) {
        Object value = extension.get(keyword);
        return value != null ? value : primary.get(keyword);
    }

    @Override
    public void put(String keyword, Object value) {
        extension.put(keyword, value);
    }

    @Override
    public boolean containsKey(String keyword) {
        return extension.containsKey(keyword) || primary.containsKey(keyword);
    }

    @Override
    public Set<String> keywords() {
        Set<String> all = new LinkedHashSet<>(primary.keywords());
        all.addAll(extension.keywords());
        return all;
    }
}
