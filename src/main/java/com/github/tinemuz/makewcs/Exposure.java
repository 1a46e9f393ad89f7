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

import java.util.List;
import java.util.Optional;

/**
 * One observation as seen by {@link MakeWcs}: the primary header, the headers
 * of its science extensions in extension order, and the header of its
 * support file when there is one.
 *
 * <p>Headers are updated in place; persisting them is the caller's job.</p>
 */
public interface Exposure {

    String name();

    Header primaryHeader();

    List<Header> scienceHeaders();

    Optional<Header> supportHeader();

    static Exposure of(String name, Header primary, List<Header> science) {
        return of(name, primary, science, null);
    }

    static Exposure of(String name, Header primary, List<Header> science, Header support) {
        List<Header> copy = List.copyOf(science);
        return new Exposure() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Header primaryHeader() {
                return primary;
            }

            @Override
            public List<Header> scienceHeaders() {
                return copy;
            }

            @Override
            public Optional<Header> supportHeader() {
                return Optional.ofNullable(support);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
