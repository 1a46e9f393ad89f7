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

import java.io.IOException;
import java.nio.file.Path;

/**
 * {@link CalibrationSource} that looks tables up in one directory. A table
 * named {@code x_idc.fits} is read from {@code x_idc.fits} or, failing that,
 * {@code x_idc.txt}.
 */
public final class DirectoryCalibrationSource implements CalibrationSource {
    private final Path directory;

    public DirectoryCalibrationSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public CalibrationTable open(String name) throws IOException {
        String base = CalibrationSource.baseName(name);
        Path path = directory.resolve(base);
        if (!path.toFile().exists() && base.endsWith(".fits")) {
            Path text = directory.resolve(base.substring(0, base.length() - 5) + ".txt");
            if (text.toFile().exists()) path = text;
        }
        return CalibrationTable.load(path);
    }
}
