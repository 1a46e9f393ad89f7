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

/** A calibration table could not be read. Carries the offending file name. */
public class CalibrationFileException extends WcsUpdateException {
    private final String fileName;

    public CalibrationFileException(String fileName, Throwable cause) {
        super(ErrorKind.CALIBRATION_IO, "Calibration file '" + fileName + "' could not be read", cause);
        this.fileName = fileName;
    }

    /** The file was read but its content is unusable. */
    public CalibrationFileException(String fileName, String problem, Throwable cause) {
        super(ErrorKind.CALIBRATION_IO, "Calibration file '" + fileName + "' is malformed: " + problem, cause);
        this.fileName = fileName;
    }

    public String fileName() {
        return fileName;
    }
}
