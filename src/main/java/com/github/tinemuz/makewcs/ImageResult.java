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

/**
 * Outcome of processing one exposure.
 *
 * @param image exposure name
 * @param status what happened
 * @param extensions number of science extensions updated or restored
 * @param errorKind kind of the failure, {@code null} unless {@code FAILED}
 * @param message reason for a skip or failure, {@code null} otherwise
 */
public record ImageResult(String image, Status status, int extensions, ErrorKind errorKind, String message) {

    public enum Status {
        UPDATED,
        RESTORED,
        SKIPPED,
        FAILED
    }

    static ImageResult updated(String image, int extensions) {
        return new ImageResult(image, Status.UPDATED, extensions, null, null);
    }

    static ImageResult restored(String image, int extensions) {
        return new ImageResult(image, Status.RESTORED, extensions, null, null);
    }

    static ImageResult skipped(String image, String message) {
        return new ImageResult(image, Status.SKIPPED, 0, null, message);
    }

    static ImageResult failed(String image, int extensions, WcsUpdateException e) {
        return new ImageResult(image, Status.FAILED, extensions, e.kind(), e.getMessage());
    }

    public boolean isSuccess() {
        return status == Status.UPDATED || status == Status.RESTORED;
    }
}
