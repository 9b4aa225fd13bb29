// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
/*
 *******************************************************************************
 * Copyright (C) 2014, International Business Machines Corporation and
 * others. All Rights Reserved.
 *******************************************************************************
 *
 * created on: 2014feb10
 * created by: Markus W. Scherer
 */
package com.github.tarcv.binexp;

import java.util.Arrays;

/**
 * Growable array of ints without boxing. Holds compiled patterns and literal symbol runs.
 */
final class MutableVector32 {
    private int[] buffer;
    private int length = 0;

    MutableVector32() {
        this(-1);
    }

    MutableVector32(final int initialCapacity) {
        int fixedCapacity = initialCapacity;
        if (fixedCapacity < 1) {
            fixedCapacity = 32;
        }
        buffer = new int[fixedCapacity];
    }

    int size() {
        return length;
    }

    int elementAti(final int i) {
        assert i >= 0 && i < length;
        return buffer[i];
    }

    void addElement(final int e) {
        ensureCapacity(length + 1);
        buffer[length++] = e;
    }

    void setElementAt(final int elem, final int index) {
        assert index >= 0 && index < length;
        buffer[index] = elem;
    }

    void ensureCapacity(final int minimumCapacity) {
        if (minimumCapacity < 0) {
            throw new IllegalArgumentException();
        }
        if (buffer.length >= minimumCapacity) {
            return;
        }
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }

    /**
     * A copy of the held elements, trimmed to size. Compiled patterns keep this frozen form.
     */
    int[] toArray() {
        return Arrays.copyOf(buffer, length);
    }
}
