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
import java.util.function.Supplier;

/**
 * Growable array of longs with an optional capacity limit. Backs the matcher's backtrack stack,
 * which is handed out in blocks of one {@link REStackFrame} each.
 */
final class MutableVector64 {
    private final Supplier<RuntimeException> overflowExceptionProvider;

    private long[] buffer = new long[32];
    private int length = 0;

    /** Zero for no limit. */
    private int maxCapacity = 0;

    MutableVector64(final Supplier<RuntimeException> overflowExceptionProvider) {
        this.overflowExceptionProvider = overflowExceptionProvider;
    }

    int size() {
        return length;
    }

    long elementAti(final int i) {
        return buffer[i];
    }

    void setElementAt(final long elem, final int index) {
        buffer[index] = elem;
    }

    void removeAllElements() {
        length = 0;
    }

    private void expandCapacity(final int minimumCapacity) {
        if (minimumCapacity < 0) {
            throw new IllegalArgumentException();
        }
        if (buffer.length >= minimumCapacity) {
            return;
        }
        if (maxCapacity > 0 && minimumCapacity > maxCapacity) {
            throw overflowExceptionProvider.get();
        }
        int newCap = buffer.length <= 0xffff ? 4 * buffer.length : 2 * buffer.length;
        if (newCap < minimumCapacity) {
            newCap = minimumCapacity;
        }
        if (maxCapacity > 0 && newCap > maxCapacity) {
            newCap = maxCapacity;
        }
        buffer = Arrays.copyOf(buffer, newCap);
    }

    void setMaxCapacity(final int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException();
        }
        maxCapacity = limit;
        if (buffer.length <= maxCapacity || maxCapacity == 0) {
            // Current capacity is within the new limit.
            return;
        }

        // New maximum capacity is smaller than the current size.
        buffer = Arrays.copyOf(buffer, maxCapacity);
        if (length > buffer.length) {
            length = buffer.length;
        }
    }

    REStackFrame reserveBlock(final int size) {
        expandCapacity(length + size);
        REStackFrame frame = new REStackFrame(this, length);
        length += size;
        return frame;
    }

    REStackFrame getLastBlock(final int size) {
        return new REStackFrame(this, length - size);
    }

    /**
     * Drops the top frame.
     *
     * @return the frame that is on the top afterwards
     */
    REStackFrame popFrame(final int size) {
        if (length < 2 * size) {
            throw new IllegalStateException("Backtrack stack underflow");
        }
        length -= size;
        return new REStackFrame(this, length - size);
    }

    /**
     * Truncates the stack, or grows it with zero filled slots.
     */
    void setSize(final int newSize) {
        if (newSize < 0) {
            return;
        }
        if (newSize > length) {
            expandCapacity(newSize);
            Arrays.fill(buffer, length, newSize, 0);
        }
        length = newSize;
    }
}
