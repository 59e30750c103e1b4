package com.id.chrono.modules.index.model;

import java.util.Arrays;

/**
 * Index over an explicit, strictly increasing array of timestamps.
 */
public final class IrregularDateTimeIndex extends DateTimeIndex {

    private final long[] instants;

    // callers hand over an owned, validated array
    IrregularDateTimeIndex(long[] instants) {
        this.instants = instants;
    }

    @Override
    public int size() {
        return instants.length;
    }

    @Override
    long tmsAt(int loc) {
        return instants[loc];
    }

    @Override
    public int locate(long tms) {
        int loc = Arrays.binarySearch(instants, tms);
        return loc >= 0 ? loc : NOT_FOUND;
    }

    @Override
    public int insertionLoc(long tms) {
        int loc = Arrays.binarySearch(instants, tms);
        return loc >= 0 ? loc + 1 : -(loc + 1);
    }

    @Override
    public DateTimeIndex slice(int fromPos, int toPos) {
        checkSlice(fromPos, toPos);
        return new IrregularDateTimeIndex(Arrays.copyOfRange(instants, fromPos, toPos));
    }

    @Override
    public long[] toMillisArray() {
        return instants.clone();
    }

    @Override
    public String toString() {
        if (instants.length == 0) {
            return "IrregularDateTimeIndex[]";
        }
        return "IrregularDateTimeIndex[size=%d, first=%d, last=%d]"
                .formatted(instants.length, instants[0], instants[instants.length - 1]);
    }
}
