package org.nowstart.backtester.data.dto;

/**
 * Order size bounds. A zero bound is not enforced.
 */
public record MinMax(double minimumSize, double maximumSize, double maximumTotal) {

    public static final MinMax NONE = new MinMax(0, 0, 0);

    public boolean isConsistent() {
        if (minimumSize < 0 || maximumSize < 0 || maximumTotal < 0) {
            return false;
        }
        return maximumSize <= 0 || minimumSize <= maximumSize;
    }
}
