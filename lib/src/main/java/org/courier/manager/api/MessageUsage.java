package org.courier.manager.api;

public record MessageUsage(int size, int maximum) {

    public boolean isOverflowing() {
        return size > maximum;
    }

    public String describe() {
        return size + " of " + maximum + " bytes";
    }
}
