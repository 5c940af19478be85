package org.courier.json;

import org.courier.manager.api.MessageUsage;

public record JsonUsage(int size, int maximum, boolean overflowing) {

    public static JsonUsage from(MessageUsage usage) {
        return new JsonUsage(usage.size(), usage.maximum(), usage.isOverflowing());
    }
}
