package com.ttennebkram.cookieflip.ml;

/**
 * Class labels used for cookie orientation.
 */
public enum CookieLabel {
    NOT_FLIPPED(1, "not flipped"),
    FLIPPED(2, "flipped");

    public final int id;
    public final String displayName;

    CookieLabel(int id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public static CookieLabel fromId(int id) {
        for (CookieLabel label : values()) {
            if (label.id == id) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown cookie label: " + id);
    }

    public static boolean isFlipped(int id) {
        return id == FLIPPED.id;
    }
}
