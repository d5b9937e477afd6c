package com.ownding.camera.camera;

public record ImageSettings(
        int brightness,
        int contrast,
        int saturation
) {
    public static final int DEFAULT_LEVEL = 50;

    public static ImageSettings defaults() {
        return new ImageSettings(DEFAULT_LEVEL, DEFAULT_LEVEL, DEFAULT_LEVEL);
    }
}
