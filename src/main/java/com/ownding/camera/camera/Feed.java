package com.ownding.camera.camera;

import java.util.UUID;

public record Feed(
        UUID id,
        String protocol,
        int port,
        String path
) {
    public static final String DEFAULT_PATH = "/";
}
