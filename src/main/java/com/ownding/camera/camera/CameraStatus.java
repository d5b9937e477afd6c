package com.ownding.camera.camera;

import java.time.Instant;
import java.util.UUID;

public record CameraStatus(
        UUID cameraId,
        boolean online,
        Instant lastCheckin
) {
}
