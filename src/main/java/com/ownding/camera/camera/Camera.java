package com.ownding.camera.camera;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A registered network camera together with the feeds it exposes.
 *
 * <p>Instances are immutable; every change yields a new record that replaces the old one in the
 * {@link CameraRepository}. {@code ipAddress} is held in canonical textual form.
 */
public record Camera(
        UUID id,
        String name,
        String model,
        String ipAddress,
        ImageSettings imageSettings,
        List<Feed> feeds,
        Instant createdAt,
        Instant updatedAt,
        Instant lastCheckin
) {
    public Camera {
        feeds = List.copyOf(feeds);
    }

    Camera withDetails(String name, String model, String ipAddress, ImageSettings imageSettings, Instant now) {
        return new Camera(id, name, model, ipAddress, imageSettings, feeds, createdAt, now, lastCheckin);
    }

    Camera withFeeds(List<Feed> feeds, Instant now) {
        return new Camera(id, name, model, ipAddress, imageSettings, feeds, createdAt, now, lastCheckin);
    }

    Camera withCheckin(Instant now) {
        return new Camera(id, name, model, ipAddress, imageSettings, feeds, createdAt, now, now);
    }
}
