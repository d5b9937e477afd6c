package com.ownding.camera.camera;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-lifetime storage of camera records keyed by id. Applies no business rules.
 *
 * <p>Not thread-safe on its own: {@link CameraRegistry} serializes all access.
 */
@Repository
public class CameraRepository {

    private static final Logger log = LoggerFactory.getLogger(CameraRepository.class);

    private final Map<UUID, Camera> cameras = new LinkedHashMap<>();

    public void put(Camera camera) {
        Camera previous = cameras.put(camera.id(), camera);
        log.debug("camera stored. id={}, replaced={}", camera.id(), previous != null);
    }

    public Optional<Camera> get(UUID id) {
        return Optional.ofNullable(cameras.get(id));
    }

    public boolean delete(UUID id) {
        boolean removed = cameras.remove(id) != null;
        log.debug("camera delete. id={}, removed={}", id, removed);
        return removed;
    }

    public List<Camera> listAll() {
        return List.copyOf(cameras.values());
    }

    public int count() {
        return cameras.size();
    }
}
