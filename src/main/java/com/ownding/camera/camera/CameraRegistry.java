package com.ownding.camera.camera;

import com.ownding.camera.common.RegistryException;
import com.ownding.camera.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Business rules over the {@link CameraRepository}: uniqueness across the whole collection, heartbeat liveness,
 * filtering and pagination.
 *
 * <p>Uniqueness checks scan every record, so all writes share one exclusive lock; reads may run together.
 * Liveness is derived from the clock at query time, nothing expires in the background.
 */
@Service
public class CameraRegistry {

    private static final Logger log = LoggerFactory.getLogger(CameraRegistry.class);

    private final CameraRepository cameraRepository;
    private final Clock clock;
    private final Duration heartbeatTimeout;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public CameraRegistry(CameraRepository cameraRepository, Clock clock, AppProperties appProperties) {
        this.cameraRepository = cameraRepository;
        this.clock = clock;
        this.heartbeatTimeout = appProperties.getRegistry().getHeartbeatTimeout();
    }

    public Camera addCamera(CreateCameraCommand command) {
        String ipAddress = IpAddresses.canonical(command.ipAddress());
        return write(() -> {
            List<Camera> existing = cameraRepository.listAll();
            for (Camera camera : existing) {
                if (camera.ipAddress().equals(ipAddress)) {
                    log.warn("duplicate ip rejected. ip={}", ipAddress);
                    throw RegistryException.conflict("A camera with this IP address already exists");
                }
            }
            for (Camera camera : existing) {
                if (camera.name().equals(command.name()) && camera.model().equals(command.model())) {
                    log.warn("duplicate name and model rejected. name={}, model={}", command.name(), command.model());
                    throw RegistryException.conflict("A camera with the same name and model already exists");
                }
            }

            // the initial batch is not checked against itself
            List<Feed> feeds = new ArrayList<>();
            for (FeedSpec spec : command.feeds()) {
                feeds.add(new Feed(UUID.randomUUID(), spec.protocol(), spec.port(), spec.path()));
            }
            Instant now = clock.instant();
            ImageSettings imageSettings = command.imageSettings() == null
                    ? ImageSettings.defaults()
                    : command.imageSettings();
            Camera camera = new Camera(UUID.randomUUID(), command.name(), command.model(), ipAddress,
                    imageSettings, feeds, now, now, null);
            cameraRepository.put(camera);
            log.info("camera created. id={}, ip={}, feeds={}", camera.id(), ipAddress, feeds.size());
            return camera;
        });
    }

    public Camera getCamera(UUID cameraId) {
        return read(() -> requireCamera(cameraId));
    }

    public void removeCamera(UUID cameraId) {
        write(() -> {
            if (!cameraRepository.delete(cameraId)) {
                log.warn("remove rejected, camera not found. id={}", cameraId);
                throw cameraNotFound();
            }
            log.info("camera removed. id={}", cameraId);
            return null;
        });
    }

    /**
     * Applies the non-null fields of {@code command}. Uniqueness is not re-checked here.
     */
    public Camera updateCamera(UUID cameraId, UpdateCameraCommand command) {
        return write(() -> {
            Camera camera = requireCamera(cameraId, "update camera");
            String name = command.name() == null ? camera.name() : command.name();
            String model = command.model() == null ? camera.model() : command.model();
            String ipAddress = command.ipAddress() == null
                    ? camera.ipAddress()
                    : IpAddresses.canonical(command.ipAddress());
            ImageSettings imageSettings = command.imageSettings() == null
                    ? camera.imageSettings()
                    : command.imageSettings();

            boolean changed = !name.equals(camera.name())
                    || !model.equals(camera.model())
                    || !ipAddress.equals(camera.ipAddress())
                    || !imageSettings.equals(camera.imageSettings());
            if (!changed) {
                log.debug("camera update had no effect. id={}", cameraId);
                return camera;
            }
            Camera updated = camera.withDetails(name, model, ipAddress, imageSettings, clock.instant());
            cameraRepository.put(updated);
            log.info("camera updated. id={}", cameraId);
            return updated;
        });
    }

    /**
     * Filters by model, then IP range, then online state, and returns the requested page.
     *
     * @throws RegistryException of kind CONFLICT if an IP range bound is not an address literal
     */
    public List<Camera> listCameras(CameraQuery query) {
        InetAddress from = parseBound(query.ipFrom());
        InetAddress to = parseBound(query.ipTo());
        return read(() -> {
            Instant now = clock.instant();
            List<Camera> cameras = cameraRepository.listAll();
            if (query.model() != null && !query.model().isEmpty()) {
                String needle = query.model().toLowerCase(Locale.ROOT);
                cameras = cameras.stream()
                        .filter(camera -> camera.model().toLowerCase(Locale.ROOT).contains(needle))
                        .toList();
            }
            if (from != null || to != null) {
                cameras = cameras.stream()
                        .filter(camera -> IpAddresses.inRange(addressOf(camera), from, to))
                        .toList();
            }
            if (query.online() != null) {
                boolean online = query.online();
                cameras = cameras.stream()
                        .filter(camera -> isOnline(camera, now) == online)
                        .toList();
            }
            return Pages.slice(cameras, query.page(), query.pageSize());
        });
    }

    public Feed addFeed(UUID cameraId, FeedSpec spec) {
        return write(() -> {
            Camera camera = requireCamera(cameraId, "add feed");
            for (Feed feed : camera.feeds()) {
                if (feed.protocol().equals(spec.protocol()) && feed.port() == spec.port()) {
                    log.warn("duplicate feed rejected. cameraId={}, protocol={}, port={}",
                            cameraId, spec.protocol(), spec.port());
                    throw RegistryException.conflict("A feed with the same protocol and port already exists for this camera");
                }
            }
            // ports are global: protocol does not matter here
            for (Camera other : cameraRepository.listAll()) {
                for (Feed feed : other.feeds()) {
                    if (feed.port() == spec.port()) {
                        log.warn("feed port already taken. cameraId={}, port={}, ownerId={}",
                                cameraId, spec.port(), other.id());
                        throw RegistryException.conflict("Feed port " + spec.port() + " is already in use");
                    }
                }
            }
            Feed feed = new Feed(UUID.randomUUID(), spec.protocol(), spec.port(), spec.path());
            List<Feed> feeds = new ArrayList<>(camera.feeds());
            feeds.add(feed);
            cameraRepository.put(camera.withFeeds(feeds, clock.instant()));
            log.info("feed added. cameraId={}, feedId={}, port={}", cameraId, feed.id(), feed.port());
            return feed;
        });
    }

    public Feed getFeed(UUID cameraId, UUID feedId) {
        return read(() -> {
            Camera camera = requireCamera(cameraId);
            return camera.feeds().get(indexOfFeed(camera, feedId, null));
        });
    }

    /**
     * Applies the non-null fields of {@code command} to one feed. Port uniqueness is not re-checked here.
     */
    public Feed updateFeed(UUID cameraId, UUID feedId, UpdateFeedCommand command) {
        return write(() -> {
            Camera camera = requireCamera(cameraId, "update feed");
            int index = indexOfFeed(camera, feedId, "update feed");
            Feed current = camera.feeds().get(index);
            Feed updated = new Feed(
                    current.id(),
                    command.protocol() == null ? current.protocol() : command.protocol(),
                    command.port() == null ? current.port() : command.port(),
                    command.path() == null ? current.path() : command.path());
            List<Feed> feeds = new ArrayList<>(camera.feeds());
            feeds.set(index, updated);
            cameraRepository.put(camera.withFeeds(feeds, clock.instant()));
            log.info("feed updated. cameraId={}, feedId={}", cameraId, feedId);
            return updated;
        });
    }

    public void removeFeed(UUID cameraId, UUID feedId) {
        write(() -> {
            Camera camera = requireCamera(cameraId, "remove feed");
            int index = indexOfFeed(camera, feedId, "remove feed");
            List<Feed> feeds = new ArrayList<>(camera.feeds());
            feeds.remove(index);
            cameraRepository.put(camera.withFeeds(feeds, clock.instant()));
            log.info("feed removed. cameraId={}, feedId={}", cameraId, feedId);
            return null;
        });
    }

    /**
     * Filters one camera's feeds (all criteria optional, combined with AND) and returns the requested page.
     */
    public List<Feed> listFeeds(UUID cameraId, FeedQuery query) {
        return read(() -> {
            List<Feed> feeds = requireCamera(cameraId).feeds();
            if (query.protocol() != null && !query.protocol().isEmpty()) {
                feeds = feeds.stream()
                        .filter(feed -> feed.protocol().equalsIgnoreCase(query.protocol()))
                        .toList();
            }
            if (query.port() != null) {
                int port = query.port();
                feeds = feeds.stream()
                        .filter(feed -> feed.port() == port)
                        .toList();
            }
            if (query.pathContains() != null && !query.pathContains().isEmpty()) {
                String needle = query.pathContains().toLowerCase(Locale.ROOT);
                feeds = feeds.stream()
                        .filter(feed -> feed.path().toLowerCase(Locale.ROOT).contains(needle))
                        .toList();
            }
            return Pages.slice(feeds, query.page(), query.pageSize());
        });
    }

    public void heartbeat(UUID cameraId) {
        write(() -> {
            Camera camera = requireCamera(cameraId, "heartbeat").withCheckin(clock.instant());
            cameraRepository.put(camera);
            log.debug("heartbeat. cameraId={}, at={}", cameraId, camera.lastCheckin());
            return null;
        });
    }

    public boolean isOnline(UUID cameraId) {
        return read(() -> isOnline(requireCamera(cameraId), clock.instant()));
    }

    public CameraStatus status(UUID cameraId) {
        return read(() -> {
            Camera camera = requireCamera(cameraId);
            return new CameraStatus(camera.id(), isOnline(camera, clock.instant()), camera.lastCheckin());
        });
    }

    private boolean isOnline(Camera camera, Instant now) {
        Instant lastCheckin = camera.lastCheckin();
        if (lastCheckin == null) {
            return false;
        }
        return Duration.between(lastCheckin, now).compareTo(heartbeatTimeout) <= 0;
    }

    private Camera requireCamera(UUID cameraId) {
        return cameraRepository.get(cameraId).orElseThrow(CameraRegistry::cameraNotFound);
    }

    private Camera requireCamera(UUID cameraId, String operation) {
        return cameraRepository.get(cameraId).orElseThrow(() -> {
            log.warn("{} rejected, camera not found. id={}", operation, cameraId);
            return cameraNotFound();
        });
    }

    /**
     * @param operation write being attempted, logged when the feed is missing; {@code null} for reads
     */
    private static int indexOfFeed(Camera camera, UUID feedId, String operation) {
        List<Feed> feeds = camera.feeds();
        for (int i = 0; i < feeds.size(); i++) {
            if (feeds.get(i).id().equals(feedId)) {
                return i;
            }
        }
        if (operation != null) {
            log.warn("{} rejected, feed not found. cameraId={}, feedId={}", operation, camera.id(), feedId);
        }
        throw RegistryException.notFound("Feed not found");
    }

    private static RegistryException cameraNotFound() {
        return RegistryException.notFound("Camera not found");
    }

    private static InetAddress parseBound(String literal) {
        if (literal == null || literal.isEmpty()) {
            return null;
        }
        return IpAddresses.parse(literal)
                .orElseThrow(() -> RegistryException.conflict("Invalid IP format: " + literal));
    }

    private static InetAddress addressOf(Camera camera) {
        return IpAddresses.parse(camera.ipAddress())
                .orElseThrow(() -> new IllegalStateException("stored address is not canonical: " + camera.ipAddress()));
    }

    private <T> T read(Supplier<T> action) {
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> action) {
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public record FeedSpec(
            String protocol,
            int port,
            String path
    ) {
        public FeedSpec {
            Objects.requireNonNull(protocol, "protocol");
            path = path == null ? Feed.DEFAULT_PATH : path;
        }
    }

    public record CreateCameraCommand(
            String name,
            String model,
            InetAddress ipAddress,
            ImageSettings imageSettings,
            List<FeedSpec> feeds
    ) {
        public CreateCameraCommand {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(model, "model");
            Objects.requireNonNull(ipAddress, "ipAddress");
            feeds = feeds == null ? List.of() : List.copyOf(feeds);
        }
    }

    public record UpdateCameraCommand(
            String name,
            String model,
            InetAddress ipAddress,
            ImageSettings imageSettings
    ) {
    }

    public record UpdateFeedCommand(
            String protocol,
            Integer port,
            String path
    ) {
    }

    public record CameraQuery(
            String model,
            String ipFrom,
            String ipTo,
            Boolean online,
            int page,
            int pageSize
    ) {
    }

    public record FeedQuery(
            String protocol,
            Integer port,
            String pathContains,
            int page,
            int pageSize
    ) {
    }
}
