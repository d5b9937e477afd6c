package com.ownding.camera.camera;

import com.ownding.camera.common.ApiResult;
import com.ownding.camera.common.RegistryException;
import com.ownding.camera.config.AppProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.InetAddress;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Validated
@RestController
@RequestMapping("/api/cameras")
public class CameraController {

    private static final String PROTOCOL_PATTERN = "(?i)rtsp|http";

    private final CameraRegistry cameraRegistry;
    private final AppProperties appProperties;

    public CameraController(CameraRegistry cameraRegistry, AppProperties appProperties) {
        this.cameraRegistry = cameraRegistry;
        this.appProperties = appProperties;
    }

    @PostMapping
    public ApiResult<Camera> createCamera(@Valid @RequestBody CameraRequest request) {
        List<CameraRegistry.FeedSpec> feeds = request.feeds() == null
                ? List.of()
                : request.feeds().stream().map(this::toFeedSpec).toList();
        Camera camera = cameraRegistry.addCamera(new CameraRegistry.CreateCameraCommand(
                request.name(),
                request.model(),
                parseAddress(request.ipAddress()),
                toImageSettings(request.imageSettings(), ImageSettings.defaults()),
                feeds
        ));
        return ApiResult.success("camera created", camera);
    }

    @GetMapping
    public ApiResult<List<Camera>> listCameras(
            @RequestParam(required = false) String model,
            @RequestParam(required = false) String ipFrom,
            @RequestParam(required = false) String ipTo,
            @RequestParam(required = false) Boolean online,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer pageSize) {
        int size = resolvePageSize(page, pageSize);
        return ApiResult.success(cameraRegistry.listCameras(
                new CameraRegistry.CameraQuery(model, ipFrom, ipTo, online, page, size)));
    }

    @GetMapping("/{id}")
    public ApiResult<Camera> getCamera(@PathVariable UUID id) {
        return ApiResult.success(cameraRegistry.getCamera(id));
    }

    @PatchMapping("/{id}")
    public ApiResult<Camera> updateCamera(@PathVariable UUID id, @Valid @RequestBody CameraPatchRequest request) {
        Camera camera = cameraRegistry.updateCamera(id, new CameraRegistry.UpdateCameraCommand(
                request.name(),
                request.model(),
                request.ipAddress() == null ? null : parseAddress(request.ipAddress()),
                request.imageSettings() == null ? null : toImageSettings(request.imageSettings(), ImageSettings.defaults())
        ));
        return ApiResult.success("camera updated", camera);
    }

    @DeleteMapping("/{id}")
    public ApiResult<Void> deleteCamera(@PathVariable UUID id) {
        cameraRegistry.removeCamera(id);
        return ApiResult.successMessage("camera removed");
    }

    @PostMapping("/{id}/feeds")
    public ApiResult<Feed> addFeed(@PathVariable UUID id, @Valid @RequestBody FeedRequest request) {
        return ApiResult.success("feed added", cameraRegistry.addFeed(id, toFeedSpec(request)));
    }

    @GetMapping("/{id}/feeds")
    public ApiResult<List<Feed>> listFeeds(
            @PathVariable UUID id,
            @RequestParam(required = false) String protocol,
            @RequestParam(required = false) Integer port,
            @RequestParam(required = false) String q,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(required = false) Integer pageSize) {
        int size = resolvePageSize(page, pageSize);
        return ApiResult.success(cameraRegistry.listFeeds(id,
                new CameraRegistry.FeedQuery(protocol, port, q, page, size)));
    }

    @GetMapping("/{id}/feeds/{feedId}")
    public ApiResult<Feed> getFeed(@PathVariable UUID id, @PathVariable UUID feedId) {
        return ApiResult.success(cameraRegistry.getFeed(id, feedId));
    }

    @PatchMapping("/{id}/feeds/{feedId}")
    public ApiResult<Feed> updateFeed(@PathVariable UUID id, @PathVariable UUID feedId,
            @Valid @RequestBody FeedPatchRequest request) {
        Feed feed = cameraRegistry.updateFeed(id, feedId, new CameraRegistry.UpdateFeedCommand(
                request.protocol() == null ? null : request.protocol().toLowerCase(Locale.ROOT),
                request.port(),
                request.path()
        ));
        return ApiResult.success("feed updated", feed);
    }

    @DeleteMapping("/{id}/feeds/{feedId}")
    public ApiResult<Void> deleteFeed(@PathVariable UUID id, @PathVariable UUID feedId) {
        cameraRegistry.removeFeed(id, feedId);
        return ApiResult.successMessage("feed removed");
    }

    @PostMapping("/{id}/heartbeat")
    public ApiResult<Void> heartbeat(@PathVariable UUID id) {
        cameraRegistry.heartbeat(id);
        return ApiResult.successMessage("heartbeat updated");
    }

    @GetMapping("/{id}/status")
    public ApiResult<CameraStatus> status(@PathVariable UUID id) {
        return ApiResult.success(cameraRegistry.status(id));
    }

    private int resolvePageSize(int page, Integer pageSize) {
        AppProperties.Registry registry = appProperties.getRegistry();
        int size = pageSize == null ? registry.getDefaultPageSize() : pageSize;
        if (page < 1) {
            throw RegistryException.validation("page must be at least 1");
        }
        if (size < 1 || size > registry.getMaxPageSize()) {
            throw RegistryException.validation("pageSize must be between 1 and " + registry.getMaxPageSize());
        }
        return size;
    }

    private CameraRegistry.FeedSpec toFeedSpec(FeedRequest request) {
        String protocol = request.protocol().toLowerCase(Locale.ROOT);
        int port = request.port() == null ? defaultPort(protocol) : request.port();
        return new CameraRegistry.FeedSpec(protocol, port, request.path());
    }

    private int defaultPort(String protocol) {
        AppProperties.Feeds feeds = appProperties.getFeeds();
        return "http".equals(protocol) ? feeds.getHttpPort() : feeds.getRtspPort();
    }

    private static InetAddress parseAddress(String literal) {
        return IpAddresses.parse(literal)
                .orElseThrow(() -> RegistryException.validation("ipAddress is not a valid IP address: " + literal));
    }

    private static ImageSettings toImageSettings(ImageSettingsRequest request, ImageSettings fallback) {
        if (request == null) {
            return fallback;
        }
        return new ImageSettings(
                request.brightness() == null ? fallback.brightness() : request.brightness(),
                request.contrast() == null ? fallback.contrast() : request.contrast(),
                request.saturation() == null ? fallback.saturation() : request.saturation()
        );
    }

    public record CameraRequest(
            @NotBlank(message = "must not be blank") String name,
            @NotBlank(message = "must not be blank") String model,
            @NotBlank(message = "must not be blank") String ipAddress,
            @Valid ImageSettingsRequest imageSettings,
            @Valid List<@NotNull FeedRequest> feeds
    ) {
    }

    public record CameraPatchRequest(
            String name,
            String model,
            String ipAddress,
            @Valid ImageSettingsRequest imageSettings
    ) {
    }

    public record ImageSettingsRequest(
            @Min(value = 0, message = "must be at least 0")
            @Max(value = 100, message = "must be at most 100")
            Integer brightness,
            @Min(value = 0, message = "must be at least 0")
            @Max(value = 100, message = "must be at most 100")
            Integer contrast,
            @Min(value = 0, message = "must be at least 0")
            @Max(value = 100, message = "must be at most 100")
            Integer saturation
    ) {
    }

    public record FeedRequest(
            @NotBlank(message = "must not be blank")
            @Pattern(regexp = PROTOCOL_PATTERN, message = "only rtsp or http is supported")
            String protocol,
            @Min(value = 1, message = "must be greater than 0")
            @Max(value = 65535, message = "must not exceed 65535")
            Integer port,
            String path
    ) {
    }

    public record FeedPatchRequest(
            @Pattern(regexp = PROTOCOL_PATTERN, message = "only rtsp or http is supported")
            String protocol,
            @Min(value = 1, message = "must be greater than 0")
            @Max(value = 65535, message = "must not exceed 65535")
            Integer port,
            String path
    ) {
    }
}
