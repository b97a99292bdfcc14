package com.profilescheduler.orchestrator.service;

import com.profilescheduler.orchestrator.mdm.DeviceManagementClient;
import com.profilescheduler.orchestrator.mdm.dto.Device;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Pushes a profile to devices, one remote call per device.
 *
 * The pushes of one schedule run concurrently on a fixed pool shared by all
 * schedules, which caps the number of calls in flight against the remote
 * API. Each push is captured independently; a failed device never fails
 * its siblings or the caller.
 */
@Service
public class ProfilePusher {

    private static final Logger log = LoggerFactory.getLogger(ProfilePusher.class);

    private final DeviceManagementClient mdm;
    private final MeterRegistry          meterRegistry;
    private final ExecutorService        pushWorkers;

    public ProfilePusher(DeviceManagementClient mdm,
                         MeterRegistry meterRegistry,
                         @Value("${profilescheduler.execution.push-workers:16}") int pushWorkerCount) {
        this.mdm           = mdm;
        this.meterRegistry = meterRegistry;
        this.pushWorkers   = Executors.newFixedThreadPool(pushWorkerCount,
                new CustomizableThreadFactory("profile-push-"));
    }

    /** One push; never throws. */
    public DeviceOutcome push(String profileId, String deviceId) {
        try {
            mdm.pushProfile(profileId, deviceId);
            meterRegistry.counter("profilescheduler.device.pushes", "status", "ok").increment();
            return DeviceOutcome.ok(deviceId);
        } catch (Exception e) {
            meterRegistry.counter("profilescheduler.device.pushes", "status", "error").increment();
            log.warn("Push of profile {} to device {} failed: {}", profileId, deviceId, e.getMessage());
            return DeviceOutcome.failed(deviceId, e.getMessage());
        }
    }

    /**
     * Push to every device concurrently and wait for all of them.
     * Outcomes come back in the order of the devices list.
     */
    public List<DeviceOutcome> pushAll(String profileId, List<Device> devices) {
        List<CompletableFuture<DeviceOutcome>> pending = devices.stream()
                .map(d -> CompletableFuture.supplyAsync(() -> push(profileId, d.id()), pushWorkers))
                .toList();
        return pending.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    @PreDestroy
    void shutdown() throws InterruptedException {
        pushWorkers.shutdown();
        if (!pushWorkers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Profile pushes still running after 30 s, forcing shutdown");
            pushWorkers.shutdownNow();
        }
    }
}
