package com.company.adaptive.service;

import com.company.adaptive.domain.ResourceSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.OptionalLong;

/**
 * Reads CPU from the platform MXBean, memory from {@code /proc/meminfo} and disk usage
 * from the filesystem root. Memory counts reclaimable page cache as available
 * ({@code MemAvailable}); where meminfo is missing it falls back to the MXBean's free
 * memory. Metrics the platform does not expose are reported as 0.
 */
@Slf4j
public class HostResourceProbe implements ResourceProbe {

    private static final double MB = 1024.0 * 1024.0;

    private static final Path PROC_MEMINFO = Paths.get("/proc/meminfo");

    private final Clock clock;
    private final File diskRoot;
    private final Path meminfo;

    public HostResourceProbe(Clock clock) {
        this(clock, new File("/"), PROC_MEMINFO);
    }

    public HostResourceProbe(Clock clock, File diskRoot, Path meminfo) {
        this.clock = clock;
        this.diskRoot = diskRoot;
        this.meminfo = meminfo;
    }

    @Override
    public ResourceSnapshot sample() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();

        double cpu = 0.0;
        long totalBytes = 0;
        long availableBytes = 0;
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getCpuLoad();
            cpu = load < 0 ? 0.0 : load * 100.0;
            totalBytes = sunOs.getTotalMemorySize();
            availableBytes = sunOs.getFreeMemorySize();
        } else {
            log.debug("Platform MXBean {} exposes no CPU/memory load", os.getClass().getName());
        }

        List<String> meminfoLines = readMeminfo();
        OptionalLong memTotal = meminfoKb(meminfoLines, "MemTotal");
        OptionalLong memAvailable = meminfoKb(meminfoLines, "MemAvailable");
        if (memTotal.isPresent() && memAvailable.isPresent()) {
            totalBytes = memTotal.getAsLong() * 1024;
            availableBytes = memAvailable.getAsLong() * 1024;
        }

        double memory = 0.0;
        double availableMb = 0.0;
        if (totalBytes > 0) {
            memory = (totalBytes - availableBytes) * 100.0 / totalBytes;
            availableMb = availableBytes / MB;
        }

        double disk = 0.0;
        long totalSpace = diskRoot.getTotalSpace();
        if (totalSpace > 0) {
            disk = (totalSpace - diskRoot.getUsableSpace()) * 100.0 / totalSpace;
        }

        return ResourceSnapshot.builder()
                .cpuPercent(round(cpu))
                .memoryPercent(round(memory))
                .diskPercent(round(disk))
                .memoryAvailableMb(round(availableMb))
                .sampledAt(clock.instant())
                .build();
    }

    private List<String> readMeminfo() {
        if (meminfo == null || !Files.isReadable(meminfo)) {
            return List.of();
        }
        try {
            return Files.readAllLines(meminfo);
        } catch (IOException e) {
            log.debug("Cannot read {}, using MXBean free memory: {}", meminfo, e.getMessage());
            return List.of();
        }
    }

    // "MemAvailable:    5397156 kB"
    static OptionalLong meminfoKb(List<String> lines, String field) {
        String prefix = field + ":";
        for (String line : lines) {
            if (!line.startsWith(prefix)) {
                continue;
            }
            String[] parts = line.substring(prefix.length()).trim().split("\\s+");
            try {
                return OptionalLong.of(Long.parseLong(parts[0]));
            } catch (NumberFormatException e) {
                log.debug("Unparseable meminfo line: {}", line);
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
