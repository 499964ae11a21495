package com.phillippitts.edgekeeper.service.migration;

import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import com.phillippitts.edgekeeper.exception.PayloadCodecException;
import com.phillippitts.edgekeeper.service.telemetry.PayloadCodec;
import com.phillippitts.edgekeeper.service.telemetry.TelemetryBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One-shot import of a legacy buffer directory (one JSON file per payload) into the
 * {@link TelemetryBuffer}.
 *
 * <p>For each {@code *.json} file, in name order:
 * <ol>
 *   <li>a complete payload document is stored unchanged</li>
 *   <li>any other JSON object becomes the {@code data} of a new payload for this device</li>
 *   <li>the file is deleted once stored</li>
 * </ol>
 * Files that are not JSON objects, cannot be read, or cannot be stored are moved to the
 * quarantine directory. An existing file of the same name there is never overwritten: the
 * moved file gets a {@code _<epochMillis>} suffix (and a counter if that is taken too).
 */
public class LegacyBufferMigrator {

    private static final Logger LOG = LogManager.getLogger(LegacyBufferMigrator.class);

    public static final String QUARANTINE_DIR = ".quarantine";

    private final TelemetryBuffer buffer;
    private final String deviceId;
    private final Path quarantineDir;
    private final Clock clock;

    public LegacyBufferMigrator(TelemetryBuffer buffer, String deviceId, Path quarantineDir) {
        this(buffer, deviceId, quarantineDir, Clock.systemUTC());
    }

    LegacyBufferMigrator(TelemetryBuffer buffer, String deviceId, Path quarantineDir, Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.quarantineDir = Objects.requireNonNull(quarantineDir, "quarantineDir");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Quarantine directory next to the buffer database: {@code <buffer-dir>/.quarantine}.
     */
    public static Path defaultQuarantineDir(Path bufferPath) {
        Path parent = bufferPath.toAbsolutePath().getParent();
        return (parent == null ? Path.of(".") : parent).resolve(QUARANTINE_DIR);
    }

    public MigrationReport migrate(Path legacyDir) {
        if (legacyDir == null || !Files.isDirectory(legacyDir)) {
            LOG.info("No legacy buffer directory at {}; nothing to migrate", legacyDir);
            return new MigrationReport(0, 0);
        }
        List<Path> files = listJsonFiles(legacyDir);
        if (files.isEmpty()) {
            LOG.info("No legacy .json files in {}", legacyDir);
            return new MigrationReport(0, 0);
        }
        LOG.info("Migrating {} legacy payload files from {}", files.size(), legacyDir);

        int migrated = 0;
        int failed = 0;
        for (Path file : files) {
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                if (!buffer.insert(toStoredJson(content))) {
                    throw new IOException("buffer rejected the payload");
                }
                Files.delete(file);
                migrated++;
            } catch (IOException | PayloadCodecException e) {
                LOG.error("Failed to migrate {}: {}", file.getFileName(), e.getMessage());
                failed++;
                quarantine(file);
            }
        }
        MigrationReport report = new MigrationReport(migrated, failed);
        LOG.info("{} files migrated, {} failures", report.migrated(), report.failed());
        return report;
    }

    private String toStoredJson(String content) {
        JSONObject json = PayloadCodec.parseObject(content);
        if (PayloadCodec.looksLikePayload(json)) {
            try {
                PayloadCodec.decode(content);
                return content;
            } catch (PayloadCodecException e) {
                LOG.debug("Legacy payload not decodable as-is ({}); wrapping it", e.getMessage());
            }
        }
        return PayloadCodec.encode(TelemetryPayload.create(deviceId, PayloadCodec.toMap(json)));
    }

    private static List<Path> listJsonFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            LOG.error("Cannot list legacy buffer directory {}: {}", dir, e.getMessage());
            return List.of();
        }
        files.sort(null);
        return files;
    }

    private void quarantine(Path file) {
        try {
            Files.createDirectories(quarantineDir);
            Path target = quarantineTarget(file.getFileName().toString());
            Files.move(file, target);
            LOG.info("Moved {} to quarantine as {}", file.getFileName(), target.getFileName());
        } catch (IOException e) {
            LOG.error("Could not quarantine {}: {}", file.getFileName(), e.getMessage());
        }
    }

    /**
     * First free name for {@code fileName} inside the quarantine directory.
     */
    Path quarantineTarget(String fileName) {
        Path target = quarantineDir.resolve(fileName);
        if (!Files.exists(target)) {
            return target;
        }
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        String suffixed = stem + "_" + clock.millis();
        target = quarantineDir.resolve(suffixed + ext);
        for (int i = 1; Files.exists(target); i++) {
            target = quarantineDir.resolve(suffixed + "_" + i + ext);
        }
        return target;
    }
}
