package com.example.ttsbatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Uploads produced segments and the manifest to S3 from a single background thread.
 * <p>
 * A path that is already waiting in the queue is not queued again. The manifest is rewritten
 * after every unit, so only its latest content is uploaded when workers outpace the uploader.
 */
public final class S3ArtifactSyncer implements ArtifactSyncer {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ArtifactSyncer.class);
    private static final Path STOP = Path.of("");

    private final S3Client s3Client;
    private final Path outputDirectory;
    private final String bucket;
    private final String prefix;
    private final BlockingQueue<Path> queue = new LinkedBlockingQueue<>();
    private final Set<Path> queued = ConcurrentHashMap.newKeySet();
    private final AtomicInteger uploaded = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final Thread uploader;
    private volatile boolean closed;

    public S3ArtifactSyncer(Path outputDirectory, String bucket, String prefix, Optional<String> region) {
        this(region.map(Region::of)
                        .map(r -> S3Client.builder().region(r).build())
                        .orElseGet(() -> S3Client.builder().build()),
                outputDirectory, bucket, prefix);
    }

    S3ArtifactSyncer(S3Client s3Client, Path outputDirectory, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.outputDirectory = outputDirectory.toAbsolutePath().normalize();
        this.bucket = bucket;
        this.prefix = prefix == null ? "" : prefix.replaceAll("^/+|/+$", "");
        this.uploader = new Thread(this::drain, "s3-artifact-sync");
        this.uploader.setDaemon(true);
        this.uploader.start();
    }

    @Override
    public void mirror(Path artifact) {
        if (closed) {
            LOGGER.warn("S3 mirror already closed; {} stays local only", artifact);
            return;
        }
        Path normalized = artifact.toAbsolutePath().normalize();
        if (queued.add(normalized)) {
            queue.offer(normalized);
        }
    }

    /**
     * Uploads everything still queued, then releases the client.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.offer(STOP);
        try {
            uploader.join();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while flushing S3 uploads; {} left unsent", queue.size(), ex);
        } finally {
            s3Client.close();
        }
        LOGGER.info("S3 mirror to s3://{}/{}: {} uploaded, {} failed", bucket, prefix, uploaded.get(), failed.get());
    }

    public int uploadedCount() {
        return uploaded.get();
    }

    public int failedCount() {
        return failed.get();
    }

    private void drain() {
        try {
            while (true) {
                Path artifact = queue.take();
                if (artifact == STOP) {
                    return;
                }
                // Removed before reading so a rewrite during the upload is queued again.
                queued.remove(artifact);
                upload(artifact);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("S3 uploader interrupted with {} artifacts pending", queue.size());
        }
    }

    private void upload(Path artifact) {
        String key = keyFor(artifact);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(contentType(artifact))
                    .build();
            s3Client.putObject(request, RequestBody.fromBytes(Files.readAllBytes(artifact)));
            uploaded.incrementAndGet();
            LOGGER.debug("Uploaded {} to s3://{}/{}", artifact, bucket, key);
        } catch (Exception ex) {
            failed.incrementAndGet();
            LOGGER.warn("Failed to upload {} to s3://{}/{}", artifact, bucket, key, ex);
        }
    }

    /**
     * Object key for a local artifact: its path below the output directory, under the prefix.
     * Files outside the output directory (a manifest placed elsewhere) keep only their file name.
     */
    String keyFor(Path artifact) {
        Path absolute = artifact.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(outputDirectory)
                ? outputDirectory.relativize(absolute)
                : absolute.getFileName();
        String key = relative.toString().replace('\\', '/');
        return prefix.isEmpty() ? key : prefix + "/" + key;
    }

    static String contentType(Path artifact) {
        String name = artifact.getFileName().toString();
        if (name.endsWith(".mp3")) {
            return "audio/mpeg";
        }
        if (name.endsWith(".json")) {
            return "application/json";
        }
        return "application/octet-stream";
    }
}
