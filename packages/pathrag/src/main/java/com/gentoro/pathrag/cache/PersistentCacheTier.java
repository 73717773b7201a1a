package com.gentoro.pathrag.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.pathrag.exception.IoException;
import com.gentoro.pathrag.exception.SerializationException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Slow, durable tier backed by a directory.
 *
 * <p>Layout: {@code index.json} maps each key to its metadata; each payload lives in {@code
 * <sha256(key)>.blob}. The index is rewritten on every mutation through a temporary file and an
 * atomic move, so readers of the directory see either the old or the new index. Access statistics
 * are flushed with the next mutation or on {@link #close()}. A corrupt or inconsistent index is
 * treated as an empty tier and rebuilt on the next successful write.
 *
 * <p>Failing to write a blob rejects the insert. Failing to write the index or to clean up orphan
 * blobs is logged and retried on the next mutation; the in-process view of the tier stays valid.
 */
public class PersistentCacheTier extends AbstractCacheTier {
  private static final org.slf4j.Logger log =
      com.gentoro.pathrag.logging.LoggingService.getLogger(PersistentCacheTier.class);

  public static final String NAME = "persistent";
  static final String INDEX_FILE = "index.json";
  static final String BLOB_SUFFIX = ".blob";

  private static final TypeReference<Map<String, IndexRecord>> INDEX_TYPE =
      new TypeReference<>() {};

  private final Path directory;
  private final Path indexFile;
  private final PayloadCodec codec;
  private final ObjectMapper indexMapper;
  private final Object indexWriteMutex = new Object();
  private volatile boolean rebuildPending;
  private volatile boolean indexDirty;

  /**
   * Metadata persisted per key.
   *
   * @param byteSize encoded payload size
   */
  public record IndexRecord(
      long byteSize,
      Instant createdAt,
      Instant lastAccessed,
      long accessCount,
      double importance,
      Map<String, String> metadata) {}

  public PersistentCacheTier(Path directory, long maxBytes, PayloadCodec codec) {
    this(directory, maxBytes, codec, Clock.systemUTC());
  }

  public PersistentCacheTier(Path directory, long maxBytes, PayloadCodec codec, Clock clock) {
    super(NAME, maxBytes, clock);
    this.directory = directory;
    this.indexFile = directory.resolve(INDEX_FILE);
    this.codec = codec;
    this.indexMapper = codec.mapper();
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new IoException("Cannot create cache directory " + directory, e);
    }
    loadIndex();
  }

  public Path directory() {
    return directory;
  }

  Path blobPath(String key) {
    return directory.resolve(CacheKey.sha256(key) + BLOB_SUFFIX);
  }

  private void loadIndex() {
    if (!Files.exists(indexFile)) {
      log.info("Persistent cache at {} has no index; starting empty", directory);
      rebuildPending = hasBlobs();
      return;
    }
    Map<String, IndexRecord> index;
    try {
      index = indexMapper.readValue(indexFile.toFile(), INDEX_TYPE);
    } catch (IOException e) {
      log.warn("Persistent cache index {} is unreadable; treating tier as empty", indexFile, e);
      rebuildPending = true;
      return;
    }
    if (index == null || !isConsistent(index)) {
      log.warn("Persistent cache index {} is inconsistent; treating tier as empty", indexFile);
      rebuildPending = true;
      return;
    }
    index.forEach(
        (key, r) ->
            restore(
                new CacheEntry(
                    key,
                    null,
                    r.byteSize(),
                    r.importance(),
                    r.createdAt(),
                    r.lastAccessed() == null ? r.createdAt() : r.lastAccessed(),
                    r.accessCount(),
                    r.metadata())));
    log.info(
        "Persistent cache at {} loaded {} entries ({} bytes)",
        directory,
        index.size(),
        usedBytes());
  }

  private boolean isConsistent(Map<String, IndexRecord> index) {
    long total = 0;
    for (Map.Entry<String, IndexRecord> e : index.entrySet()) {
      IndexRecord r = e.getValue();
      if (e.getKey() == null
          || e.getKey().isEmpty()
          || r == null
          || r.byteSize() < 0
          || r.createdAt() == null
          || r.accessCount() < 0
          || !Files.isRegularFile(blobPath(e.getKey()))) {
        return false;
      }
      total += r.byteSize();
    }
    return total <= maxBytes;
  }

  private boolean hasBlobs() {
    try (DirectoryStream<Path> blobs = Files.newDirectoryStream(directory, "*" + BLOB_SUFFIX)) {
      return blobs.iterator().hasNext();
    } catch (IOException e) {
      throw new IoException("Cannot list cache directory " + directory, e);
    }
  }

  @Override
  protected CacheEntry load(CacheEntry resident) {
    if (resident.getPayload() != null) {
      return resident;
    }
    try {
      byte[] bytes = Files.readAllBytes(blobPath(resident.getKey()));
      return resident.withPayload(codec.decode(bytes));
    } catch (NoSuchFileException e) {
      log.warn("Blob for '{}' is missing", resident.getKey());
      return null;
    } catch (IOException | SerializationException e) {
      log.warn("Blob for '{}' is unreadable", resident.getKey(), e);
      return null;
    }
  }

  @Override
  protected CacheEntry store(CacheEntry entry) {
    if (entry.getPayload() == null) {
      throw new IllegalArgumentException("Cannot persist an entry without payload");
    }
    writeAtomically(blobPath(entry.getKey()), codec.encode(entry.getPayload()));
    return entry.withPayload(null);
  }

  @Override
  protected void discard(CacheEntry entry) {
    try {
      Files.deleteIfExists(blobPath(entry.getKey()));
    } catch (IOException e) {
      log.warn(
          "Failed to delete blob for '{}'; it will be removed on the next rebuild",
          entry.getKey(),
          e);
      rebuildPending = true;
    }
  }

  @Override
  protected void afterMutation() {
    if (rebuildPending) {
      deleteOrphanBlobs();
    }
    flushIndex();
  }

  @Override
  protected void afterAccess(CacheEntry entry) {
    indexDirty = true;
  }

  /** Persist pending access statistics. */
  @Override
  public void close() {
    lock.writeLock().lock();
    try {
      if (indexDirty) {
        flushIndex();
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void flushIndex() {
    try {
      writeIndex();
      indexDirty = false;
    } catch (IoException | SerializationException e) {
      indexDirty = true;
      rebuildPending = true;
      log.warn("Failed to persist cache index {}; retrying on the next write", indexFile, e);
    }
  }

  private void deleteOrphanBlobs() {
    Set<String> live = new HashSet<>();
    for (String key : entries.keySet()) {
      live.add(blobPath(key).getFileName().toString());
    }
    int deleted = 0;
    try (DirectoryStream<Path> blobs = Files.newDirectoryStream(directory, "*" + BLOB_SUFFIX)) {
      for (Path blob : blobs) {
        if (!live.contains(blob.getFileName().toString())) {
          Files.deleteIfExists(blob);
          deleted++;
        }
      }
    } catch (IOException e) {
      log.warn("Failed to clean cache directory {}; retrying on the next write", directory, e);
      return;
    }
    rebuildPending = false;
    if (deleted > 0) {
      log.info("Persistent cache rebuilt: removed {} orphan blobs from {}", deleted, directory);
    }
  }

  private void writeIndex() {
    synchronized (indexWriteMutex) {
      Map<String, IndexRecord> snapshot = new TreeMap<>();
      for (CacheEntry e : entries.values()) {
        snapshot.put(
            e.getKey(),
            new IndexRecord(
                e.getByteSize(),
                e.getCreatedAt(),
                e.getLastAccessed(),
                e.getAccessCount(),
                e.getImportance(),
                e.getMetadata()));
      }
      byte[] bytes;
      try {
        bytes = indexMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
      } catch (IOException e) {
        throw new SerializationException("Failed to encode cache index", e);
      }
      writeAtomically(indexFile, bytes);
    }
  }

  private void writeAtomically(Path target, byte[] bytes) {
    Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.write(tmp, bytes);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported in {}; replacing {} directly", directory, target);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new IoException("Failed to write " + target, e);
    }
  }
}
