package com.codeheadsystems.tenancy.server.store;

import com.codeheadsystems.tenancy.model.RegistryDocument;
import com.codeheadsystems.tenancy.registry.RegistryPersistenceException;
import com.codeheadsystems.tenancy.registry.RegistrySnapshot;
import com.codeheadsystems.tenancy.registry.RegistryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RegistryStore} backed by a single JSON file.
 * <p>
 * Each save writes the whole registry to {@code <file>.tmp} and renames it over the target, so a
 * reader never observes a half-written file. A missing file loads as an empty registry.
 */
public class FileRegistryStore implements RegistryStore {

  private static final Logger log = LoggerFactory.getLogger(FileRegistryStore.class);

  private final Path path;
  private final Path tempPath;
  private final ObjectMapper mapper;

  public FileRegistryStore(Path path) {
    this(path, new ObjectMapper());
  }

  /**
   * Instantiates a new file registry store.
   *
   * @param path   registry file
   * @param mapper JSON mapper; a copy with indentation enabled is used for writing
   */
  public FileRegistryStore(Path path, ObjectMapper mapper) {
    this.path = Objects.requireNonNull(path, "path");
    this.tempPath = path.resolveSibling(path.getFileName() + ".tmp");
    this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
  }

  @Override
  public RegistrySnapshot load() {
    if (!Files.exists(path)) {
      log.info("Registry file {} does not exist, starting empty", path);
      return RegistrySnapshot.empty();
    }
    try {
      RegistryDocument document = mapper.readValue(path.toFile(), RegistryDocument.class);
      RegistrySnapshot snapshot = RegistryDocuments.toSnapshot(document);
      log.info("Loaded {} claim(s) from {}", snapshot.claims().size(), path);
      return snapshot;
    } catch (IOException | IllegalArgumentException e) {
      throw new RegistryPersistenceException("Unable to read registry file " + path, e);
    }
  }

  @Override
  public void save(RegistrySnapshot snapshot) {
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      mapper.writeValue(tempPath.toFile(), RegistryDocuments.toDocument(snapshot));
      try {
        Files.move(tempPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, falling back to replace", path);
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
      }
      log.debug("Wrote {} claim(s) to {}", snapshot.claims().size(), path);
    } catch (IOException e) {
      throw new RegistryPersistenceException("Unable to write registry file " + path, e);
    }
  }

  @Override
  public String toString() {
    return "FileRegistryStore(" + path + ")";
  }
}
