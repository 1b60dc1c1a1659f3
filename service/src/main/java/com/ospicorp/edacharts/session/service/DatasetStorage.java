package com.ospicorp.edacharts.session.service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/** Keeps uploaded datasets on disk, one directory per session. */
@Component
public class DatasetStorage {
  private static final Logger log = LoggerFactory.getLogger(DatasetStorage.class);

  private final Path root;

  public DatasetStorage(@Value("${eda.storage.upload-dir:uploads}") String uploadDir) {
    this.root = Paths.get(uploadDir).toAbsolutePath().normalize();
  }

  public String store(UUID sessionId, String filename, byte[] content) {
    Path directory = root.resolve(sessionId.toString());
    Path target = directory.resolve(safeFilename(filename));
    try {
      Files.createDirectories(directory);
      Files.write(target, content);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to store dataset for session " + sessionId, ex);
    }
    log.debug("Stored dataset for session {} at {}", sessionId, target);
    return target.toString();
  }

  public void delete(UUID sessionId) {
    Path directory = root.resolve(sessionId.toString());
    try {
      FileSystemUtils.deleteRecursively(directory);
    } catch (IOException ex) {
      log.warn("Could not delete dataset directory {}: {}", directory, ex.getMessage());
    }
  }

  static String safeFilename(String filename) {
    String name = Paths.get(filename).getFileName().toString();
    return name.replaceAll("[^A-Za-z0-9._-]", "_");
  }
}
