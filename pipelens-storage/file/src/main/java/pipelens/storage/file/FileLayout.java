/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.storage.file;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import pipelens.StorageException;
import pipelens.ValidationException;
import pipelens.internal.Nullable;

/**
 * Where each document lives under the base path.
 *
 * <pre>{@code
 * pipelines/{pipeline}.json               run summaries of the pipeline
 * runs/{runId}/meta.json                  run summary
 * runs/{runId}/steps.json                 every step, written when the run finishes
 * runs/{runId}/steps/{key}.json           one step, written as it starts and finishes
 * timeseries/{pipeline}/{stepName}.json   finished instances of a step
 * settings/{pipeline}.json                pipeline settings
 * }</pre>
 *
 * <p>Names are URL encoded to form file names. Documents are replaced atomically, so readers never
 * see a partial write.
 */
final class FileLayout {
  static final String JSON = ".json";

  final Path basePath;

  FileLayout(Path basePath) {
    this.basePath = basePath;
  }

  Path pipelinesDir() {
    return basePath.resolve("pipelines");
  }

  Path pipelineRuns(String pipeline) {
    return pipelinesDir().resolve(fileName(pipeline) + JSON);
  }

  Path runDir(String runId) {
    return basePath.resolve("runs").resolve(fileName(runId));
  }

  Path runMeta(String runId) {
    return runDir(runId).resolve("meta.json");
  }

  Path runSteps(String runId) {
    return runDir(runId).resolve("steps.json");
  }

  Path stepsDir(String runId) {
    return runDir(runId).resolve("steps");
  }

  Path step(String runId, String key) {
    return stepsDir(runId).resolve(fileName(key) + JSON);
  }

  Path timeseriesDir(String pipeline) {
    return basePath.resolve("timeseries").resolve(fileName(pipeline));
  }

  Path timeseries(String pipeline, String stepName) {
    return timeseriesDir(pipeline).resolve(fileName(stepName) + JSON);
  }

  Path settings(String pipeline) {
    return basePath.resolve("settings").resolve(fileName(pipeline) + JSON);
  }

  /** Encodes a name so it is a single, non-hidden path segment. */
  static String fileName(String name) {
    String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8);
    return encoded.startsWith(".") ? "%2E" + encoded.substring(1) : encoded;
  }

  /** Inverse of {@link #fileName}, after dropping the json extension. */
  static String nameOf(Path file) {
    String fileName = file.getFileName().toString();
    if (fileName.endsWith(JSON)) fileName = fileName.substring(0, fileName.length() - JSON.length());
    return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
  }

  /** Returns null if the file doesn't exist. */
  @Nullable static byte[] read(Path file) throws IOException {
    try {
      return Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  static void write(Path file, byte[] content) throws IOException {
    Path parent = file.getParent();
    Files.createDirectories(parent);
    Path temp = Files.createTempFile(parent, ".", ".tmp");
    try {
      Files.write(temp, content);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /** Json documents directly under the directory, or empty if it doesn't exist. */
  static List<Path> listJson(Path dir) throws IOException {
    List<Path> result = new ArrayList<>();
    if (!Files.isDirectory(dir)) return result;
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + JSON)) {
      for (Path file : files) result.add(file);
    }
    return result;
  }

  static void deleteRecursively(Path path) throws IOException {
    if (!Files.exists(path)) return;
    Files.walkFileTree(path, new SimpleFileVisitor<Path>() {
      @Override public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
        throws IOException {
        Files.delete(file);
        return FileVisitResult.CONTINUE;
      }

      @Override public FileVisitResult postVisitDirectory(Path dir, IOException e)
        throws IOException {
        if (e != null) throw e;
        Files.delete(dir);
        return FileVisitResult.CONTINUE;
      }
    });
  }

  /** Decodes a document, reporting corruption as a storage failure naming the file. */
  static <T> T decode(Path file, byte[] content, Decoder<T> decoder) throws StorageException {
    try {
      return decoder.decode(content);
    } catch (ValidationException e) {
      throw new StorageException("Corrupt document " + file + ": " + e.getMessage(), e);
    }
  }

  interface Decoder<T> {
    T decode(byte[] content);
  }

  @Override public String toString() {
    return "FileLayout{" + basePath + "}";
  }
}
