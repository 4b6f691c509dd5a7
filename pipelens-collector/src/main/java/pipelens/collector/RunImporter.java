/*
 * Copyright The Pipelens Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package pipelens.collector;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pipelens.PipelineMeta;
import pipelens.StepMeta;
import pipelens.ValidationException;
import pipelens.codec.JsonCodec;
import pipelens.storage.StepConsumer;
import pipelens.storage.StorageComponent;

/**
 * Stores runs from documents written with {@link pipelens.Pipeline#outputPipelineMeta()}.
 *
 * <p>Two shapes are read:
 * <ul>
 *   <li>versioned objects, with {@code "logVersion": 1}, which must carry {@code runId}, {@code
 *   time.startTs} and {@code steps}</li>
 *   <li>legacy arrays of steps, the first being the root. These get a random run ID.</li>
 * </ul>
 *
 * <p>Each step is stored with {@link StepConsumer#finishStep}, then the run with {@link
 * StepConsumer#finishRun}, as running when the root has no end time, failed when it has an error
 * and completed otherwise. Importing the same versioned document twice leaves one run.
 */
public final class RunImporter {
  static final Logger LOG = LoggerFactory.getLogger(RunImporter.class);

  public static RunImporter create(StorageComponent storage) {
    return create(storage, () -> UUID.randomUUID().toString());
  }

  // Visible for testing
  static RunImporter create(StorageComponent storage, Supplier<String> runIdGenerator) {
    if (storage == null) throw new NullPointerException("storage == null");
    return new RunImporter(storage, runIdGenerator);
  }

  final StorageComponent storage;
  final Supplier<String> runIdGenerator;

  RunImporter(StorageComponent storage, Supplier<String> runIdGenerator) {
    this.storage = storage;
    this.runIdGenerator = runIdGenerator;
  }

  /**
   * Decodes a document into the run it describes, without storing it.
   *
   * @throws ValidationException if the document is neither shape, naming the missing field
   */
  public PipelineMeta parse(byte[] document) {
    JsonNode input = JsonCodec.readTree(document);
    if (input.isArray()) return parseLegacy(input);
    if (!input.isObject() || !input.has("logVersion")) throw new ValidationException("Invalid input");
    JsonNode logVersion = input.get("logVersion");
    if (!logVersion.isInt() || logVersion.asInt() != PipelineMeta.LOG_VERSION) {
      throw new ValidationException("Invalid input");
    }
    return JsonCodec.decodePipelineMeta(input);
  }

  PipelineMeta parseLegacy(JsonNode steps) {
    JsonNode first = steps.path(0);
    if (!first.path("key").isTextual() || !first.path("time").path("startTs").isNumber()) {
      throw new ValidationException("Invalid input");
    }
    List<StepMeta> decoded = new ArrayList<>(steps.size());
    for (JsonNode step : steps) decoded.add(JsonCodec.decodeStepMeta(step));
    return PipelineMeta.create(runIdGenerator.get(), 0, decoded.get(0), decoded);
  }

  /** Parses and stores one document, returning the stored run. */
  public PipelineMeta importRun(byte[] document) throws IOException {
    PipelineMeta pipelineMeta = parse(document);
    StepConsumer consumer = storage.stepConsumer();
    for (StepMeta step : pipelineMeta.steps()) {
      consumer.finishStep(pipelineMeta.runId(), step).execute();
    }
    consumer.finishRun(pipelineMeta, pipelineMeta.status()).execute();
    LOG.debug("Imported run {} of {} with {} steps", pipelineMeta.runId(), pipelineMeta.name(),
      pipelineMeta.steps().size());
    return pipelineMeta;
  }

  /**
   * Imports each file independently, returning one result per file in iteration order.
   *
   * @throws ValidationException if there are no files
   */
  public List<ImportResult> importFiles(Map<String, byte[]> files) {
    if (files == null) throw new NullPointerException("files == null");
    if (files.isEmpty()) throw new ValidationException("No files uploaded");
    List<ImportResult> results = new ArrayList<>(files.size());
    for (Map.Entry<String, byte[]> file : files.entrySet()) {
      try {
        results.add(ImportResult.imported(file.getKey(), importRun(file.getValue())));
      } catch (ValidationException e) {
        LOG.debug("Rejected file {}: {}", file.getKey(), e.getMessage());
        results.add(ImportResult.failed(file.getKey(), e.getMessage()));
      } catch (IOException | RuntimeException e) {
        LOG.warn("Error importing file {}", file.getKey(), e);
        results.add(ImportResult.failed(file.getKey(),
          e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
      }
    }
    return results;
  }

  @Override public String toString() {
    return "RunImporter{storage=" + storage + "}";
  }
}
