package com.linkedin.schemaregistry.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.utils.ObjectMapperFactory;
import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;


/**
 * Stores the registry as three append-only JSON-lines files under one directory:
 * <ul>
 *   <li>{@value #SCHEMAS_FILE} with one {@link SchemaLogRecord} per line</li>
 *   <li>{@value #VERSIONS_FILE} with one {@link VersionLogRecord} per line</li>
 *   <li>{@value #CONFIGS_FILE} with one {@link ConfigLogRecord} per line</li>
 * </ul>
 * An append returns only once its line, newline included, has been forced to the storage device. A failed append is
 * rolled back to the previous end of file.
 *
 * On read, an unterminated last line is an interrupted append: it is cut off the file. Any other line that is not
 * valid UTF-8 or not a well formed record fails recovery.
 */
public class LocalFileSchemaRegistryAccessor implements SchemaRegistryAccessor {
  private static final Logger LOGGER = LogManager.getLogger(LocalFileSchemaRegistryAccessor.class);

  static final String SCHEMAS_FILE = "schemas.log";
  static final String VERSIONS_FILE = "versions.log";
  static final String CONFIGS_FILE = "config.log";

  private static final byte NEWLINE = '\n';

  private final ObjectMapper mapper = ObjectMapperFactory.getInstance();
  private final LogFile<SchemaLogRecord> schemaLog;
  private final LogFile<VersionLogRecord> versionLog;
  private final LogFile<ConfigLogRecord> configLog;

  public LocalFileSchemaRegistryAccessor(File storageDir) {
    if (!storageDir.exists() && !storageDir.mkdirs()) {
      throw new SchemaRegistryStorageException("Unable to create storage directory " + storageDir.getAbsolutePath());
    }
    if (!storageDir.isDirectory()) {
      throw new SchemaRegistryStorageException(storageDir.getAbsolutePath() + " is not a directory");
    }
    this.schemaLog = new LogFile<>(new File(storageDir, SCHEMAS_FILE), SchemaLogRecord.class);
    this.versionLog = new LogFile<>(new File(storageDir, VERSIONS_FILE), VersionLogRecord.class);
    this.configLog = new LogFile<>(new File(storageDir, CONFIGS_FILE), ConfigLogRecord.class);
    LOGGER.info("Schema registry storage opened at {}", storageDir.getAbsolutePath());
  }

  @Override
  public void appendSchema(SchemaLogRecord record) {
    schemaLog.append(record);
  }

  @Override
  public void appendVersion(VersionLogRecord record) {
    versionLog.append(record);
  }

  @Override
  public void appendConfig(ConfigLogRecord record) {
    configLog.append(record);
  }

  @Override
  public List<SchemaLogRecord> readSchemas() {
    return schemaLog.readAll();
  }

  @Override
  public List<VersionLogRecord> readVersions() {
    return versionLog.readAll();
  }

  @Override
  public List<ConfigLogRecord> readConfigs() {
    return configLog.readAll();
  }

  @Override
  public void close() {
    SchemaRegistryStorageException failure = null;
    for (LogFile<?> logFile: new LogFile<?>[] { schemaLog, versionLog, configLog }) {
      try {
        logFile.close();
      } catch (SchemaRegistryStorageException e) {
        LOGGER.error("Failed to close {}", logFile.file, e);
        failure = e;
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  /**
   * Opens the channel appends to {@code path} go through.
   */
  FileChannel openAppendChannel(Path path) throws IOException {
    return FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
  }

  private static String decodeStrict(byte[] content, int offset, int length) throws CharacterCodingException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return decoder.decode(ByteBuffer.wrap(content, offset, length)).toString();
  }

  private class LogFile<T> {
    private final File file;
    private final Class<T> recordClass;
    private FileChannel channel;

    LogFile(File file, Class<T> recordClass) {
      this.file = file;
      this.recordClass = recordClass;
    }

    synchronized void append(T record) {
      byte[] line;
      try {
        line = (mapper.writeValueAsString(record) + (char) NEWLINE).getBytes(StandardCharsets.UTF_8);
      } catch (JsonProcessingException e) {
        throw new SchemaRegistryStorageException("Unable to serialize " + record, e);
      }
      long endOfFile = -1;
      try {
        if (channel == null) {
          channel = openAppendChannel(file.toPath());
        }
        endOfFile = channel.size();
        ByteBuffer buffer = ByteBuffer.wrap(line);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(false);
      } catch (IOException e) {
        rollBack(endOfFile, e);
        throw new SchemaRegistryStorageException("Unable to append to " + file.getAbsolutePath(), e);
      }
    }

    /**
     * Cuts whatever the failed append left behind. If that fails too, the channel is dropped and the next read
     * treats the leftover as an interrupted append.
     */
    private void rollBack(long endOfFile, IOException cause) {
      if (channel == null || endOfFile < 0) {
        return;
      }
      try {
        channel.truncate(endOfFile);
        channel.force(false);
        LOGGER.warn("Rolled {} back to {} bytes after a failed append", file.getAbsolutePath(), endOfFile);
      } catch (IOException e) {
        cause.addSuppressed(e);
        LOGGER.error("Unable to roll back {} to {} bytes", file.getAbsolutePath(), endOfFile, e);
        try {
          channel.close();
        } catch (IOException closeFailure) {
          cause.addSuppressed(closeFailure);
        }
        channel = null;
      }
    }

    synchronized List<T> readAll() {
      List<T> records = new ArrayList<>();
      if (!file.exists()) {
        return records;
      }
      byte[] content;
      try {
        content = Files.readAllBytes(file.toPath());
      } catch (IOException e) {
        throw new SchemaRegistryStorageException("Unable to read " + file.getAbsolutePath(), e);
      }

      int lineStart = 0;
      int lineNumber = 0;
      while (lineStart < content.length) {
        lineNumber++;
        int lineEnd = lineStart;
        while (lineEnd < content.length && content[lineEnd] != NEWLINE) {
          lineEnd++;
        }
        if (lineEnd == content.length) {
          LOGGER.warn(
              "Dropping unterminated last line {} of {}, {} bytes",
              lineNumber,
              file.getAbsolutePath(),
              lineEnd - lineStart);
          truncate(lineStart);
          break;
        }
        try {
          String line = decodeStrict(content, lineStart, lineEnd - lineStart);
          if (!line.trim().isEmpty()) {
            records.add(mapper.readValue(line, recordClass));
          }
        } catch (IOException e) {
          throw new SchemaRegistryStorageException(
              "Corrupted record at line " + lineNumber + " of " + file.getAbsolutePath(),
              e);
        }
        lineStart = lineEnd + 1;
      }
      return records;
    }

    private void truncate(long length) {
      try (FileChannel repairChannel = FileChannel.open(file.toPath(), StandardOpenOption.WRITE)) {
        repairChannel.truncate(length);
        repairChannel.force(false);
      } catch (IOException e) {
        throw new SchemaRegistryStorageException("Unable to repair " + file.getAbsolutePath(), e);
      }
    }

    synchronized void close() {
      if (channel == null) {
        return;
      }
      try {
        channel.close();
      } catch (IOException e) {
        throw new SchemaRegistryStorageException("Unable to close " + file.getAbsolutePath(), e);
      } finally {
        channel = null;
      }
    }
  }
}
