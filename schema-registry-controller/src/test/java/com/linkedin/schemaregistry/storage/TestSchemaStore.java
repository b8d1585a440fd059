package com.linkedin.schemaregistry.storage;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

import com.linkedin.schemaregistry.exceptions.SchemaIdNotFoundException;
import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.schema.AvroSchemaCanonicalizer;
import com.linkedin.schemaregistry.schema.CanonicalSchema;
import com.linkedin.schemaregistry.schema.SchemaEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;


public class TestSchemaStore {
  private static final String INT_SCHEMA = "\"int\"";
  private static final String STRING_SCHEMA = "\"string\"";

  private final AvroSchemaCanonicalizer canonicalizer = AvroSchemaCanonicalizer.getInstance();
  private InMemorySchemaRegistryAccessor accessor;
  private SchemaStore schemaStore;

  @BeforeMethod
  public void setUp() {
    accessor = new InMemorySchemaRegistryAccessor();
    schemaStore = new SchemaStore(accessor, canonicalizer);
  }

  @Test
  public void testIdsAreDenseAndDeduplicated() {
    SchemaEntry first = schemaStore.put(canonicalizer.canonicalize(INT_SCHEMA));
    SchemaEntry second = schemaStore.put(canonicalizer.canonicalize(STRING_SCHEMA));
    SchemaEntry again = schemaStore.put(canonicalizer.canonicalize("{\"type\": \"int\"}"));

    Assert.assertEquals(first.getId(), SchemaStore.FIRST_SCHEMA_ID);
    Assert.assertEquals(second.getId(), 2);
    Assert.assertEquals(again.getId(), first.getId());
    Assert.assertEquals(schemaStore.size(), 2);
    Assert.assertEquals(accessor.readSchemas().size(), 2);
  }

  @Test
  public void testLookups() {
    SchemaEntry entry = schemaStore.put(canonicalizer.canonicalize(INT_SCHEMA));
    Assert.assertEquals(schemaStore.getById(entry.getId()), entry);
    Assert.assertEquals(schemaStore.getByFingerprint(entry.getFingerprint()).get().getId(), entry.getId());
    Assert.assertFalse(schemaStore.getByFingerprint("unknown").isPresent());
    Assert.assertTrue(schemaStore.containsId(entry.getId()));
    Assert.assertFalse(schemaStore.containsId(entry.getId() + 1));
  }

  @Test(expectedExceptions = SchemaIdNotFoundException.class)
  public void testUnknownId() {
    schemaStore.getById(42);
  }

  @Test
  public void testRestoreResumesCounter() {
    schemaStore.put(canonicalizer.canonicalize(INT_SCHEMA));
    schemaStore.put(canonicalizer.canonicalize(STRING_SCHEMA));

    SchemaStore restored = new SchemaStore(accessor, canonicalizer);
    Assert.assertEquals(restored.size(), 2);
    Assert.assertEquals(restored.getById(2).getCanonicalSchemaStr(), STRING_SCHEMA);
    Assert.assertEquals(restored.put(canonicalizer.canonicalize("\"long\"")).getId(), 3);
  }

  @Test
  public void testFailedAppendDoesNotConsumeId() {
    SchemaRegistryAccessor failingAccessor = spy(new InMemorySchemaRegistryAccessor());
    SchemaStore store = new SchemaStore(failingAccessor, canonicalizer);
    doThrow(new SchemaRegistryStorageException("disk full")).when(failingAccessor).appendSchema(any());
    CanonicalSchema canonicalSchema = canonicalizer.canonicalize(INT_SCHEMA);
    Assert.assertThrows(SchemaRegistryStorageException.class, () -> store.put(canonicalSchema));
    Assert.assertEquals(store.size(), 0);
    Assert.assertFalse(store.getByFingerprint(canonicalSchema.getFingerprint()).isPresent());
    Assert.assertFalse(store.containsId(SchemaStore.FIRST_SCHEMA_ID));
  }

  @Test(expectedExceptions = SchemaRegistryStorageException.class)
  public void testRestoreRejectsFingerprintMismatch() {
    accessor.appendSchema(new SchemaLogRecord(1, "0000", INT_SCHEMA));
    new SchemaStore(accessor, canonicalizer);
  }

  @Test(expectedExceptions = SchemaRegistryStorageException.class)
  public void testRestoreRejectsIdGap() {
    CanonicalSchema canonicalSchema = canonicalizer.canonicalize(INT_SCHEMA);
    accessor.appendSchema(new SchemaLogRecord(2, canonicalSchema.getFingerprint(), INT_SCHEMA));
    new SchemaStore(accessor, canonicalizer);
  }

  @Test(timeOut = 30000)
  public void testConcurrentPutsOfOneSchemaShareAnId() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Callable<Integer>> tasks = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        tasks.add(() -> schemaStore.put(canonicalizer.canonicalize(INT_SCHEMA)).getId());
      }
      List<Integer> ids = new ArrayList<>();
      for (Future<Integer> future: executor.invokeAll(tasks)) {
        ids.add(future.get());
      }
      Assert.assertEquals(Collections.frequency(ids, 1), threads);
      Assert.assertEquals(schemaStore.size(), 1);
    } finally {
      executor.shutdownNow();
      executor.awaitTermination(10, TimeUnit.SECONDS);
    }
  }
}
