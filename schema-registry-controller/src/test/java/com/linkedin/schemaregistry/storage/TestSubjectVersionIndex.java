package com.linkedin.schemaregistry.storage;

import com.linkedin.schemaregistry.exceptions.SchemaRegistryStorageException;
import com.linkedin.schemaregistry.exceptions.SubjectNotFoundException;
import com.linkedin.schemaregistry.exceptions.VersionNotFoundException;
import com.linkedin.schemaregistry.meta.SubjectKey;
import com.linkedin.schemaregistry.meta.SubjectVersion;
import com.linkedin.schemaregistry.meta.VersionSpec;
import java.util.Arrays;
import java.util.Collections;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;


public class TestSubjectVersionIndex {
  private final SubjectKey orders = SubjectKey.of("orders", "value");
  private final SubjectKey ordersKey = SubjectKey.of("orders", "key");

  private InMemorySchemaRegistryAccessor accessor;
  private SubjectVersionIndex index;

  @BeforeMethod
  public void setUp() {
    accessor = new InMemorySchemaRegistryAccessor();
    index = new SubjectVersionIndex(accessor);
  }

  @Test
  public void testVersionsStartAtOneAndIncrease() {
    Assert.assertEquals(index.appendVersion(orders, 10).getVersion(), 1);
    Assert.assertEquals(index.appendVersion(orders, 11).getVersion(), 2);
    Assert.assertEquals(index.appendVersion(ordersKey, 11).getVersion(), 1);
    Assert.assertEquals(index.listVersions(orders), Arrays.asList(1, 2));
    Assert.assertEquals(index.getVersion(orders, VersionSpec.LATEST).getSchemaId(), 11);
    Assert.assertEquals(index.getVersion(orders, VersionSpec.of(1)).getSchemaId(), 10);
  }

  @Test
  public void testDuplicateAppendReturnsExistingVersion() {
    index.appendVersion(orders, 10);
    index.appendVersion(orders, 11);
    VersionAppendResult result = index.appendVersion(orders, 10);
    Assert.assertTrue(result.isDuplicate());
    Assert.assertEquals(result.getVersion(), 1);
    Assert.assertEquals(index.listVersions(orders), Arrays.asList(1, 2));
    Assert.assertEquals(accessor.readVersions().size(), 2);
  }

  @Test
  public void testSoftDeleteHidesVersion() {
    index.appendVersion(orders, 10);
    index.appendVersion(orders, 11);
    SubjectVersion deleted = index.softDeleteVersion(orders, 2);
    Assert.assertTrue(deleted.isDeleted());
    Assert.assertEquals(index.listVersions(orders), Collections.singletonList(1));
    Assert.assertEquals(index.getVersion(orders, VersionSpec.LATEST).getVersion(), 1);
    Assert.assertFalse(index.findVersion(orders, VersionSpec.of(2)).isPresent());
    Assert.assertThrows(VersionNotFoundException.class, () -> index.softDeleteVersion(orders, 2));
    Assert.assertThrows(VersionNotFoundException.class, () -> index.softDeleteVersion(orders, 3));
  }

  @Test
  public void testVersionNumbersAreNeverReused() {
    index.appendVersion(orders, 10);
    index.appendVersion(orders, 11);
    Assert.assertEquals(index.deleteSubject(orders), Arrays.asList(1, 2));
    Assert.assertFalse(index.hasLiveVersion(orders));
    Assert.assertEquals(index.appendVersion(orders, 10).getVersion(), 3);
    Assert.assertEquals(index.listVersions(orders), Collections.singletonList(3));
  }

  @Test
  public void testDeletedSchemaCanBeAppendedAgain() {
    index.appendVersion(orders, 10);
    index.softDeleteVersion(orders, 1);
    VersionAppendResult result = index.appendVersion(orders, 10);
    Assert.assertFalse(result.isDuplicate());
    Assert.assertEquals(result.getVersion(), 2);
  }

  @Test
  public void testDeleteSubjectIsIdempotent() {
    Assert.assertTrue(index.deleteSubject(orders).isEmpty());
    index.appendVersion(orders, 10);
    Assert.assertEquals(index.deleteSubject(orders), Collections.singletonList(1));
    Assert.assertTrue(index.deleteSubject(orders).isEmpty());
  }

  @Test
  public void testListSubjectsSkipsEmptySubjects() {
    index.appendVersion(orders, 10);
    index.appendVersion(ordersKey, 11);
    index.deleteSubject(ordersKey);
    Assert.assertEquals(index.listSubjects(), Collections.singleton(orders));
  }

  @Test(expectedExceptions = SubjectNotFoundException.class)
  public void testListVersionsOfUnknownSubject() {
    index.listVersions(orders);
  }

  @Test(expectedExceptions = VersionNotFoundException.class)
  public void testLatestOfUnknownSubject() {
    index.getVersion(orders, VersionSpec.LATEST);
  }

  @Test
  public void testRestoreReplaysDeletes() {
    index.appendVersion(orders, 10);
    index.appendVersion(orders, 11);
    index.softDeleteVersion(orders, 2);

    SubjectVersionIndex restored = new SubjectVersionIndex(accessor);
    Assert.assertEquals(restored.listVersions(orders), Collections.singletonList(1));
    Assert.assertEquals(restored.appendVersion(orders, 12).getVersion(), 3);
  }

  @Test(expectedExceptions = SchemaRegistryStorageException.class)
  public void testValidateSchemaIds() {
    index.appendVersion(orders, 10);
    index.validateSchemaIds(schemaId -> schemaId != 10);
  }

  @Test(expectedExceptions = SchemaRegistryStorageException.class)
  public void testRestoreRejectsMalformedSubject() {
    accessor.appendVersion(new VersionLogRecord("orders", 1, 10, false));
    new SubjectVersionIndex(accessor);
  }
}
