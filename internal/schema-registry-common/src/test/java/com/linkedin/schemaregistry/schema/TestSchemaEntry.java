package com.linkedin.schemaregistry.schema;

import org.testng.Assert;
import org.testng.annotations.Test;


public class TestSchemaEntry {
  private static final String SCHEMA_STR =
      "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"name\",\"type\":\"string\",\"doc\":\"name field\"},{\"name\":\"company\",\"type\":\"string\"}]}";

  @Test
  public void testToString() {
    SchemaEntry schemaEntry = SchemaTestUtils.schemaEntry(10, SCHEMA_STR);
    Assert.assertEquals(schemaEntry.toString(), "10\t" + SCHEMA_STR + "\t" + schemaEntry.getFingerprint());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testNullSchema() {
    new SchemaEntry(10, null);
  }

  @Test
  public void testEqualityIgnoresId() {
    SchemaEntry entry1 = SchemaTestUtils.schemaEntry(1, SCHEMA_STR);
    SchemaEntry entry2 = SchemaTestUtils.schemaEntry(2, SCHEMA_STR);
    Assert.assertEquals(entry1, entry2);
    Assert.assertEquals(entry1.hashCode(), entry2.hashCode());
  }

  @Test
  public void testEqualityWithDifferentSpaces() {
    String spaced =
        "{\"type\":\"record\",    \"name\":\"KeyRecord\",\"fields\":[{\"name\":\"name\",\"type\":\"string\",\"doc\":\"name field\"},{\"name\":\"company\",     \"type\":\"string\"}]}";
    SchemaEntry entry1 = SchemaTestUtils.schemaEntry(1, SCHEMA_STR);
    SchemaEntry entry2 = SchemaTestUtils.schemaEntry(1, spaced);
    Assert.assertEquals(entry1, entry2);
    Assert.assertEquals(entry2.getSchemaStr(), spaced);
    Assert.assertEquals(entry2.getCanonicalSchemaStr(), SCHEMA_STR);
  }

  @Test
  public void testDifferentFieldTypeIsNotEqual() {
    String other =
        "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"name\",\"type\":\"string\",\"doc\":\"name field\"},{\"name\":\"company\",\"type\":\"long\"}]}";
    Assert.assertNotEquals(SchemaTestUtils.schemaEntry(1, SCHEMA_STR), SchemaTestUtils.schemaEntry(1, other));
  }
}
