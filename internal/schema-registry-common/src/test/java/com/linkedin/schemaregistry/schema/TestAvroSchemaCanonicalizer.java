package com.linkedin.schemaregistry.schema;

import com.linkedin.schemaregistry.exceptions.InvalidSchemaException;
import org.apache.avro.Schema;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


public class TestAvroSchemaCanonicalizer {
  private final SchemaCanonicalizer canonicalizer = AvroSchemaCanonicalizer.getInstance();

  @Test
  public void testWhitespaceDoesNotChangeFingerprint() {
    String compact = "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"name\",\"type\":\"string\"}]}";
    String spaced = "{\n  \"type\" : \"record\",\n  \"name\" : \"KeyRecord\",\n"
        + "  \"fields\" : [ { \"name\" : \"name\", \"type\" : \"string\" } ]\n}";
    CanonicalSchema first = canonicalizer.canonicalize(compact);
    CanonicalSchema second = canonicalizer.canonicalize(spaced);
    Assert.assertEquals(first.getFingerprint(), second.getFingerprint());
    Assert.assertEquals(first.getCanonicalSchemaStr(), second.getCanonicalSchemaStr());
    Assert.assertEquals(second.getRawSchemaStr(), spaced);
  }

  @Test
  public void testAttributeOrderDoesNotChangeFingerprint() {
    String first = "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"id\",\"type\":\"long\"}]}";
    String second = "{\"fields\":[{\"type\":\"long\",\"name\":\"id\"}],\"name\":\"KeyRecord\",\"type\":\"record\"}";
    Assert.assertEquals(
        canonicalizer.canonicalize(first).getFingerprint(),
        canonicalizer.canonicalize(second).getFingerprint());
  }

  @Test
  public void testDefaultValueChangesFingerprint() {
    String withoutDefault =
        "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"id\",\"type\":\"long\"}]}";
    String withDefault =
        "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"id\",\"type\":\"long\",\"default\":0}]}";
    CanonicalSchema first = canonicalizer.canonicalize(withoutDefault);
    CanonicalSchema second = canonicalizer.canonicalize(withDefault);
    Assert.assertNotEquals(first.getFingerprint(), second.getFingerprint());
  }

  @Test
  public void testCanonicalBodyIsCompactAvroRendering() {
    String schemaStr = SchemaTestUtils.loadSchemaFileAsString("UserV2.avsc");
    CanonicalSchema canonicalSchema = canonicalizer.canonicalize(schemaStr);
    Assert.assertEquals(canonicalSchema.getCanonicalSchemaStr(), new Schema.Parser().parse(schemaStr).toString());
    Assert.assertEquals(canonicalSchema.getFingerprint().length(), 64);
    Assert.assertEquals(canonicalSchema.getSchema().getFullName(), "com.linkedin.schemaregistry.test.User");
  }

  @Test
  public void testPrimitiveSchema() {
    CanonicalSchema canonicalSchema = canonicalizer.canonicalize("\"string\"");
    Assert.assertEquals(canonicalSchema.getSchema().getType(), Schema.Type.STRING);
    Assert.assertEquals(
        canonicalSchema.getFingerprint(),
        canonicalizer.canonicalize("{\"type\": \"string\"}").getFingerprint());
  }

  @DataProvider(name = "invalidSchemas")
  public Object[][] invalidSchemas() {
    return new Object[][] { { null }, { "" }, { "   " }, { "not json" },
        { "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"company\"}]}" },
        { "{\"type\":\"record\",\"name\":\"KeyRecord\",\"fields\":[{\"name\":\"id\",\"type\":\"int\",\"default\":\"x\"}]}" },
        { "{\"type\":\"record\",\"name\":\"Empty\",\"fields\":[]}" },
        { "{\"type\":\"record\",\"name\":\"Outer\",\"fields\":[{\"name\":\"inner\",\"type\":"
            + "{\"type\":\"record\",\"name\":\"Inner\",\"fields\":[]}}]}" },
        { "{\"type\":\"enum\",\"name\":\"Color\",\"symbols\":[]}" }, { "{\"type\":\"unknown_type\"}" } };
  }

  @Test(dataProvider = "invalidSchemas", expectedExceptions = InvalidSchemaException.class)
  public void testInvalidSchemasAreRejected(String schemaStr) {
    canonicalizer.canonicalize(schemaStr);
  }

  @Test
  public void testRecursiveSchemaIsAccepted() {
    String linkedList = "{\"type\":\"record\",\"name\":\"Node\",\"fields\":[{\"name\":\"value\",\"type\":\"int\"},"
        + "{\"name\":\"next\",\"type\":[\"null\",\"Node\"],\"default\":null}]}";
    Assert.assertNotNull(canonicalizer.canonicalize(linkedList).getFingerprint());
  }
}
