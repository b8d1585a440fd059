package com.linkedin.schemaregistry.utils;

import com.linkedin.schemaregistry.exceptions.ConfigurationException;
import com.linkedin.schemaregistry.exceptions.UndefinedPropertyException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;
import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.Test;


public class TestRegistryProperties {
  @Test
  public void testTypedGetters() {
    RegistryProperties props = new PropertyBuilder().put("a.string", "value")
        .put("a.long", 10000L)
        .put("an.int", " 42 ")
        .put("a.boolean", "true")
        .build();
    Assert.assertEquals(props.getString("a.string"), "value");
    Assert.assertEquals(props.getLong("a.long"), 10000L);
    Assert.assertEquals(props.getInt("an.int"), 42);
    Assert.assertTrue(props.getBoolean("a.boolean", false));
    Assert.assertEquals(props.getString("missing", "fallback"), "fallback");
    Assert.assertEquals(props.getLong("missing", 7L), 7L);
    Assert.assertFalse(props.containsKey("missing"));
  }

  @Test(expectedExceptions = UndefinedPropertyException.class)
  public void testMissingRequiredProperty() {
    RegistryProperties.empty().getString("missing");
  }

  @Test(expectedExceptions = ConfigurationException.class)
  public void testNonNumericValue() {
    new PropertyBuilder().put("a.long", "ten").build().getLong("a.long", 1L);
  }

  @Test
  public void testPutIfAbsentKeepsExistingValue() {
    RegistryProperties props = new PropertyBuilder().put("key", "first").putIfAbsent("key", "second").build();
    Assert.assertEquals(props.getString("key"), "first");
  }

  @Test
  public void testPropertiesAreCopied() {
    Properties properties = new Properties();
    properties.setProperty("key", "value");
    RegistryProperties props = new PropertyBuilder().put(properties).build();
    properties.setProperty("key", "changed");
    Assert.assertEquals(props.getString("key"), "value");
    Assert.assertEquals(props, new PropertyBuilder().put("key", "value").build());
  }

  @Test
  public void testLoadFromFile() throws IOException {
    File file = File.createTempFile("registry", ".properties");
    try {
      FileUtils.writeStringToFile(file, "schema.registry.storage.type=local_file\n", StandardCharsets.UTF_8);
      RegistryProperties props = new PropertyBuilder().put(file).build();
      Assert.assertEquals(props.getString("schema.registry.storage.type"), "local_file");
    } finally {
      FileUtils.deleteQuietly(file);
    }
  }
}
