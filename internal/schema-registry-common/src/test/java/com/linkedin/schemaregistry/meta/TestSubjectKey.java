package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


public class TestSubjectKey {
  @Test
  public void testRendering() {
    Assert.assertEquals(SubjectKey.of("orders", "value").toString(), "orders-value");
    Assert.assertEquals(SubjectKey.of("orders", "KEY").toString(), "orders-key");
  }

  @Test
  public void testParseKeepsDelimiterInName() {
    SubjectKey subjectKey = SubjectKey.parse("user-events-value");
    Assert.assertEquals(subjectKey.getName(), "user-events");
    Assert.assertEquals(subjectKey.getType(), SubjectType.VALUE);
    Assert.assertEquals(SubjectKey.parse(subjectKey.toString()), subjectKey);
  }

  @Test
  public void testKeyAndValueAreDistinctScopes() {
    Assert.assertNotEquals(SubjectKey.of("orders", "key"), SubjectKey.of("orders", "value"));
    Assert.assertTrue(SubjectKey.of("orders", "key").compareTo(SubjectKey.of("orders", "value")) < 0);
  }

  @DataProvider(name = "invalidKeys")
  public Object[][] invalidKeys() {
    return new Object[][] { { null, "value" }, { "", "value" }, { "  ", "key" }, { "orders", "" },
        { "orders", "both" }, { "orders", null }, { "line\nbreak", "value" } };
  }

  @Test(dataProvider = "invalidKeys", expectedExceptions = InvalidArgumentException.class)
  public void testInvalidKeys(String name, String type) {
    SubjectKey.of(name, type);
  }

  @Test(expectedExceptions = InvalidArgumentException.class)
  public void testParseWithoutType() {
    SubjectKey.parse("orders");
  }

  @Test
  public void testInvalidTypeNamesArgument() {
    try {
      SubjectKey.of("orders", "both");
      Assert.fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      Assert.assertEquals(e.getArgumentName(), "type");
    }
  }
}
