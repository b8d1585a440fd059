package com.linkedin.schemaregistry.meta;

import com.linkedin.schemaregistry.exceptions.InvalidArgumentException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;


public class TestVersionSpec {
  @Test
  public void testLatest() {
    Assert.assertTrue(VersionSpec.parse(null).isLatest());
    Assert.assertTrue(VersionSpec.parse("latest").isLatest());
    Assert.assertTrue(VersionSpec.parse("LATEST").isLatest());
    Assert.assertEquals(VersionSpec.LATEST.toString(), "latest");
  }

  @Test
  public void testExplicitVersion() {
    VersionSpec versionSpec = VersionSpec.parse("12");
    Assert.assertFalse(versionSpec.isLatest());
    Assert.assertEquals(versionSpec.getVersion(), 12);
    Assert.assertEquals(versionSpec, VersionSpec.of(12));
  }

  @DataProvider(name = "invalidVersions")
  public Object[][] invalidVersions() {
    return new Object[][] { { "0" }, { "-1" }, { "1.5" }, { "one" }, { "" }, { "99999999999" } };
  }

  @Test(dataProvider = "invalidVersions", expectedExceptions = InvalidArgumentException.class)
  public void testInvalidVersions(String version) {
    VersionSpec.parse(version);
  }

  @Test(expectedExceptions = IllegalStateException.class)
  public void testLatestHasNoNumber() {
    VersionSpec.LATEST.getVersion();
  }
}
