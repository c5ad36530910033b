package fit.ageing.entities;

import static fit.ageing.test.TestUtils.channel;
import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class DatasetTest {

  private static Module module(String identifier, boolean reference) {
    return new Module(identifier, identifier + ".txt", reference, Collections.singletonList(1));
  }

  @Test
  public void referenceModuleIsFoundByIdentifier() {
    Dataset dataset = new Dataset("2023-01-01",
        Arrays.asList(module("PMA1", false), module("PMA0", true)), "PMA0");
    assertEquals("PMA0", dataset.getReferenceModule().getIdentifier());
    assertEquals("PMA1", dataset.getModule("PMA1").getIdentifier());
    assertNull(dataset.getModule("PMC0"));
  }

  @Test
  public void missingReferenceModuleIsRejected() {
    try {
      new Dataset("2023-01-01", Collections.singletonList(module("PMA1", false)), "PMA0");
      fail("Reference module must be present");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("Reference module PMA0 not in files"));
    }
  }

  @Test
  public void duplicateReferenceModuleIsRejected() {
    try {
      new Dataset("2023-01-01", Arrays.asList(module("PMA0", true), module("PMA0", true)),
          "PMA0");
      fail("Reference module must be unique");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("appears 2 times"));
    }
  }

  @Test
  public void referenceModuleSurvivesModuleReplacement() {
    Dataset dataset = new Dataset("2023-01-01", Collections.singletonList(module("PMA0", true)),
        "PMA0").withReferenceMeans(5., 6.);
    Module filled = dataset.getReferenceModule()
        .withChannels(Arrays.asList(channel(1, 1.), channel(2, 2.)));
    Dataset replaced = dataset.withModules(Collections.singletonList(filled));
    assertEquals(2, replaced.getReferenceModule().getChannels().size());
    assertEquals(2, replaced.getChannelCount());
    assertEquals(5., replaced.getReferenceGaussianMean(), 0.);
    assertEquals(6., replaced.getReferenceWeightedMean(), 0.);
  }

  @Test
  public void sortsByDate() {
    List<Dataset> datasets = new ArrayList<>();
    for (String date : new String[]{"2023-05-01", "2021-12-31", "2022-01-15"}) {
      datasets.add(new Dataset(date, Collections.singletonList(module("PMA0", true)), "PMA0"));
    }
    Collections.sort(datasets, Dataset.BY_DATE);
    assertEquals("2021-12-31", datasets.get(0).getDate());
    assertEquals("2022-01-15", datasets.get(1).getDate());
    assertEquals("2023-05-01", datasets.get(2).getDate());
  }

}
