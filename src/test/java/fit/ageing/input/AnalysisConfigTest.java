package fit.ageing.input;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AnalysisConfigTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private File root;

  @Before
  public void setUp() throws IOException {
    root = folder.getRoot();
    folder.newFolder("data", "2023-01-01");
    folder.newFolder("data", "2022-06-01");
  }

  private static JsonNode json(String text) throws IOException {
    return MAPPER.readTree(text.replace('\'', '"'));
  }

  private static String dataset(String date, String basePath, String extra) {
    return "{'date': '" + date + "', 'basePath': '" + basePath + "', "
        + "'files': {'PMA0': 'PMA0.txt'}, 'refCH': {'PM': 'PMA0', 'CH': [1, 2]}" + extra + "}";
  }

  private void expectError(String config, String message) throws IOException {
    try {
      AnalysisConfig.fromJson(json(config), root);
      fail("Configuration should have been rejected: " + config);
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString(message));
    }
  }

  @Test
  public void missingInputsIsRejected() throws IOException {
    expectError("{'basePath': 'data'}", "inputs field not found in config file");
  }

  @Test
  public void inputsMustBeAList() throws IOException {
    expectError("{'inputs': {'date': 'x'}}", "inputs field must be a list of datasets");
  }

  @Test
  public void missingDateIsRejected() throws IOException {
    expectError("{'inputs': [{'basePath': 'data/2023-01-01'}]}",
        "date field missing in one of the input datasets");
  }

  @Test
  public void malformedRefChIsRejected() throws IOException {
    expectError("{'inputs': [{'date': '2023-01-01', 'basePath': 'data/2023-01-01', "
        + "'refCH': [1]}]}", "refCH field must be a dictionary");
    expectError("{'inputs': [{'date': '2023-01-01', 'basePath': 'data/2023-01-01', "
        + "'refCH': {'CH': [1]}}]}", "refCH field missing PM key");
    expectError("{'inputs': [{'date': '2023-01-01', 'basePath': 'data/2023-01-01', "
        + "'refCH': {'PM': 'PMA0'}}]}", "refCH field missing CH key");
  }

  @Test
  public void datasetsAreSortedAndParsed() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'basePath': 'data', 'inputs': ["
        + dataset("2023-01-01", "2023-01-01", "") + ", "
        + dataset("2022-06-01", "2022-06-01", ", 'validateHeader': true") + "]}"), root);
    List<DatasetConfig> datasets = config.getDatasets();
    assertEquals(2, datasets.size());
    assertEquals("2022-06-01", datasets.get(0).getDate());
    assertEquals("2023-01-01", datasets.get(1).getDate());
    assertTrue(datasets.get(0).validateHeader());
    assertFalse(datasets.get(1).validateHeader());
    assertEquals(Arrays.asList(1, 2), datasets.get(1).getReferenceChannels());
    assertEquals("PMA0", datasets.get(1).getReferencePm());
    assertEquals("PMA0.txt", datasets.get(1).getFiles().get("PMA0"));
    assertEquals(new File(root, "data/2023-01-01").getAbsoluteFile().toPath().normalize(),
        datasets.get(1).getBasePath().toPath());
  }

  @Test
  public void missingBasePathSkipsDataset() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'basePath': 'data', 'inputs': ["
        + dataset("2023-01-01", "2023-01-01", "") + ", "
        + dataset("2021-01-01", "does-not-exist", "") + "]}"), root);
    assertEquals(1, config.getDatasets().size());
    assertEquals("2023-01-01", config.getDatasets().get(0).getDate());
  }

  @Test
  public void referenceChannelsMayBeSingleValues() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'inputs': [{'date': '2023-01-01', "
        + "'basePath': 'data/2023-01-01', 'files': {}, "
        + "'refCH': {'PM': 'PMA0', 'CH': '3'}}]}"), root);
    assertEquals(Collections.singletonList(3),
        config.getDatasets().get(0).getReferenceChannels());
  }

  @Test
  public void basePathResolution() {
    File global = new File(root, "data").getAbsoluteFile();
    File absolute = new File(root, "elsewhere").getAbsoluteFile();

    assertEquals(absolute.toPath().normalize().toFile(),
        AnalysisConfig.resolveBasePath(root, global, absolute.getPath()));
    assertEquals(new File(global, "2023-01-01").toPath().normalize().toFile(),
        AnalysisConfig.resolveBasePath(root, global, "2023-01-01"));
    assertEquals(global, AnalysisConfig.resolveBasePath(root, global, ""));
    assertEquals(new File(root, "sub").getAbsoluteFile().toPath().normalize().toFile(),
        AnalysisConfig.resolveBasePath(root, null, "sub"));
    assertEquals(root.getAbsoluteFile().toPath().normalize().toFile(),
        AnalysisConfig.resolveBasePath(root, null, ""));
  }

  @Test
  public void integratedChargeIsNormalized() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'basePath': 'data', 'inputs': ["
        + dataset("2023-01-01", "2023-01-01",
        ", 'integratedCharge': {'pma0': {'Ch1': 1.5, 'ch02': 2}}") + "]}"), root);
    DatasetConfig dataset = config.getDatasets().get(0);
    assertEquals(1.5, dataset.getIntegratedCharge("PMA0").get("CH01"), 0.);
    assertEquals(2., dataset.getIntegratedCharge("PMA0").get("CH02"), 0.);
    assertTrue(dataset.getIntegratedCharge("PMA1").isEmpty());
  }

  @Test
  public void malformedIntegratedChargeIsDropped() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'basePath': 'data', 'inputs': ["
        + dataset("2023-01-01", "2023-01-01", ", 'integratedCharge': {'PMA0': {'CH01': 'x'}}")
        + ", " + dataset("2022-06-01", "2022-06-01", ", 'integratedCharge': [1, 2]") + "]}"),
        root);
    for (DatasetConfig dataset : config.getDatasets()) {
      assertTrue(dataset.getIntegratedCharge().isEmpty());
    }
  }

  @Test
  public void createsDatasetsFromFiles() throws IOException {
    File data = new File(root, "data/2023-01-01");
    Files.write(new File(data, "PMA0.txt").toPath(), Arrays.asList("bin:a:b", "0:1:1"),
        StandardCharsets.UTF_8);
    Files.write(new File(data, "PMC1.txt").toPath(), Arrays.asList("bin:a:b", "0:1:1"),
        StandardCharsets.UTF_8);
    File configFile = folder.newFile("config.json");
    Files.write(configFile.toPath(), Collections.singletonList(("{'basePath': 'data', "
        + "'inputs': [{'date': '2023-01-01', 'basePath': '2023-01-01', "
        + "'files': {'PMA0': 'PMA0.txt', 'PMC1': ' PMC1.txt'}, "
        + "'refCH': {'PM': 'PMA0', 'CH': [1]}, "
        + "'integratedCharge': {'PMC1': {'CH01': 4.0}}}]}").replace('\'', '"')),
        StandardCharsets.UTF_8);

    List<Dataset> datasets = AnalysisConfig.load(configFile, root).createDatasets();
    assertEquals(1, datasets.size());
    Dataset dataset = datasets.get(0);
    assertEquals("PMA0", dataset.getReferenceModule().getIdentifier());
    assertEquals(Collections.singletonList(1),
        dataset.getReferenceModule().getReferenceChannelNumbers());

    Module other = dataset.getModule("PMC1");
    assertFalse(other.isReference());
    assertTrue(other.getReferenceChannelNumbers().isEmpty());
    assertEquals(4.0, other.getIntegratedCharge("CH01"), 0.);
    assertNull(dataset.getReferenceModule().getIntegratedCharge("CH01"));
  }

  @Test
  public void invalidIdentifierFailsDatasetCreation() throws IOException {
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'inputs': [{'date': '2023-01-01', "
        + "'basePath': 'data/2023-01-01', 'files': {'PMB0': 'PMB0.txt'}, "
        + "'refCH': {'PM': 'PMB0', 'CH': [1]}}]}"), root);
    try {
      config.createDatasets();
      fail("PMB0 is not a module identifier");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("Invalid file identifier 'PMB0'"));
    }
  }

  @Test
  public void missingReferenceModuleFailsDatasetCreation() throws IOException {
    File data = new File(root, "data/2023-01-01");
    Files.write(new File(data, "PMA1.txt").toPath(), Arrays.asList("bin:a:b", "0:1:1"),
        StandardCharsets.UTF_8);
    AnalysisConfig config = AnalysisConfig.fromJson(json("{'inputs': [{'date': '2023-01-01', "
        + "'basePath': 'data/2023-01-01', 'files': {'PMA1': 'PMA1.txt'}, "
        + "'refCH': {'PM': 'PMA0', 'CH': [1]}}]}"), root);
    try {
      config.createDatasets();
      fail("Reference module is not among the files");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("Reference module PMA0 not in files"));
    }
  }

}
