package fit.ageing.stage;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import fit.ageing.input.TraceBlock;
import fit.ageing.test.TestUtils;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class DistributionFitterTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static TraceBlock block(double[] data) {
    return new TraceBlock("test", data);
  }

  private static double[] peak(int length, double center) {
    return TestUtils.peakTrace(length, 0., 10., center, 200.);
  }

  private static Dataset dataset(Channel... channels) {
    Module module = new Module("PMA0", "PMA0.txt", true, Collections.singletonList(1))
        .withChannels(Arrays.asList(channels));
    return new Dataset("2023-01-01", Collections.singletonList(module), "PMA0");
  }

  @Test
  public void fitsSignalWithoutWarnings() {
    Channel channel = new Channel(2, block(peak(343, 100.)), block(new double[257]), false);
    DistributionFitter fitter = new DistributionFitter();
    Dataset result = fitter.runOnDataset(dataset(channel));

    Channel fitted = result.getModule("PMA0").getChannel("CH02");
    assertEquals(100., fitted.getGaussianMean(), 1E-3);
    assertEquals(100., fitted.getWeightedMean(), 1E-3);
    assertEquals(0, fitter.getWarningCount());
    assertEquals(Integer.valueOf(0), fitter.getWarningCounts().get("PMA0"));
  }

  @Test
  public void zeroSignalFallsBackToNoise() {
    Channel channel = new Channel(2, block(new double[343]), block(peak(257, 128.)), false);
    DistributionFitter fitter = new DistributionFitter();
    Channel fitted = fitter.runOnDataset(dataset(channel)).getModule("PMA0").getChannel("CH02");
    assertEquals(128., fitted.getGaussianMean(), 1E-3);
    assertEquals(128., fitted.getWeightedMean(), 1E-3);
    assertEquals(1, fitter.getWarningCount());
  }

  @Test
  public void zeroSignalAndNoiseGiveZeroMeans() {
    Channel empty = new Channel(2, block(new double[343]), block(new double[257]), false);
    Channel reference = new Channel(1, block(new double[100]), null, true);
    DistributionFitter fitter = new DistributionFitter();
    Module module = fitter.runOnDataset(dataset(reference, empty)).getModule("PMA0");
    for (Channel channel : module.getChannels()) {
      assertEquals(0., channel.getGaussianMean(), 0.);
      assertEquals(0., channel.getWeightedMean(), 0.);
    }
    assertEquals(2, fitter.getWarningCount());
  }

  @Test
  public void warningCountsAreKeptPerRun() {
    DistributionFitter fitter = new DistributionFitter();
    fitter.runOnDataset(dataset(
        new Channel(2, block(new double[343]), block(new double[257]), false)));
    Map<String, Integer> firstRun = fitter.getWarningCounts();
    assertEquals(Integer.valueOf(1), firstRun.get("PMA0"));

    Module other = new Module("PMC1", "PMC1.txt", false, null).withChannels(
        Collections.singletonList(
            new Channel(1, block(peak(343, 100.)), block(new double[257]), false)));
    fitter.runOnDataset(new Dataset("2023-06-01", Arrays.asList(
        dataset().getModule("PMA0"), other), "PMA0"));

    assertEquals(1, firstRun.size());
    assertEquals(Integer.valueOf(1), firstRun.get("PMA0"));
    assertEquals(Integer.valueOf(0), fitter.getWarningCounts().get("PMC1"));
    try {
      fitter.getWarningCounts().put("PMA0", 5);
      fail("Warning counts should not be modifiable");
    } catch (UnsupportedOperationException e) {
      assertEquals(Integer.valueOf(0), fitter.getWarningCounts().get("PMA0"));
    }
  }

  @Test
  public void debugPlotsAreWritten() throws IOException {
    File plots = folder.newFolder("plots");
    Channel channel = new Channel(3, block(peak(343, 100.)), block(new double[257]), false);
    new DistributionFitter(plots).runOnDataset(dataset(channel));
    assertTrue(new File(plots, "gaussian_fit/2023-01-01/PMA0/CH03_gaussian_fit.png").exists());
  }

}
