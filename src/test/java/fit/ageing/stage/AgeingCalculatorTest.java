package fit.ageing.stage;

import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import fit.ageing.entities.AgeingFactor;
import fit.ageing.entities.Channel;
import fit.ageing.entities.Dataset;
import fit.ageing.entities.Module;
import fit.ageing.input.TraceBlock;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class AgeingCalculatorTest {

  private static final TraceBlock BLOCK = new TraceBlock("chan", new double[]{1., 2., 1.});

  private static Dataset dataset(double referenceGaussian, double referenceWeighted,
      Channel... channels) {
    Module module = new Module("PMA0", "PMA0.txt", true, Collections.singletonList(1))
        .withChannels(Arrays.asList(channels));
    return new Dataset("2023-01-01", Collections.singletonList(module), "PMA0")
        .withReferenceMeans(referenceGaussian, referenceWeighted);
  }

  @Test
  public void dividesByReferenceMeans() {
    Channel reference = new Channel(1, BLOCK, null, true).withMeans(10., 20.);
    Channel plain = new Channel(2, BLOCK, BLOCK, false).withMeans(12., 30.);
    Module module = new AgeingCalculator()
        .runOnDataset(dataset(10., 20., reference, plain)).getModule("PMA0");

    assertEquals(AgeingFactor.of(1.), module.getChannel("CH01").getGaussianAgeingFactor());
    assertEquals(AgeingFactor.of(1.), module.getChannel("CH01").getWeightedAgeingFactor());
    assertEquals(1.2, module.getChannel("CH02").getGaussianAgeingFactor().getValue(), 1E-12);
    assertEquals(1.5, module.getChannel("CH02").getWeightedAgeingFactor().getValue(), 1E-12);
  }

  @Test
  public void nanMeansGiveUnavailableFactors() {
    Channel channel = new Channel(2, BLOCK, BLOCK, false).withMeans(Double.NaN, 4.);
    Channel result = new AgeingCalculator().runOnDataset(dataset(2., 2., channel))
        .getModule("PMA0").getChannel("CH02");
    assertFalse(result.getGaussianAgeingFactor().isAvailable());
    assertEquals(AgeingFactor.of(2.), result.getWeightedAgeingFactor());
  }

  @Test
  public void zeroReferenceMeanFails() {
    Channel channel = new Channel(2, BLOCK, BLOCK, false).withMeans(1., 1.);
    try {
      new AgeingCalculator().runOnDataset(dataset(0., 5., channel));
      fail("Zero reference mean cannot be divided by");
    } catch (ArithmeticException e) {
      assertThat(e.getMessage(), containsString("Reference mean is zero for dataset 2023-01-01"));
    }
  }

}
