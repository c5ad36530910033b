package fit.ageing.utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class PeakFinderTest {

  @Test
  public void findsPeaksWithBasesAndProminence() {
    List<Peak> peaks = PeakFinder.findPeaks(new double[]{0., 2., 1., 3., 0.});
    assertEquals(2, peaks.size());

    Peak first = peaks.get(0);
    assertEquals(new Peak(1, 0, 2, 1.), first);
    assertEquals(1., first.getProminence(), 0.);

    Peak second = peaks.get(1);
    assertEquals(new Peak(3, 0, 4, 3.), second);
    assertEquals(3., second.getProminence(), 0.);
  }

  @Test
  public void prominenceThresholdIsInclusive() {
    double[] trace = {0., 2., 1., 3., 0.};
    assertEquals(1, PeakFinder.findPeaks(trace, 2.).size());
    assertEquals(3, PeakFinder.findPeaks(trace, 3.).get(0).getPosition());
    assertEquals(2, PeakFinder.findPeaks(trace, 1.).size());
    assertTrue(PeakFinder.findPeaks(trace, 3.5).isEmpty());
  }

  @Test
  public void plateauPeakIsAtItsMiddle() {
    assertEquals(Collections.singletonList(2),
        PeakFinder.localMaxima(new double[]{0., 1., 1., 1., 0.}));
    // a plateau that keeps rising is not a peak
    assertEquals(Collections.singletonList(3),
        PeakFinder.localMaxima(new double[]{0., 1., 1., 2., 0.}));
  }

  @Test
  public void edgesAreNeverPeaks() {
    assertTrue(PeakFinder.findPeaks(new double[]{5., 1., 0.}).isEmpty());
    assertTrue(PeakFinder.findPeaks(new double[]{0., 1., 5.}).isEmpty());
    assertTrue(PeakFinder.findPeaks(new double[]{1.}).isEmpty());
  }

  @Test
  public void closePeaksAreMerged() {
    List<Peak> peaks = Arrays.asList(new Peak(10, 5, 20, 4.), new Peak(12, 7, 22, 6.));
    List<Peak> merged = PeakFinder.mergePeaks(peaks, 5);
    assertEquals(1, merged.size());
    assertEquals(new Peak(11, 6, 21, 6.), merged.get(0));
    assertEquals(6., merged.get(0).getProminence(), 0.);
    // input untouched
    assertEquals(2, peaks.size());
  }

  @Test
  public void mergeThresholdIsExclusive() {
    List<Peak> peaks = Arrays.asList(new Peak(10, 5, 20, 1.), new Peak(15, 10, 25, 1.));
    assertEquals(2, PeakFinder.mergePeaks(peaks, 5).size());
    assertEquals(1, PeakFinder.mergePeaks(peaks, 6).size());
  }

  @Test
  public void bothBasesMustBeClose() {
    List<Peak> peaks = Arrays.asList(new Peak(10, 5, 20, 1.), new Peak(30, 6, 40, 1.));
    assertEquals(2, PeakFinder.mergePeaks(peaks, 5).size());
  }

  @Test
  public void mergedPeakIsComparedWithTheNext() {
    List<Peak> peaks = new ArrayList<>();
    peaks.add(new Peak(10, 4, 20, 1.));
    peaks.add(new Peak(12, 6, 22, 1.));
    peaks.add(new Peak(14, 8, 24, 1.));
    peaks.add(new Peak(100, 80, 120, 1.));
    List<Peak> merged = PeakFinder.mergePeaks(peaks, 4);
    // (10,4,20)+(12,6,22) -> (11,5,21), then +(14,8,24) -> (12,6,22)
    assertEquals(2, merged.size());
    assertEquals(new Peak(12, 6, 22, 1.), merged.get(0));
    assertEquals(new Peak(100, 80, 120, 1.), merged.get(1));
  }

}
