package fit.ageing.entities;

import static fit.ageing.test.TestUtils.channel;
import static org.hamcrest.CoreMatchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import fit.ageing.input.TraceBlock;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class ModuleTest {

  @Test
  public void identifierIsValidated() {
    try {
      new Module("PMX1", "PMX1.txt", false, null);
      fail("PMX1 is not a module identifier");
    } catch (IllegalArgumentException e) {
      assertThat(e.getMessage(), containsString("Expected format is PMA0-PMA9 or PMC0-PMC9"));
    }
  }

  @Test
  public void referenceChannelsOnlyApplyToReferenceModule() {
    Module reference = new Module("PMA0", "PMA0.txt", true, Arrays.asList(1, 3));
    assertTrue(reference.isReferenceChannel(3));
    assertFalse(reference.isReferenceChannel(2));

    Module other = new Module("PMA1", "PMA1.txt", false, Arrays.asList(1, 3));
    assertFalse(other.isReferenceChannel(1));
    assertTrue(other.getReferenceChannelNumbers().isEmpty());
  }

  @Test
  public void referenceChannelsAreDerivedFromChannels() {
    TraceBlock block = new TraceBlock("ref", new double[]{1., 2.});
    Channel first = new Channel(1, block, null, true);
    Channel second = channel(2, 1., 2.);
    Channel third = new Channel(3, block, null, true);
    Module module = new Module("PMA0", "PMA0.txt", true, Arrays.asList(1, 3))
        .withChannels(Arrays.asList(first, second, third));

    List<Channel> references = module.getReferenceChannels();
    assertEquals(2, references.size());
    assertSame(first, references.get(0));
    assertSame(third, references.get(1));
    assertSame(second, module.getChannel("CH02"));
    assertNull(module.getChannel("CH04"));
  }

  @Test
  public void integratedChargeLookupIsNormalized() {
    Map<String, Double> charges = new HashMap<>();
    charges.put("ch1", 1.5);
    Module module = new Module("PMC2", "PMC2.txt", false, null, charges);
    assertEquals(1.5, module.getIntegratedCharge("CH01"), 0.);
    assertEquals(1.5, module.getIntegratedCharge("Ch01"), 0.);
    assertNull(module.getIntegratedCharge("CH02"));
  }

  @Test
  public void withChannelsLeavesOriginalEmpty() {
    Module module = new Module("PMA0", "PMA0.txt", false, Collections.<Integer>emptyList());
    Module filled = module.withChannels(Collections.singletonList(channel(1, 1.)));
    assertTrue(module.getChannels().isEmpty());
    assertEquals(1, filled.getChannels().size());
    assertEquals("Module(identifier=PMA0, path=PMA0.txt, is_reference=false)",
        filled.toString());
  }

}
