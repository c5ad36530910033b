package fit.ageing.entities;

import fit.ageing.input.InputValidation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A PM module (detector board) as read from one trace file of a dataset. The module knows which
 * of its channels are reference channels from the channel numbers given in the dataset's refCH
 * configuration; these numbers only apply when the module is the dataset's reference module.
 *
 * Modules are immutable. The trace extractor produces a populated copy of a module through
 * {@link #withChannels(List)}, and later stages replace the channel list the same way.
 */
public class Module {

  private final String identifier;
  private final String path;
  private final boolean reference;
  private final List<Integer> referenceChannelNumbers;
  private final Map<String, Double> integratedCharges;
  private final List<Channel> channels;

  /**
   * Create a module with no channels yet
   *
   * @param identifier PM identifier (PMA0-PMA9, PMC0-PMC9)
   * @param path Path of the trace file for the module
   * @param reference True if this module is the dataset's reference module
   * @param referenceChannelNumbers Numbers of reference channels, only used if reference is true
   */
  public Module(String identifier, String path, boolean reference,
      List<Integer> referenceChannelNumbers) {
    this(identifier, path, reference, referenceChannelNumbers,
        Collections.<String, Double>emptyMap(), Collections.<Channel>emptyList());
  }

  /**
   * Create a module with integrated charge values for its channels
   *
   * @param identifier PM identifier (PMA0-PMA9, PMC0-PMC9)
   * @param path Path of the trace file for the module
   * @param reference True if this module is the dataset's reference module
   * @param referenceChannelNumbers Numbers of reference channels, only used if reference is true
   * @param integratedCharges Map from channel names (any capitalization) to integrated charges
   */
  public Module(String identifier, String path, boolean reference,
      List<Integer> referenceChannelNumbers, Map<String, Double> integratedCharges) {
    this(identifier, path, reference, referenceChannelNumbers, integratedCharges,
        Collections.<Channel>emptyList());
  }

  private Module(String identifier, String path, boolean reference,
      List<Integer> referenceChannelNumbers, Map<String, Double> integratedCharges,
      List<Channel> channels) {
    if (!InputValidation.isValidModuleIdentifier(identifier)) {
      throw new IllegalArgumentException("Invalid file identifier '" + identifier
          + "'. Expected format is PMA0-PMA9 or PMC0-PMC9.");
    }
    this.identifier = identifier;
    this.path = path;
    this.reference = reference;
    List<Integer> numbers = new ArrayList<>();
    if (reference && referenceChannelNumbers != null) {
      numbers.addAll(referenceChannelNumbers);
    }
    this.referenceChannelNumbers = Collections.unmodifiableList(numbers);
    Map<String, Double> charges = new LinkedHashMap<>();
    if (integratedCharges != null) {
      for (Map.Entry<String, Double> entry : integratedCharges.entrySet()) {
        charges.put(InputValidation.normalizeChannelName(entry.getKey()), entry.getValue());
      }
    }
    this.integratedCharges = Collections.unmodifiableMap(charges);
    this.channels = Collections.unmodifiableList(new ArrayList<>(channels));
  }

  /**
   * Copy of this module holding the given channels
   *
   * @param newChannels channels, in file column order
   * @return new module
   */
  public Module withChannels(List<Channel> newChannels) {
    return new Module(identifier, path, reference, referenceChannelNumbers, integratedCharges,
        newChannels);
  }

  public String getIdentifier() {
    return identifier;
  }

  public String getPath() {
    return path;
  }

  public boolean isReference() {
    return reference;
  }

  public List<Integer> getReferenceChannelNumbers() {
    return referenceChannelNumbers;
  }

  /**
   * Check whether a channel number is one of this module's reference channels
   *
   * @param channelNumber number of the channel, starting at 1
   * @return true if the module is a reference module and lists this channel
   */
  public boolean isReferenceChannel(int channelNumber) {
    return reference && referenceChannelNumbers.contains(channelNumber);
  }

  /**
   * Get the integrated charge configured for a channel, if there is one
   *
   * @param channelName name of the channel (e.g., "CH01")
   * @return integrated charge, or null if none is configured
   */
  public Double getIntegratedCharge(String channelName) {
    return integratedCharges.get(InputValidation.normalizeChannelName(channelName));
  }

  public List<Channel> getChannels() {
    return channels;
  }

  /**
   * Get the reference channels of this module. The list is derived from the channel list
   * each time this is called.
   *
   * @return reference channels, in column order
   */
  public List<Channel> getReferenceChannels() {
    List<Channel> referenceChannels = new ArrayList<>();
    for (Channel channel : channels) {
      if (channel.isReference()) {
        referenceChannels.add(channel);
      }
    }
    return referenceChannels;
  }

  /**
   * Find a channel by name
   *
   * @param channelName name of the channel (e.g., "CH05")
   * @return the channel, or null if the module has no such channel
   */
  public Channel getChannel(String channelName) {
    for (Channel channel : channels) {
      if (channel.getName().equals(channelName)) {
        return channel;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Module(identifier=" + identifier + ", path=" + path
        + ", is_reference=" + reference + ")";
  }
}
