package fit.ageing.stage;

import fit.ageing.entities.Dataset;
import javax.swing.event.ChangeEvent;
import javax.swing.event.ChangeListener;
import javax.swing.event.EventListenerList;

/**
 * Template for the steps run on each dataset of an analysis. Concrete stages implement
 * {@link #backend(Dataset)}, which takes a dataset as left by the previous stage and returns a
 * new dataset with this stage's results filled in; datasets are never modified in place.
 *
 * Stages report what they are working on through status messages. A host UI (or the pipeline's
 * progress callback) registers a ChangeListener and reads {@link #getStatus()} when notified.
 */
public abstract class AnalysisStage {

  private final EventListenerList eventHelper;
  private String status;

  AnalysisStage() {
    status = "";
    eventHelper = new EventListenerList();
  }

  /**
   * Add an object to the list of objects to be notified when the stage's status changes
   *
   * @param listener ChangeListener to be notified (i.e., pipeline or progress window)
   */
  public void addChangeListener(ChangeListener listener) {
    eventHelper.add(ChangeListener.class, listener);
  }

  public void removeChangeListener(ChangeListener listener) {
    eventHelper.remove(ChangeListener.class, listener);
  }

  /**
   * Set the status message and notify listeners of the change
   *
   * @param newStatus New status message
   */
  protected void fireStateChange(String newStatus) {
    status = newStatus;
    ChangeListener[] listeners = eventHelper.getListeners(ChangeListener.class);
    if (listeners != null && listeners.length > 0) {
      ChangeEvent event = new ChangeEvent(this);
      for (ChangeListener listener : listeners) {
        listener.stateChanged(event);
      }
    }
  }

  /**
   * Return newest status message produced by this stage
   *
   * @return String representing status of the stage
   */
  public String getStatus() {
    return status;
  }

  /**
   * Short human-readable name of the stage, used in status messages
   *
   * @return stage name
   */
  public abstract String getName();

  /**
   * Run the calculations of this stage on a dataset
   *
   * @param dataset Dataset as produced by the previous stage
   * @return Copy of the dataset with this stage's results
   */
  protected abstract Dataset backend(final Dataset dataset);

  /**
   * Driver for a stage: reports the start and the end of the work around the concrete backend
   *
   * @param dataset Dataset to process
   * @return processed copy of the dataset
   */
  public Dataset runOnDataset(final Dataset dataset) {
    fireStateChange("Beginning " + getName() + " for dataset " + dataset.getDate() + "...");
    Dataset result = backend(dataset);
    fireStateChange(getName() + " done for dataset " + dataset.getDate());
    return result;
  }

}
