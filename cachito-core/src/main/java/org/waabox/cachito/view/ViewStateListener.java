package org.waabox.cachito.view;

/**
 * A listener that is notified on every state transition of a view model.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ViewStateListener {

  /**
   * Called synchronously after the view model has applied a transition.
   * The view model's accessors already reflect the new state.
   *
   * @param state the state just entered, never null
   */
  void onStateChanged(ViewState state);
}
