package io.memoryrunr.formation;

/**
 * Receives formation outcomes. Called synchronously on the forming thread.
 */
@FunctionalInterface
public interface FormationListener {

    void onFormation(FormationEvent event);
}
