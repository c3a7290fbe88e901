package io.memoryrunr.formation;

@FunctionalInterface
public interface FormationStatusListener {

    void onStatus(FormationStatus status);
}
