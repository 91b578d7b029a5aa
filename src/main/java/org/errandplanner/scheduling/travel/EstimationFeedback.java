package org.errandplanner.scheduling.travel;

/**
 * External estimation collaborator that learns from completed errands.
 *
 * <p>Feedback never alters past schedules; it only shifts future estimation inputs.</p>
 */
public interface EstimationFeedback {

    void recordCompletion(String instanceId, int actualDurationMinutes, int actualTravelMinutes);

    void recordActual(String instanceId, ActualTimeField field, int valueMinutes);

    /**
     * Feedback sink that drops everything.
     */
    static EstimationFeedback discarding() {
        return new EstimationFeedback() {
            @Override
            public void recordCompletion(String instanceId, int actualDurationMinutes, int actualTravelMinutes) {
            }

            @Override
            public void recordActual(String instanceId, ActualTimeField field, int valueMinutes) {
            }
        };
    }
}
