package com.vpcrouter.loadbalancer;

import com.vpcrouter.registry.Endpoint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of endpoint selection: an endpoint, or the reason there is none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SelectionResult {

    public enum Status {
        SELECTED,
        NO_HEALTHY_ENDPOINT,
        ALL_CIRCUITS_OPEN
    }

    Status status;
    Endpoint endpoint;
    int candidateCount;

    public static SelectionResult selected(Endpoint endpoint, int candidateCount) {
        return new SelectionResult(Status.SELECTED, endpoint, candidateCount);
    }

    public static SelectionResult noHealthyEndpoint() {
        return new SelectionResult(Status.NO_HEALTHY_ENDPOINT, null, 0);
    }

    public static SelectionResult allCircuitsOpen() {
        return new SelectionResult(Status.ALL_CIRCUITS_OPEN, null, 0);
    }

    public boolean isSelected() {
        return status == Status.SELECTED;
    }
}
