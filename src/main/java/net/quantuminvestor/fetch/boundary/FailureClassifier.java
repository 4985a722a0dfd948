package net.quantuminvestor.fetch.boundary;

import net.quantuminvestor.fetch.ClassifiedFailure;

/**
 * Classifies exceptions into structured failures.
 * Implementations must be pure: no side effects, same input gives the same kind.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * Classifies an exception into a ClassifiedFailure.
     *
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return A classified failure; {@code ALREADY_EXISTS} marks a benign duplicate
     */
    ClassifiedFailure classify(String operation, Throwable throwable);
}
