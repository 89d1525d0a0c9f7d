package org.tessera.mosaic;

/**
 * Thrown by {@link MosaicRun#run()} when a matcher thread failed.
 * <p>
 * The partial canvas has already been handed to the sink when this is thrown; the cause is
 * the first failure any worker reported.
 */
public class WorkerFaultException extends RuntimeException {

    public WorkerFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
