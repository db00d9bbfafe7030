package fr.lapetina.mesh.infrastructure.resilience;

import fr.lapetina.mesh.domain.exception.GatewayTimeoutException;
import fr.lapetina.mesh.domain.exception.UpstreamStatusException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures to the codes used in {@link RetryPolicy#retryableErrors()}.
 */
public final class FailureClassifier {

    private FailureClassifier() {
        // Utility class
    }

    public static String classify(Throwable throwable) {
        Throwable failure = unwrap(throwable);
        if (failure instanceof UpstreamStatusException) {
            return String.valueOf(((UpstreamStatusException) failure).getStatusCode());
        }
        if (failure instanceof HttpConnectTimeoutException) {
            return "ETIMEDOUT";
        }
        if (failure instanceof GatewayTimeoutException
                || failure instanceof TimeoutException
                || failure instanceof HttpTimeoutException) {
            return "TIMEOUT";
        }
        if (failure instanceof ConnectException) {
            return "ECONNREFUSED";
        }
        if (failure instanceof UnknownHostException) {
            return "ENOTFOUND";
        }
        if (failure instanceof NoRouteToHostException) {
            return "ENETUNREACH";
        }
        if (failure instanceof IOException) {
            return "NETWORK_ERROR";
        }
        return failure.getClass().getSimpleName();
    }

    public static boolean isTimeout(Throwable throwable) {
        return "TIMEOUT".equals(classify(throwable));
    }

    /**
     * Strips the wrappers added by {@code CompletableFuture}.
     */
    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
