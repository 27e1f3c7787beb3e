package com.brixo.connecthub.session.exception;

import com.brixo.connecthub.session.model.CommandResult;
import com.brixo.connecthub.session.model.ErrorKind;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** Conversión de fallos asíncronos a errores tipados. */
public final class SessionErrors {

    private SessionErrors() {
    }

    /** Quita los envoltorios de CompletableFuture. */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public static SessionException asSessionException(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof SessionException sessionError) {
            return sessionError;
        }
        if (cause instanceof TimeoutException) {
            return new SessionException(ErrorKind.TIMEOUT, "Tiempo de espera agotado", cause);
        }
        return new SessionException(ErrorKind.INVALID_STATE,
                cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    public static CommandResult toResult(Throwable error) {
        SessionException e = asSessionException(error);
        return CommandResult.failure(e.getKind(), e.getMessage());
    }
}
