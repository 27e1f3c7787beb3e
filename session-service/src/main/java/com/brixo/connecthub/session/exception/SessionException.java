package com.brixo.connecthub.session.exception;

import com.brixo.connecthub.session.model.ErrorKind;

/**
 * Error tipado de una operación de sesión. El gestor lo convierte en
 * {@link com.brixo.connecthub.session.model.CommandResult} para el consumidor.
 */
public class SessionException extends RuntimeException {

    private final ErrorKind kind;

    public SessionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SessionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
