package com.brixo.connecthub.session.model;

/** Resultado de una orden: éxito o un error tipado. */
public record CommandResult(
        boolean success,
        ErrorKind error,
        String message) {

    public static CommandResult ok() {
        return new CommandResult(true, null, null);
    }

    public static CommandResult failure(ErrorKind error, String message) {
        return new CommandResult(false, error, message);
    }
}
