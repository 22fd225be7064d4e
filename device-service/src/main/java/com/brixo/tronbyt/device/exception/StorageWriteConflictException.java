package com.brixo.tronbyt.device.exception;

/**
 * La actualización atómica de campos no pudo confirmarse (conflicto de
 * escritura concurrente o ruta de campo inexistente en el documento).
 */
public class StorageWriteConflictException extends RuntimeException {

    public StorageWriteConflictException(String message) {
        super(message);
    }

    public StorageWriteConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
