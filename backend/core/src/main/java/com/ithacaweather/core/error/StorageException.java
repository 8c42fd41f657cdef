package com.ithacaweather.core.error;

public class StorageException extends IllegalStateException {
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public ErrorClass errorClass() {
        return ErrorClass.STORAGE_FAILURE;
    }
}
